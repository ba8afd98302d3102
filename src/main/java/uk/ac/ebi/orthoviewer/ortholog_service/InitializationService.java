package uk.ac.ebi.orthoviewer.ortholog_service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import uk.ac.ebi.orthoviewer.ortholog_service.config.OrthoDataConfig;
import uk.ac.ebi.orthoviewer.ortholog_service.status.DataReloadService;
import uk.ac.ebi.orthoviewer.ortholog_service.status.EngineStatus;

/**
 * Service responsible for loading the orthology data once the application has started.
 *
 * <p>Listens for the {@link ApplicationReadyEvent} and loads, in order, the orthogroup table with
 * its gene index, the species mapping, and the bound species tree, so that the first request does
 * not pay for parsing. A failure is logged and the application keeps running; the next query
 * retries the load and reports the data as unavailable if it fails again.
 */
@Slf4j
@Service
public class InitializationService {

  private final OrthoDataConfig config;
  private final DataReloadService dataReloadService;

  public InitializationService(OrthoDataConfig config, DataReloadService dataReloadService) {
    this.config = config;
    this.dataReloadService = dataReloadService;
  }

  @EventListener(ApplicationReadyEvent.class)
  public void initialize() {
    if (!config.isWarmUpOnStartup()) {
      log.info("Warm-up disabled, data will be loaded on first request");
      return;
    }
    log.debug("Application initialization started");
    try {
      dataReloadService.ensureAllLoaded();
      EngineStatus status = dataReloadService.status();
      log.info(
          "Application initialization completed: {} orthogroups, {} species, {} tree leaves{}",
          status.orthogroupCount(),
          status.speciesCount(),
          status.leafCount(),
          status.treeDegraded() ? " (DEGRADED tree)" : "");
    } catch (Exception e) {
      log.error("Application initialization failed", e);
    }
  }
}
