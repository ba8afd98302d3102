package uk.ac.ebi.orthoviewer.ortholog_service.rest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import uk.ac.ebi.orthoviewer.ortholog_service.species.SpeciesMappingReport;
import uk.ac.ebi.orthoviewer.ortholog_service.species.SpeciesResolver;
import uk.ac.ebi.orthoviewer.ortholog_service.status.DataReloadService;
import uk.ac.ebi.orthoviewer.ortholog_service.status.EngineStatus;

/**
 * Maintenance endpoints: data reload and species mapping diagnostics.
 *
 * <p><b>Security:</b> unsecured; expose only on an internal network.
 */
@Slf4j
@RestController
@RequestMapping("/internal/api")
@Tag(name = "Maintenance", description = "Reload source files and inspect the species mapping.")
public class InternalController {

  private final DataReloadService dataReloadService;
  private final SpeciesResolver speciesResolver;

  public InternalController(DataReloadService dataReloadService, SpeciesResolver speciesResolver) {
    this.dataReloadService = dataReloadService;
    this.speciesResolver = speciesResolver;
  }

  @PostMapping("/reload")
  @Operation(
      summary = "Reload all data",
      description =
          """
          Reads the orthogroup table, species metadata and species tree again. Queries running
          during the reload finish on the previous data.""")
  public ResponseEntity<RestResponse<EngineStatus>> reload() {
    log.info("Reload requested");
    return ResponseEntity.ok(RestResponse.success("Data reloaded", dataReloadService.reloadAll()));
  }

  @GetMapping("/species-mapping")
  @Operation(summary = "How well the species metadata covers the orthogroup table")
  public ResponseEntity<RestResponse<SpeciesMappingReport>> speciesMapping() {
    SpeciesMappingReport report = speciesResolver.report();
    String message =
        String.format(
            "%d of %d species mapped from metadata", report.mappedCount(), report.tableSpecies());
    return ResponseEntity.ok(RestResponse.success(message, report));
  }
}
