package uk.ac.ebi.orthoviewer.ortholog_service.species;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.ac.ebi.orthoviewer.ortholog_service.Constants;
import uk.ac.ebi.orthoviewer.ortholog_service.orthogroup.OrthogroupRepository;

/**
 * Resolves species codes to human-readable names; every call succeeds.
 *
 * <p>On first access the metadata table is loaded and enhanced with names for every species
 * column of the orthogroup table. The result is held until {@link #reload()}.
 */
@Slf4j
@Service
public class SpeciesResolver {

  private final SpeciesMetadataLoader loader;
  private final OrthogroupRepository orthogroupRepository;

  private volatile SpeciesMapping mapping;

  public SpeciesResolver(SpeciesMetadataLoader loader, OrthogroupRepository orthogroupRepository) {
    this.loader = loader;
    this.orthogroupRepository = orthogroupRepository;
  }

  public void ensureLoaded() {
    current();
  }

  /** Reads the metadata table again and rebuilds the enhanced mapping. */
  public synchronized void reload() {
    log.info("Reloading species mapping");
    mapping = build();
  }

  public boolean isLoaded() {
    return mapping != null;
  }

  private SpeciesMapping current() {
    SpeciesMapping m = mapping;
    if (m == null) {
      synchronized (this) {
        m = mapping;
        if (m == null) {
          m = build();
          mapping = m;
        }
      }
    }
    return m;
  }

  private SpeciesMapping build() {
    List<String> tableCodes = orthogroupRepository.getAllSpeciesCodes();
    SpeciesMapping enhanced = loader.load().enhance(tableCodes);
    log.info(
        "Species mapping ready: {} metadata entries, {} synthesized names",
        enhanced.getCodeToName().size(),
        enhanced.getEnhanced().size());
    return enhanced;
  }

  /**
   * Resolves a species code.
   *
   * @param code any string
   * @return the identity, with a non-empty name
   */
  public SpeciesIdentity resolve(String code) {
    return current().resolve(code);
  }

  /** Shorthand for the resolved name of a code. */
  public String resolveName(String code) {
    return resolve(code).canonicalName();
  }

  /** The current mapping. */
  public SpeciesMapping getMapping() {
    return current();
  }

  /** Describes how well the metadata covers the species columns of the orthogroup table. */
  public SpeciesMappingReport report() {
    SpeciesMapping m = current();
    List<String> tableCodes = orthogroupRepository.getAllSpeciesCodes();
    Map<String, NameSource> sources = new LinkedHashMap<>();
    tableCodes.forEach(code -> sources.put(code, m.resolve(code).source()));

    List<String> missing =
        tableCodes.stream().filter(code -> !m.getCodeToName().containsKey(code)).sorted().toList();
    return new SpeciesMappingReport(
        tableCodes.size(),
        m.getCodeToName().size(),
        tableCodes.size() - missing.size(),
        missing.size(),
        missing.stream().limit(Constants.MAPPING_REPORT_EXAMPLES).toList(),
        sources);
  }
}
