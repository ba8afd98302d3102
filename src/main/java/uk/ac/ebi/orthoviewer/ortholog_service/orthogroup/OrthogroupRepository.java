package uk.ac.ebi.orthoviewer.ortholog_service.orthogroup;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Owns the loaded {@link OrthogroupTable} and its {@link GeneIndex} and answers gene and orthogroup
 * lookups over them.
 *
 * <p><strong>Thread Safety:</strong> the table and index are loaded at most once, on first access,
 * behind double-checked locking. {@link #reload()} builds a new snapshot and publishes it
 * atomically; readers keep the snapshot they started with.
 */
@Slf4j
@Service
public class OrthogroupRepository {

  private final OrthogroupTableLoader loader;
  private final Function<OrthogroupTable, GeneIndex> indexBuilder;

  private volatile Snapshot snapshot;

  @Autowired
  public OrthogroupRepository(OrthogroupTableLoader loader) {
    this(loader, GeneIndex::build);
  }

  OrthogroupRepository(
      OrthogroupTableLoader loader, Function<OrthogroupTable, GeneIndex> indexBuilder) {
    this.loader = loader;
    this.indexBuilder = indexBuilder;
  }

  /**
   * Loads the table and builds the gene index unless already done.
   *
   * @throws uk.ac.ebi.orthoviewer.ortholog_service.exceptions.DataNotFoundException if the table
   *     file is missing
   */
  public void ensureLoaded() {
    current();
  }

  /** Discards the current table and index and loads them again from the source file. */
  public synchronized void reload() {
    log.info("Reloading orthogroup table");
    snapshot = build();
  }

  public boolean isLoaded() {
    return snapshot != null;
  }

  private Snapshot current() {
    Snapshot s = snapshot;
    if (s == null) {
      synchronized (this) {
        s = snapshot;
        if (s == null) {
          s = build();
          snapshot = s;
        }
      }
    }
    return s;
  }

  private Snapshot build() {
    OrthogroupTable table = loader.load();
    return new Snapshot(table, indexBuilder.apply(table));
  }

  /**
   * Finds the orthogroup containing a gene.
   *
   * <p>Uses the gene index first. On a miss every cell of the table is scanned; a gene found that
   * way is added to the index so the next lookup is direct.
   *
   * @param geneId gene identifier, compared exactly after trimming
   * @return the orthogroup id, or empty if no row contains the gene
   */
  public Optional<String> findGeneOrthogroup(String geneId) {
    if (geneId == null || geneId.isBlank()) {
      return Optional.empty();
    }
    String gene = geneId.trim();
    Snapshot s = current();
    Optional<String> indexed = s.geneIndex().lookup(gene);
    if (indexed.isPresent()) {
      log.debug("Gene {} found in orthogroup {} using the index", gene, indexed.get());
      return indexed;
    }

    log.debug("Gene {} not in the index, scanning the table", gene);
    for (OrthogroupRow row : s.table().getRows()) {
      for (List<String> genes : row.perSpecies().values()) {
        if (genes.contains(gene)) {
          s.geneIndex().remember(gene, row.orthogroupId());
          log.debug("Gene {} found in orthogroup {} by table scan", gene, row.orthogroupId());
          return Optional.of(row.orthogroupId());
        }
      }
    }
    log.debug("Gene {} not found in any orthogroup", gene);
    return Optional.empty();
  }

  /**
   * Returns the genes of an orthogroup by species, omitting species with an empty cell.
   *
   * @param orthogroupId orthogroup identifier
   * @return species code to genes, in table column order; empty map for an unknown id
   */
  public Map<String, List<String>> getOrthogroupGenes(String orthogroupId) {
    if (orthogroupId == null) {
      return Map.of();
    }
    return current()
        .table()
        .findRow(orthogroupId.trim())
        .map(OrthogroupRow::nonEmptySpecies)
        .orElse(Map.of());
  }

  /** Every species column of the table, in table order, including species without any gene. */
  public List<String> getAllSpeciesCodes() {
    return current().table().getSpeciesCodes();
  }

  /** The loaded table. */
  public OrthogroupTable getTable() {
    return current().table();
  }

  /** The gene index built over the loaded table. */
  public GeneIndex getGeneIndex() {
    return current().geneIndex();
  }

  private record Snapshot(OrthogroupTable table, GeneIndex geneIndex) {}
}
