package uk.ac.ebi.orthoviewer.ortholog_service.orthogroup;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;

/**
 * Gene identifier to orthogroup identifier lookup derived from an {@link OrthogroupTable}.
 *
 * <p>A gene appearing in more than one orthogroup is a data-quality problem of the source. The row
 * processed last wins; every such conflict is logged and counted. The map is concurrent because a
 * successful fallback scan adds the discovered mapping while other threads read.
 */
@Slf4j
public class GeneIndex {

  private final Map<String, String> geneToOrthogroup;
  private final AtomicInteger conflictCount = new AtomicInteger();

  private GeneIndex(int expectedSize) {
    this.geneToOrthogroup = new ConcurrentHashMap<>(Math.max(16, expectedSize));
  }

  /**
   * Builds the index from every non-empty species cell of every row.
   *
   * @param table the loaded table
   * @return the index
   */
  public static GeneIndex build(OrthogroupTable table) {
    int mentions = table.getSpeciesGeneTotals().values().stream().mapToInt(Integer::intValue).sum();
    GeneIndex index = new GeneIndex(mentions);
    for (OrthogroupRow row : table.getRows()) {
      for (var genes : row.perSpecies().values()) {
        for (String gene : genes) {
          index.register(gene, row.orthogroupId());
        }
      }
    }
    log.info(
        "Gene index built: {} genes from {} mentions, {} conflicts",
        index.size(),
        mentions,
        index.getConflictCount());
    return index;
  }

  private void register(String geneId, String orthogroupId) {
    String previous = geneToOrthogroup.put(geneId, orthogroupId);
    if (previous != null && !previous.equals(orthogroupId)) {
      conflictCount.incrementAndGet();
      log.warn(
          "Gene {} found in orthogroups {} and {}; keeping {}",
          geneId,
          previous,
          orthogroupId,
          orthogroupId);
    }
  }

  public Optional<String> lookup(String geneId) {
    return Optional.ofNullable(geneToOrthogroup.get(geneId));
  }

  /** Adds a mapping found outside the index. An existing mapping is never replaced. */
  public void remember(String geneId, String orthogroupId) {
    geneToOrthogroup.putIfAbsent(geneId, orthogroupId);
  }

  public int size() {
    return geneToOrthogroup.size();
  }

  public int getConflictCount() {
    return conflictCount.get();
  }
}
