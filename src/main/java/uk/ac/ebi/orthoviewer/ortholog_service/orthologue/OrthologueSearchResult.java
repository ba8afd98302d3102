package uk.ac.ebi.orthoviewer.ortholog_service.orthologue;

import java.util.List;

/**
 * Outcome of an orthologue search.
 *
 * @param success false when the gene belongs to no orthogroup
 * @param geneId the queried gene, trimmed
 * @param orthogroupId orthogroup of the gene, or null on a miss
 * @param orthologues every other gene of the orthogroup
 * @param countsBySpecies one entry per species column of the table, zero counts included
 * @param newickTree species tree for rendering, or null on a miss
 * @param message explanation of a miss, or null
 */
public record OrthologueSearchResult(
    boolean success,
    String geneId,
    String orthogroupId,
    List<OrthologueRecord> orthologues,
    List<SpeciesCount> countsBySpecies,
    String newickTree,
    String message) {

  public static OrthologueSearchResult notFound(String geneId) {
    return new OrthologueSearchResult(
        false,
        geneId,
        null,
        List.of(),
        List.of(),
        null,
        "gene " + geneId + " not found in any orthogroup");
  }
}
