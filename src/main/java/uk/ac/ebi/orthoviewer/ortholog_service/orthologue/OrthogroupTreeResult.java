package uk.ac.ebi.orthoviewer.ortholog_service.orthologue;

import java.util.List;

/**
 * Species tree of an orthogroup, with the species to highlight.
 *
 * @param orthogroupId the orthogroup
 * @param newick species tree text
 * @param speciesWithGenes codes of species with at least one gene in the orthogroup
 */
public record OrthogroupTreeResult(
    String orthogroupId, String newick, List<String> speciesWithGenes) {}
