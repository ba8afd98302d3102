package uk.ac.ebi.orthoviewer.ortholog_service.status;

import java.util.List;

/**
 * Snapshot of what the engine has loaded.
 *
 * @param tableLoaded whether the orthogroup table is loaded
 * @param orthogroupCount number of orthogroup rows
 * @param speciesCount number of species columns
 * @param indexedGenes number of genes in the gene index
 * @param geneConflicts genes found in more than one orthogroup
 * @param skippedRows malformed table rows skipped while loading
 * @param speciesMappingLoaded whether the species mapping is built
 * @param treeLoaded whether the species tree is loaded
 * @param treeDegraded whether the fallback tree is in use
 * @param leafCount number of tree leaves
 * @param unboundLeaves tree leaves without a table column
 */
public record EngineStatus(
    boolean tableLoaded,
    int orthogroupCount,
    int speciesCount,
    int indexedGenes,
    int geneConflicts,
    int skippedRows,
    boolean speciesMappingLoaded,
    boolean treeLoaded,
    boolean treeDegraded,
    int leafCount,
    List<String> unboundLeaves) {}
