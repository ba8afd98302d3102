package uk.ac.ebi.orthoviewer.ortholog_service.orthologue;

/** Number of genes a species contributes to an orthogroup; 0 for species without genes. */
public record SpeciesCount(String speciesId, String speciesName, int count) {}
