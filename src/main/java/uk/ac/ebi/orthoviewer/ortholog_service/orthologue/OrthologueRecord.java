package uk.ac.ebi.orthoviewer.ortholog_service.orthologue;

/** A gene sharing an orthogroup with the queried gene. */
public record OrthologueRecord(
    String geneId, String speciesId, String speciesName, String orthogroupId) {}
