package uk.ac.ebi.orthoviewer.ortholog_service.status;

import uk.ac.ebi.orthoviewer.ortholog_service.species.NameSource;

/** A species column of the orthogroup table with its resolved name and total gene count. */
public record SpeciesSummary(String code, String name, NameSource source, int geneCount) {}
