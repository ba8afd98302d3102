package uk.ac.ebi.orthoviewer.ortholog_service.species;

import java.util.List;
import java.util.Map;

/**
 * Coverage of the orthogroup table's species codes by the metadata table.
 *
 * @param tableSpecies number of species columns in the orthogroup table
 * @param metadataEntries number of codes in the metadata table
 * @param mappedCount table codes found in metadata
 * @param missingCount table codes absent from metadata
 * @param missingExamples first missing codes, sorted
 * @param sources how each table code is named
 */
public record SpeciesMappingReport(
    int tableSpecies,
    int metadataEntries,
    int mappedCount,
    int missingCount,
    List<String> missingExamples,
    Map<String, NameSource> sources) {}
