package uk.ac.ebi.orthoviewer.ortholog_service;

/**
 * A utility class holding application-wide constant values used across the ortholog service.
 * This class is non-instantiable.
 */
public final class Constants {

  /** Conventional header of the first column of the orthogroup table. */
  public static final String ORTHOGROUP_COLUMN = "Orthogroup";

  /** Separator between gene identifiers inside one orthogroup table cell. */
  public static final String GENE_SEPARATOR = ",";

  /** Separator between species names in a common-ancestor query. */
  public static final String SPECIES_LIST_SEPARATOR = ",";

  /**
   * Number of codes listed as examples in the species mapping report. The report always carries
   * the full count.
   */
  public static final int MAPPING_REPORT_EXAMPLES = 20;

  // Leaf names listed in tree statistics
  public static final int STATISTICS_LEAF_NAMES = 10;

  public static final String NODE_TYPE_LEAF = "leaf";
  public static final String NODE_TYPE_INTERNAL = "internal";

  // Private constructor to prevent instantiation
  private Constants() {
    throw new UnsupportedOperationException("Constants class cannot be instantiated");
  }
}
