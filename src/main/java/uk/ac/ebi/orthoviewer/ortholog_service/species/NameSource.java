package uk.ac.ebi.orthoviewer.ortholog_service.species;

/** Where a resolved species name comes from. */
public enum NameSource {
  /** Read from the metadata table for exactly this code. */
  METADATA,
  /** Metadata name of a code the queried identifier starts with. */
  PREFIX,
  /** Synthesized from a metadata code sharing the first two letters ("... (variant X)"). */
  VARIANT,
  /** Synthesized from the genus hint table or the generic "Species X" pattern. */
  GENERATED;

  /** True if the name was synthesized rather than read from metadata. */
  public boolean isSynthesized() {
    return this == VARIANT || this == GENERATED;
  }
}
