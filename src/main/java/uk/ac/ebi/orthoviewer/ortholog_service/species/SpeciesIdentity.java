package uk.ac.ebi.orthoviewer.ortholog_service.species;

/**
 * Resolved identity of a species code.
 *
 * @param code the species code as queried
 * @param canonicalName human-readable name; never empty
 * @param source how the name was obtained
 */
public record SpeciesIdentity(String code, String canonicalName, NameSource source) {

  /** True if the name was synthesized, not read from the metadata table. */
  public boolean isFallback() {
    return source.isSynthesized();
  }
}
