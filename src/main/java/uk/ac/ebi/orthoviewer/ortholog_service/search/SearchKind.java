package uk.ac.ebi.orthoviewer.ortholog_service.search;

import java.util.Locale;
import uk.ac.ebi.orthoviewer.ortholog_service.exceptions.UnknownSearchKindException;

/** Kinds of structural tree search. */
public enum SearchKind {
  GENE("gene"),
  SPECIES("species"),
  CLADE("clade"),
  COMMON_ANCESTOR("common_ancestor");

  private final String value;

  SearchKind(String value) {
    this.value = value;
  }

  /** Wire name, as accepted by {@link #fromString(String)}. */
  public String getValue() {
    return value;
  }

  /**
   * Parses a search kind; case is ignored and {@code -} is accepted for {@code _}.
   *
   * @throws UnknownSearchKindException if the value names no kind
   */
  public static SearchKind fromString(String value) {
    if (value != null) {
      String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
      for (SearchKind kind : values()) {
        if (kind.value.equals(normalized)) {
          return kind;
        }
      }
    }
    throw new UnknownSearchKindException(value);
  }
}
