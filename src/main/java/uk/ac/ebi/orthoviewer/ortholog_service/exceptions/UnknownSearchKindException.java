package uk.ac.ebi.orthoviewer.ortholog_service.exceptions;

/** Thrown when a tree search is requested with a kind that does not exist. */
public class UnknownSearchKindException extends IllegalArgumentException {

  public UnknownSearchKindException(String kind) {
    super("Unknown search type: " + kind);
  }
}
