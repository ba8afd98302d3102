package uk.ac.ebi.orthoviewer.ortholog_service.exceptions;

/**
 * Signals that a required source file is missing or unreadable at load time.
 *
 * <p>No query can be answered without the orthogroup table and the species tree, so this is
 * surfaced to HTTP clients as service unavailable.
 */
public class DataNotFoundException extends RuntimeException {

  public DataNotFoundException(String message) {
    super(message);
  }

  public DataNotFoundException(String message, Throwable cause) {
    super(message, cause);
  }
}
