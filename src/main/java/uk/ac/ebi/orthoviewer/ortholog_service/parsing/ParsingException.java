package uk.ac.ebi.orthoviewer.ortholog_service.parsing;

/**
 * Runtime exception to signal errors encountered while parsing a source table row or a Newick
 * tree. Loaders catch it and continue in a degraded state.
 */
public class ParsingException extends RuntimeException {

  /**
   * Constructs a new ParsingException with the specified detail message.
   *
   * @param message the detail message explaining the exception
   */
  public ParsingException(String message) {
    super(message);
  }

  /**
   * Constructs a new ParsingException with the specified detail message and cause.
   *
   * @param message the detail message explaining the exception
   * @param cause the original exception that caused this parsing failure
   */
  public ParsingException(String message, Throwable cause) {
    super(message, cause);
  }
}
