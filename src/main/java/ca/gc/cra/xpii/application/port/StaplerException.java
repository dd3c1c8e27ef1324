package ca.gc.cra.xpii.application.port;

/**
 * Checked base exception for provenance pipeline and governance failures.
 *
 * @since 0.1.0
 */
public class StaplerException extends Exception {
  /**
   * Creates an exception with a descriptive message.
   *
   * @param message human-readable error
   */
  public StaplerException(String message) {
    super(message);
  }

  /**
   * Creates an exception with a message and underlying cause.
   *
   * @param message human-readable error
   * @param cause root cause
   */
  public StaplerException(String message, Throwable cause) {
    super(message, cause);
  }
}
