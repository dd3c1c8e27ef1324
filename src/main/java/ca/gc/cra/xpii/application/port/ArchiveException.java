package ca.gc.cra.xpii.application.port;

/**
 * Thrown when an input is not a valid OOXML zip container: unreadable zip structure, missing
 * {@code [Content_Types].xml}, or an entry name that would escape the workspace.
 *
 * @since 0.1.0
 */
public final class ArchiveException extends StaplerException {
  public ArchiveException(String message) {
    super(message);
  }

  public ArchiveException(String message, Throwable cause) {
    super(message, cause);
  }
}
