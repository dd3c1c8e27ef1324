package ca.gc.cra.xpii.application.port;

/**
 * Thrown when an XML part inside a package cannot be parsed. The message carries the parser diagnostic.
 *
 * @since 0.1.0
 */
public final class MalformedArchiveException extends StaplerException {
  private final String part;

  /**
   * Creates an exception for a specific part.
   *
   * @param part package-relative part name, for example {@code word/settings.xml}
   * @param cause parser failure
   */
  public MalformedArchiveException(String part, Throwable cause) {
    super(part + ": " + (cause == null ? "malformed XML" : cause.getMessage()), cause);
    this.part = part;
  }

  /**
   * Returns the part that failed to parse.
   *
   * @return package-relative part name
   */
  public String part() {
    return part;
  }
}
