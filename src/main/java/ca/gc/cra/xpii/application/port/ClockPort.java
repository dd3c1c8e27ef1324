package ca.gc.cra.xpii.application.port;

import java.time.Instant;

/**
 * <strong>What:</strong> Port supplying wall-clock time to the pipeline and the audit log.
 * <p><strong>Why:</strong> Session identifiers, {@code dcterms:modified} stamps and audit timestamps all come
 * from one replaceable source so tests can pin them.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent reads.</p>
 *
 * @since 0.1.0
 */
public interface ClockPort {
  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since 1970-01-01T00:00:00Z
   */
  long nowMillis();

  /**
   * Returns the current instant.
   *
   * @return {@link #nowMillis()} as an {@link Instant}
   */
  default Instant now() {
    return Instant.ofEpochMilli(nowMillis());
  }

  /** Default {@link ClockPort} using {@link System#currentTimeMillis()}. */
  ClockPort SYSTEM = System::currentTimeMillis;
}
