package ca.gc.cra.xpii.domain.provenance;

import ca.gc.cra.xpii.domain.util.Sha256;
import java.util.Locale;
import java.util.Objects;

/**
 * Derives the revision save identifier (RSID) stamped into {@code word/settings.xml}.
 *
 * <p>The marker is the first eight hex characters of {@code SHA-256(sessionId)}, upper-cased, so the same session
 * always yields the same marker.
 *
 * @since 0.1.0
 */
public final class RevisionMarker {
  /** Number of hex characters in a marker. */
  public static final int LENGTH = 8;

  private RevisionMarker() {}

  /**
   * Derives the marker for a session.
   *
   * @param sessionId session identifier; must not be {@code null}
   * @return eight upper-case hex characters
   */
  public static String derive(String sessionId) {
    Objects.requireNonNull(sessionId, "sessionId");
    return Sha256.hex(sessionId).substring(0, LENGTH).toUpperCase(Locale.ROOT);
  }
}
