package ca.gc.cra.xpii.domain.provenance;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Formats and parses the delimited provenance string stored in {@code dc:description}.
 *
 * <p>Format: {@code XPII-CHAIN-PROVENANCE: <session> | XPII-CHAIN-SHA256: <fingerprint>}.
 *
 * @since 0.1.0
 */
public final class ProvenanceDescription {
  /** Key carrying the session identifier. */
  public static final String SESSION_KEY = "XPII-CHAIN-PROVENANCE";
  /** Key carrying the source fingerprint. */
  public static final String FINGERPRINT_KEY = "XPII-CHAIN-SHA256";
  /** Token whose presence marks a description as stapled. */
  public static final String MARKER = SESSION_KEY + ":";

  private static final String SEGMENT_DELIMITER = " | ";
  private static final String KEY_DELIMITER = ": ";

  private ProvenanceDescription() {}

  /**
   * Builds the description text.
   *
   * @param sessionId session identifier; must not be {@code null}
   * @param fingerprint source fingerprint; must not be {@code null}
   * @return description in the bit-exact stapled format
   */
  public static String format(String sessionId, String fingerprint) {
    Objects.requireNonNull(sessionId, "sessionId");
    Objects.requireNonNull(fingerprint, "fingerprint");
    return SESSION_KEY + KEY_DELIMITER + sessionId + SEGMENT_DELIMITER + FINGERPRINT_KEY + KEY_DELIMITER
        + fingerprint;
  }

  /**
   * Returns whether {@code description} carries the provenance marker.
   *
   * @param description raw description text; may be {@code null}
   * @return {@code true} when the marker token is present
   */
  public static boolean isStapled(String description) {
    return description != null && !description.isEmpty() && description.contains(MARKER);
  }

  /**
   * Splits a description into key/value pairs.
   *
   * <p>Segments are separated by {@code |}. The first segment holding the {@value #MARKER} token yields the
   * session id: everything after the token, trimmed, whatever precedes it and whether or not a space follows.
   * In other segments the key ends at the first {@code ": "}. Keys and values are trimmed. Segments without a
   * key separator are skipped. Insertion order is kept and unknown keys are preserved.
   *
   * @param description raw description text; must not be {@code null}
   * @return unmodifiable ordered map of fields
   */
  public static Map<String, String> parse(String description) {
    Objects.requireNonNull(description, "description");
    Map<String, String> fields = new LinkedHashMap<>();
    boolean sessionSeen = false;
    for (String segment : description.split("\\|")) {
      int marker = segment.indexOf(MARKER);
      if (marker >= 0 && !sessionSeen) {
        sessionSeen = true;
        fields.put(SESSION_KEY, segment.substring(marker + MARKER.length()).trim());
        continue;
      }
      int split = segment.indexOf(KEY_DELIMITER);
      if (split < 0) {
        String trimmed = segment.trim();
        // "KEY:" with nothing after it still names the key
        if (trimmed.endsWith(":") && trimmed.length() > 1) {
          fields.putIfAbsent(trimmed.substring(0, trimmed.length() - 1).trim(), "");
        }
        continue;
      }
      String key = segment.substring(0, split).trim();
      String value = segment.substring(split + KEY_DELIMITER.length()).trim();
      if (!key.isEmpty()) {
        fields.putIfAbsent(key, value);
      }
    }
    return Collections.unmodifiableMap(fields);
  }
}
