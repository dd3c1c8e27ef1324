package ca.gc.cra.xpii.domain.provenance;

import java.util.Objects;

/**
 * Provenance stapled into a package: who produced it, under which session, and which input it came from.
 *
 * @param author value written to {@code dc:creator}
 * @param sessionId session identifier embedded in the description
 * @param fingerprint SHA-256 hex of the original source package bytes; {@code null} only when read back from a
 *     description that carries no fingerprint segment
 * @param modifiedAt {@code dcterms:modified} value, {@code yyyy-MM-dd'T'HH:mm:ss'Z'} in UTC, or
 *     {@value #UNKNOWN} when read back from a package without one
 * @since 0.1.0
 */
public record ProvenanceRecord(String author, String sessionId, String fingerprint, String modifiedAt) {
  /** Placeholder used by verification when a field is absent. */
  public static final String UNKNOWN = "Unknown";

  public ProvenanceRecord {
    Objects.requireNonNull(author, "author");
    Objects.requireNonNull(sessionId, "sessionId");
    Objects.requireNonNull(modifiedAt, "modifiedAt");
  }

  /**
   * Renders the {@code dc:description} text carrying this record.
   *
   * @return delimited provenance description
   */
  public String description() {
    return ProvenanceDescription.format(sessionId, fingerprint);
  }
}
