package ca.gc.cra.xpii.domain.provenance;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of verifying a package.
 *
 * @param status verification outcome
 * @param record provenance read back; present only for {@link VerificationStatus#VERIFIED}
 * @param fields every key/value pair parsed from the description, including unknown keys
 * @param detail diagnostic message (parser error for malformed archives); empty when not applicable
 * @since 0.1.0
 */
public record VerificationResult(
    VerificationStatus status,
    Optional<ProvenanceRecord> record,
    Map<String, String> fields,
    String detail) {

  public VerificationResult {
    Objects.requireNonNull(status, "status");
    record = record == null ? Optional.empty() : record;
    fields = fields == null ? Map.of() : Map.copyOf(fields);
    detail = detail == null ? "" : detail;
    if (status == VerificationStatus.VERIFIED && record.isEmpty()) {
      throw new IllegalArgumentException("verified result requires a provenance record");
    }
  }

  /**
   * Creates a successful result.
   *
   * @param record parsed provenance
   * @param fields parsed description fields
   * @return verified result
   */
  public static VerificationResult verified(ProvenanceRecord record, Map<String, String> fields) {
    return new VerificationResult(VerificationStatus.VERIFIED, Optional.of(record), fields, "");
  }

  /**
   * Creates a non-verified result.
   *
   * @param status failure status; must not be {@link VerificationStatus#VERIFIED}
   * @param detail diagnostic message
   * @return failure result
   */
  public static VerificationResult failed(VerificationStatus status, String detail) {
    if (status == VerificationStatus.VERIFIED) {
      throw new IllegalArgumentException("use verified() for successful results");
    }
    return new VerificationResult(status, Optional.empty(), Map.of(), detail);
  }

  public boolean isVerified() {
    return status == VerificationStatus.VERIFIED;
  }
}
