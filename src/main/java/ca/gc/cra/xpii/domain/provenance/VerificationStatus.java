package ca.gc.cra.xpii.domain.provenance;

/**
 * Outcome of reading provenance back from a package.
 *
 * @since 0.1.0
 */
public enum VerificationStatus {
  /** Provenance marker found and parsed. */
  VERIFIED,
  /** The package has no {@code docProps/core.xml} part. */
  NO_METADATA,
  /** Core properties exist but carry no provenance marker. */
  NO_PROVENANCE,
  /** The file is not a readable zip, or the core properties are not well-formed XML. */
  MALFORMED_ARCHIVE
}
