package ca.gc.cra.xpii.application.port;

import ca.gc.cra.xpii.domain.provenance.VerificationResult;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Port that reads stapled provenance back out of a package without modifying it.
 *
 * @since 0.1.0
 */
public interface ProvenanceVerifier {
  /**
   * Reads the provenance embedded in {@code pkg}.
   *
   * @param pkg package to inspect
   * @return verification result; invalid zips and XML map to
   *     {@link ca.gc.cra.xpii.domain.provenance.VerificationStatus#MALFORMED_ARCHIVE}
   * @throws IOException when the file itself cannot be read
   */
  VerificationResult verify(Path pkg) throws IOException;
}
