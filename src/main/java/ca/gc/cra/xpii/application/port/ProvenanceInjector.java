package ca.gc.cra.xpii.application.port;

import ca.gc.cra.xpii.domain.provenance.ProvenanceRecord;
import java.io.IOException;

/**
 * Port for the edit phase: stamps author, session, fingerprint, modification time and revision marker into the
 * parts of an unpacked package.
 *
 * @since 0.1.0
 */
public interface ProvenanceInjector {
  /**
   * Rewrites the provenance-bearing parts of {@code workspace}. Absent parts are skipped.
   *
   * @param workspace unpacked package
   * @param author author to stamp; must not be {@code null}
   * @param sessionId session identifier; {@code null} or blank to generate one from the local time
   * @return provenance that was stamped
   * @throws MalformedArchiveException when a present part is not well-formed XML
   * @throws IOException when reading or writing a part fails
   */
  ProvenanceRecord inject(Workspace workspace, String author, String sessionId)
      throws MalformedArchiveException, IOException;
}
