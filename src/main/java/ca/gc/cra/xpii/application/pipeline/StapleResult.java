package ca.gc.cra.xpii.application.pipeline;

import ca.gc.cra.xpii.domain.provenance.ProvenanceRecord;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Outcome of a successful staple.
 *
 * @param record provenance stamped into the output
 * @param output written package
 * @param outputSha256 SHA-256 hex of the written package
 * @since 0.1.0
 */
public record StapleResult(ProvenanceRecord record, Path output, String outputSha256) {
  public StapleResult {
    Objects.requireNonNull(record, "record");
    Objects.requireNonNull(output, "output");
    Objects.requireNonNull(outputSha256, "outputSha256");
  }
}
