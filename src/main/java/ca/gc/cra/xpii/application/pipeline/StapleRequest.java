package ca.gc.cra.xpii.application.pipeline;

import java.nio.file.Path;
import java.util.Objects;

/**
 * One staple invocation.
 *
 * @param input package to stamp
 * @param output destination; {@code null} writes {@code <outputPrefix><name>} next to the input
 * @param author author to stamp; {@code null} uses the configured default
 * @param sessionId session identifier; {@code null} or blank generates one from the local time
 * @since 0.1.0
 */
public record StapleRequest(Path input, Path output, String author, String sessionId) {
  public StapleRequest {
    Objects.requireNonNull(input, "input");
  }

  public static StapleRequest of(Path input) {
    return new StapleRequest(input, null, null, null);
  }
}
