package ca.gc.cra.xpii.application.pipeline;

import ca.gc.cra.xpii.application.governance.AuditLog;
import ca.gc.cra.xpii.application.governance.BuiltinPolicies;
import ca.gc.cra.xpii.application.governance.GovernanceStack;
import ca.gc.cra.xpii.application.governance.OperationBlockedException;
import ca.gc.cra.xpii.application.governance.PolicyDeniedException;
import ca.gc.cra.xpii.application.port.MetricsPort;
import ca.gc.cra.xpii.application.port.PackageCodec;
import ca.gc.cra.xpii.application.port.ProvenanceInjector;
import ca.gc.cra.xpii.application.port.StaplerException;
import ca.gc.cra.xpii.application.port.Workspace;
import ca.gc.cra.xpii.config.StaplerConfig;
import ca.gc.cra.xpii.domain.provenance.ProvenanceRecord;
import ca.gc.cra.xpii.logging.Logs;
import ca.gc.cra.xpii.validation.Paths;
import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Stamps provenance into a package: unpack, inject, pack, each behind the operator gate.
 * <p><strong>Why:</strong> Ties every file modification to an agent identity and an audit entry.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Refuse to start while the operator halt is engaged, and re-check before every phase.</li>
 *   <li>Evaluate the {@code staple} policies once over the request.</li>
 *   <li>Record one audit entry per phase, with outcome {@code FAILED: <message>} when the phase throws.</li>
 *   <li>Remove the per-call workspace whatever the outcome.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Safe for concurrent invocations writing distinct outputs; every call
 * unpacks into its own workspace directory, even when session ids repeat.</p>
 * <p><strong>Observability:</strong> Counts {@code staple.completed}, {@code staple.denied},
 * {@code staple.blocked}, {@code staple.failed} and observes {@code staple.latencyNanos}.</p>
 *
 * @since 0.1.0
 */
public final class StapleUseCase {
  private static final Logger log = LoggerFactory.getLogger(StapleUseCase.class);
  private static final int LOG_AUTHOR_BYTES = 64;

  private final GovernanceStack governance;
  private final PackageCodec codec;
  private final ProvenanceInjector injector;
  private final StaplerConfig config;
  private final MetricsPort metrics;

  /**
   * Creates the use case.
   *
   * @param governance identity, audit log, policy engine and operator control
   * @param codec package codec
   * @param injector provenance injector
   * @param config runtime configuration
   * @param metrics metrics sink
   */
  public StapleUseCase(
      GovernanceStack governance,
      PackageCodec codec,
      ProvenanceInjector injector,
      StaplerConfig config,
      MetricsPort metrics) {
    this.governance = Objects.requireNonNull(governance, "governance");
    this.codec = Objects.requireNonNull(codec, "codec");
    this.injector = Objects.requireNonNull(injector, "injector");
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Runs the full staple pipeline.
   *
   * @param request staple request
   * @return stamped provenance, output path and output hash
   * @throws OperationBlockedException when the operator halt is engaged before any phase
   * @throws PolicyDeniedException when a policy denies the request
   * @throws StaplerException when the input is not a valid package or contains malformed XML
   * @throws IOException when a filesystem operation fails
   */
  public StapleResult staple(StapleRequest request) throws StaplerException, IOException {
    Objects.requireNonNull(request, "request");
    long started = System.nanoTime();
    try {
      StapleResult result = run(request);
      metrics.increment("staple.completed");
      metrics.observe("staple.latencyNanos", System.nanoTime() - started);
      return result;
    } catch (OperationBlockedException ex) {
      metrics.increment("staple.blocked");
      throw ex;
    } catch (PolicyDeniedException ex) {
      metrics.increment("staple.denied");
      throw ex;
    } catch (StaplerException | IOException | RuntimeException ex) {
      metrics.increment("staple.failed");
      throw ex;
    }
  }

  private StapleResult run(StapleRequest request) throws StaplerException, IOException {
    Path input = request.input();
    Path output = request.output() != null ? request.output() : defaultOutput(input);
    String author = request.author() != null ? request.author() : config.defaultAuthor();
    String sessionId = request.sessionId();

    governance.operatorControl().assertActive("staple");
    Map<String, Object> context = new LinkedHashMap<>();
    context.put(BuiltinPolicies.IDENTITY, governance.identity());
    context.put(BuiltinPolicies.AUTHOR, author);
    context.put(BuiltinPolicies.INPUT_PATH, input.toString());
    context.put(BuiltinPolicies.OUTPUT_PATH, output.toString());
    context.put("session_id", sessionId == null ? "" : sessionId);
    governance.policyEngine().evaluate("staple", context).requireAllowed("staple");

    AuditLog audit = governance.auditLog();
    Path workspaceDir = Paths.resolveWithin(config.workspaceRoot(), workspaceName(sessionId));

    governance.operatorControl().assertActive("unpack");
    Workspace workspace = unpack(input, workspaceDir);
    audit.record("unpack", Map.of(
        "source", input.toString(),
        "workspace", workspace.root().toString(),
        "source_sha256", workspace.sourceSha256()));
    log.info("Unpacked {} into {}", input, workspace.root());

    try (workspace) {
      governance.operatorControl().assertActive("inject_metadata");
      ProvenanceRecord record;
      try {
        record = injector.inject(workspace, author, sessionId);
      } catch (StaplerException | IOException ex) {
        audit.record("inject_metadata", Map.of("author", author), failed(ex));
        throw ex;
      }
      audit.record("inject_metadata", Map.of(
          "author", record.author(),
          "session_id", record.sessionId(),
          "fingerprint", String.valueOf(record.fingerprint())));
      log.info("Injected provenance for author {} session {}",
          Logs.truncate(record.author(), LOG_AUTHOR_BYTES), record.sessionId());

      governance.operatorControl().assertActive("pack");
      String outputSha256;
      try {
        outputSha256 = codec.pack(workspace, output);
      } catch (IOException ex) {
        audit.record("pack", Map.of("output", output.toString()), failed(ex));
        throw ex;
      }
      audit.record("pack", Map.of("output", output.toString(), "output_sha256", outputSha256));
      log.info("Packed {} (sha256={})", output, outputSha256);
      return new StapleResult(record, output, outputSha256);
    }
  }

  private Workspace unpack(Path input, Path workspaceDir) throws StaplerException, IOException {
    try {
      return codec.unpack(input, workspaceDir);
    } catch (StaplerException | IOException ex) {
      governance.auditLog().record("unpack", Map.of("source", input.toString()), failed(ex));
      throw ex;
    }
  }

  private Path defaultOutput(Path input) {
    Path fileName = input.getFileName();
    if (fileName == null) {
      throw new IllegalArgumentException("input has no file name: " + input);
    }
    return input.resolveSibling(config.outputPrefix() + fileName);
  }

  /**
   * Returns a per-call workspace directory name: the sanitized session id plus a random suffix, so calls
   * sharing a session id (or ids that sanitize alike) never share a tree.
   */
  static String workspaceName(String sessionId) {
    StringBuilder name = new StringBuilder("session-");
    if (sessionId != null && !sessionId.isBlank()) {
      for (int i = 0; i < sessionId.length(); i++) {
        char c = sessionId.charAt(i);
        name.append(Character.isLetterOrDigit(c) || c == '-' || c == '_' ? c : '_');
      }
      name.append('-');
    }
    return name.append(UUID.randomUUID()).toString();
  }

  private static String failed(Exception ex) {
    return "FAILED: " + ex.getMessage();
  }
}
