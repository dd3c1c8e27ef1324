package ca.gc.cra.xpii.application.pipeline;

import ca.gc.cra.xpii.application.governance.BuiltinPolicies;
import ca.gc.cra.xpii.application.governance.GovernanceStack;
import ca.gc.cra.xpii.application.port.MetricsPort;
import ca.gc.cra.xpii.application.port.ProvenanceVerifier;
import ca.gc.cra.xpii.application.port.StaplerException;
import ca.gc.cra.xpii.config.StaplerConfig;
import ca.gc.cra.xpii.domain.provenance.VerificationResult;
import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads back stapled provenance behind the operator gate and the {@code verify} policies.
 *
 * <p>The verification status is the audit outcome; a package without provenance is a result, not a failure.
 *
 * @since 0.1.0
 */
public final class VerifyUseCase {
  private static final Logger log = LoggerFactory.getLogger(VerifyUseCase.class);

  private final GovernanceStack governance;
  private final ProvenanceVerifier verifier;
  private final StaplerConfig config;
  private final MetricsPort metrics;

  public VerifyUseCase(
      GovernanceStack governance, ProvenanceVerifier verifier, StaplerConfig config, MetricsPort metrics) {
    this.governance = Objects.requireNonNull(governance, "governance");
    this.verifier = Objects.requireNonNull(verifier, "verifier");
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Verifies the provenance of {@code pkg}.
   *
   * @param pkg package to inspect
   * @return verification result
   * @throws StaplerException when the operator halt is engaged or a policy denies the request
   * @throws IOException when the file cannot be read
   */
  public VerificationResult verify(Path pkg) throws StaplerException, IOException {
    Objects.requireNonNull(pkg, "pkg");
    governance.operatorControl().assertActive("verify");

    Map<String, Object> context = new LinkedHashMap<>();
    context.put(BuiltinPolicies.IDENTITY, governance.identity());
    context.put(BuiltinPolicies.AUTHOR, config.defaultAuthor());
    context.put(BuiltinPolicies.INPUT_PATH, pkg.toString());
    governance.policyEngine().evaluate("verify", context).requireAllowed("verify");

    VerificationResult result;
    try {
      result = verifier.verify(pkg);
    } catch (IOException ex) {
      governance.auditLog().record("verify", Map.of("path", pkg.toString()), "FAILED: " + ex.getMessage());
      throw ex;
    }

    Map<String, Object> auditContext = new LinkedHashMap<>();
    auditContext.put("path", pkg.toString());
    auditContext.put("fields", result.fields());
    governance.auditLog().record("verify", auditContext, result.status().name());
    metrics.increment("verify.completed");
    metrics.increment("verify.status." + result.status().name().toLowerCase(Locale.ROOT));
    log.info("Verified {}: {}", pkg, result.status());
    return result;
  }
}
