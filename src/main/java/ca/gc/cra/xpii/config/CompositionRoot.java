package ca.gc.cra.xpii.config;

import ca.gc.cra.xpii.application.governance.GovernanceStack;
import ca.gc.cra.xpii.application.pipeline.StapleUseCase;
import ca.gc.cra.xpii.application.pipeline.VerifyUseCase;
import ca.gc.cra.xpii.application.port.ClockPort;
import ca.gc.cra.xpii.application.port.MetricsPort;
import ca.gc.cra.xpii.application.port.PackageCodec;
import ca.gc.cra.xpii.application.port.ProvenanceInjector;
import ca.gc.cra.xpii.application.port.ProvenanceVerifier;
import ca.gc.cra.xpii.infrastructure.audit.AuditJsonCodec;
import ca.gc.cra.xpii.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.xpii.infrastructure.ooxml.OoxmlProvenanceInjector;
import ca.gc.cra.xpii.infrastructure.ooxml.OoxmlProvenanceVerifier;
import ca.gc.cra.xpii.infrastructure.ooxml.ZipPackageCodec;
import ca.gc.cra.xpii.validation.Paths;
import java.time.ZoneId;
import java.util.Objects;

/**
 * <strong>What:</strong> Central composition root that wires the stapler use cases to concrete adapters.
 * <p><strong>Why:</strong> Keeps the translation from {@link StaplerConfig} to runnable use cases in one place.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Create one {@link GovernanceStack} shared by the staple and verify use cases.</li>
 *   <li>Instantiate the OOXML codec, injector and verifier.</li>
 *   <li>Select the metrics adapter from {@code metricsExporter}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Construct on one thread; the wired use cases may then be shared.</p>
 *
 * @since 0.1.0
 * @see StapleUseCase
 * @see VerifyUseCase
 */
public final class CompositionRoot {
  private final StaplerConfig config;
  private final ClockPort clock;
  private final GovernanceStack governance;
  private final MetricsPort metrics;
  private final PackageCodec codec;
  private final ProvenanceInjector injector;
  private final ProvenanceVerifier verifier;

  /**
   * Wires adapters using the system clock and zone.
   *
   * @param config runtime configuration
   */
  public CompositionRoot(StaplerConfig config) {
    this(config, ClockPort.SYSTEM, metricsFor(config));
  }

  /**
   * Wires adapters with an explicit clock and metrics sink.
   *
   * @param config runtime configuration
   * @param clock clock for session ids, modified stamps and audit timestamps
   * @param metrics metrics sink
   * @throws IllegalArgumentException when the workspace root is not a writable directory
   */
  public CompositionRoot(StaplerConfig config, ClockPort clock, MetricsPort metrics) {
    this.config = Objects.requireNonNull(config, "config");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    Paths.requireWritableDir(config.workspaceRoot());
    this.governance = GovernanceStack.create(config.agentName(), clock);
    this.codec = new ZipPackageCodec();
    this.injector = new OoxmlProvenanceInjector(clock, ZoneId.systemDefault());
    this.verifier = new OoxmlProvenanceVerifier();
  }

  public GovernanceStack governance() {
    return governance;
  }

  public MetricsPort metrics() {
    return metrics;
  }

  public StapleUseCase stapleUseCase() {
    return new StapleUseCase(governance, codec, injector, config, metrics);
  }

  public VerifyUseCase verifyUseCase() {
    return new VerifyUseCase(governance, verifier, config, metrics);
  }

  public AuditJsonCodec auditJsonCodec() {
    return new AuditJsonCodec();
  }

  public ClockPort clock() {
    return clock;
  }

  static MetricsPort metricsFor(StaplerConfig config) {
    return "otlp".equals(config.metricsExporter()) ? new OpenTelemetryMetricsAdapter() : MetricsPort.NO_OP;
  }
}
