package ca.gc.cra.xpii.config;

import ca.gc.cra.xpii.application.governance.GovernanceStack;
import ca.gc.cra.xpii.validation.Strings;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * <strong>What:</strong> Immutable runtime configuration of the stapler.
 * <p><strong>Thread-safety:</strong> Record is immutable; safe for concurrent reads.</p>
 *
 * @param workspaceRoot directory under which per-session workspaces are created
 * @param agentName name of the agent identity created for each governance stack
 * @param defaultAuthor author stamped when a request names none
 * @param outputPrefix prefix of the default output file name
 * @param metricsExporter {@code none} or {@code otlp}
 * @since 0.1.0
 */
public record StaplerConfig(
    Path workspaceRoot,
    String agentName,
    String defaultAuthor,
    String outputPrefix,
    String metricsExporter) {
  public static final String DEFAULT_AUTHOR = "XPII-CHAIN";
  public static final String DEFAULT_OUTPUT_PREFIX = "stapled_";
  public static final Set<String> METRICS_EXPORTERS = Set.of("none", "otlp");

  public StaplerConfig {
    Objects.requireNonNull(workspaceRoot, "workspaceRoot");
    agentName = Strings.requireNonBlank("agentName", agentName);
    defaultAuthor = Strings.requireNonBlank("defaultAuthor", defaultAuthor);
    outputPrefix = Strings.requireFileNamePrefix("outputPrefix", outputPrefix);
    metricsExporter = Strings.requireNonBlank("metricsExporter", metricsExporter).toLowerCase(Locale.ROOT);
    if (!METRICS_EXPORTERS.contains(metricsExporter)) {
      throw new IllegalArgumentException("metricsExporter must be one of " + METRICS_EXPORTERS);
    }
  }

  /**
   * Provides the values used when no configuration file is supplied.
   *
   * @return default configuration
   */
  public static StaplerConfig defaults() {
    return new StaplerConfig(
        Path.of(System.getProperty("java.io.tmpdir"), "xpii-work"),
        GovernanceStack.DEFAULT_AGENT_NAME,
        DEFAULT_AUTHOR,
        DEFAULT_OUTPUT_PREFIX,
        "none");
  }

  /**
   * Overlays flat configuration keys on the defaults.
   *
   * @param values flat key map as produced by {@link YamlConfigLoader}
   * @return merged configuration
   */
  public static StaplerConfig fromMap(Map<String, String> values) {
    StaplerConfig base = defaults();
    return new StaplerConfig(
        Path.of(values.getOrDefault("workspaceRoot", base.workspaceRoot().toString())),
        values.getOrDefault("agentName", base.agentName()),
        values.getOrDefault("defaultAuthor", base.defaultAuthor()),
        values.getOrDefault("outputPrefix", base.outputPrefix()),
        values.getOrDefault("metricsExporter", base.metricsExporter()));
  }

  /**
   * Loads configuration for a mode, falling back to defaults when the file is absent.
   *
   * @param yaml YAML file; may be {@code null}
   * @param mode {@code staple} or {@code verify}
   * @return configuration
   * @throws IOException if the file exists but cannot be read
   */
  public static StaplerConfig load(Path yaml, String mode) throws IOException {
    if (yaml == null) {
      return defaults();
    }
    return YamlConfigLoader.load(yaml, mode).map(StaplerConfig::fromMap).orElseGet(StaplerConfig::defaults);
  }
}
