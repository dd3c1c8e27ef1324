package ca.gc.cra.xpii.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads stapler configuration from YAML, merging the {@code common} section with a mode section
 * ({@code staple} or {@code verify}) into a flat dotted-key map. Mode values override common ones.
 */
public final class YamlConfigLoader {
  /** Sections recognised besides {@code common}. */
  public static final Set<String> MODES = Set.of("staple", "verify");

  private YamlConfigLoader() {}

  /**
   * Loads and flattens the YAML document at {@code path}.
   *
   * @param path location of the YAML configuration
   * @param mode {@code staple} or {@code verify}
   * @return flat map, or empty when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the mode is unknown or the YAML structure is invalid
   */
  public static Optional<Map<String, String>> load(Path path, String mode) throws IOException {
    Objects.requireNonNull(path, "path");
    String normalizedMode = Objects.requireNonNull(mode, "mode").trim().toLowerCase(Locale.ROOT);
    if (!MODES.contains(normalizedMode)) {
      throw new IllegalArgumentException("unknown config mode '" + mode + "'; expected one of " + MODES);
    }
    if (!Files.exists(path)) {
      return Optional.empty();
    }

    Object document;
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      document = new Yaml().load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + path, ex);
    }
    if (document == null) {
      return Optional.of(Map.of());
    }
    if (!(document instanceof Map<?, ?> root)) {
      throw new IllegalArgumentException("root of " + path + " must be a mapping");
    }

    Map<String, String> flattened = new LinkedHashMap<>();
    for (String section : new String[] {"common", normalizedMode}) {
      Object node = root.get(section);
      if (node == null) {
        continue;
      }
      if (!(node instanceof Map<?, ?> sectionMap)) {
        throw new IllegalArgumentException(section + " section must be a mapping");
      }
      flatten(sectionMap, "", flattened);
    }
    return Optional.of(Map.copyOf(flattened));
  }

  private static void flatten(Map<?, ?> source, String prefix, Map<String, String> target) {
    for (Map.Entry<?, ?> entry : source.entrySet()) {
      if (!(entry.getKey() instanceof String key) || key.isBlank()) {
        throw new IllegalArgumentException("YAML contains a blank or non-string key under '" + prefix + "'");
      }
      String composite = prefix.isEmpty() ? key : prefix + '.' + key;
      Object value = entry.getValue();
      if (value instanceof Map<?, ?> nested) {
        flatten(nested, composite, target);
      } else if (value instanceof Iterable<?>) {
        throw new IllegalArgumentException("YAML arrays are not supported for key " + composite);
      } else {
        target.put(composite, value == null ? "" : value.toString());
      }
    }
  }
}
