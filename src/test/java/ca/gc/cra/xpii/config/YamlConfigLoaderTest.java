package ca.gc.cra.xpii.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlConfigLoaderTest {

  @TempDir Path tempDir;

  @Test
  void loadMergesCommonAndModeSections() throws IOException {
    Path yaml = tempDir.resolve("xpii.yaml");
    Files.writeString(yaml, """
        common:
          agentName: COMMON-AGENT
          metricsExporter: none
        staple:
          agentName: STAPLE-AGENT
          outputPrefix: signed_
        verify:
          defaultAuthor: Auditor
        """);

    Map<String, String> map = YamlConfigLoader.load(yaml, "staple").orElseThrow();

    assertEquals("STAPLE-AGENT", map.get("agentName"));
    assertEquals("signed_", map.get("outputPrefix"));
    assertEquals("none", map.get("metricsExporter"));
    assertFalse(map.containsKey("defaultAuthor"));
  }

  @Test
  void loadFlattensNestedMaps() throws IOException {
    Path yaml = tempDir.resolve("nested.yaml");
    Files.writeString(yaml, """
        verify:
          audit:
            export: /tmp/audit.json
        """);

    assertEquals("/tmp/audit.json", YamlConfigLoader.load(yaml, "VERIFY").orElseThrow().get("audit.export"));
  }

  @Test
  void missingFileReturnsEmptyOptional() throws IOException {
    Optional<Map<String, String>> result = YamlConfigLoader.load(tempDir.resolve("missing.yaml"), "staple");
    assertFalse(result.isPresent());
  }

  @Test
  void emptyFileYieldsEmptyMap() throws IOException {
    Path yaml = Files.writeString(tempDir.resolve("empty.yaml"), "");
    assertTrue(YamlConfigLoader.load(yaml, "staple").orElseThrow().isEmpty());
  }

  @Test
  void invalidStructuresThrow() throws IOException {
    Path list = Files.writeString(tempDir.resolve("list.yaml"), "- staple\n");
    Path array = Files.writeString(tempDir.resolve("array.yaml"), "staple:\n  authors: [a, b]\n");
    Path broken = Files.writeString(tempDir.resolve("broken.yaml"), "staple: [unclosed\n");

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(list, "staple"));
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(array, "staple"));
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(broken, "staple"));
  }

  @Test
  void unknownModeRejected() {
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(tempDir.resolve("x.yaml"), "capture"));
  }
}
