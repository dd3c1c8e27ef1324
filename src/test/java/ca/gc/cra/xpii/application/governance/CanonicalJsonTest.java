package ca.gc.cra.xpii.application.governance;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

import ca.gc.cra.xpii.domain.governance.AuditEntry;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CanonicalJsonTest {

  @Test
  void keysAreSortedAtEveryLevel() {
    Map<String, Object> inner = new LinkedHashMap<>();
    inner.put("z", 1);
    inner.put("a", true);
    Map<String, Object> outer = new LinkedHashMap<>();
    outer.put("b", List.of(inner, "x"));
    outer.put("a", null);

    String json = new String(CanonicalJson.write(outer), StandardCharsets.UTF_8);

    assertEquals("{\"a\":null,\"b\":[{\"a\":true,\"z\":1},\"x\"]}", json);
  }

  @Test
  void hashInputExcludesEntryHash() {
    AuditEntry entry = new AuditEntry(3, "2026-01-01T00:00:00Z", "AGENT:00", "pack",
        Map.of("output", "o.docx"), "OK", "prev", "ignored-hash");

    String json = new String(CanonicalJson.hashInput(entry), StandardCharsets.UTF_8);

    assertEquals("{\"action\":\"pack\",\"agent_id\":\"AGENT:00\",\"context\":{\"output\":\"o.docx\"},"
        + "\"outcome\":\"OK\",\"prev_hash\":\"prev\",\"seq\":3,\"timestamp\":\"2026-01-01T00:00:00Z\"}", json);
    assertFalse(json.contains("ignored-hash"));
  }
}
