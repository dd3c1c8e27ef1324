package ca.gc.cra.xpii.application.governance;

import ca.gc.cra.xpii.domain.governance.AuditEntry;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Map;
import java.util.TreeMap;

/**
 * Deterministic JSON serialization of audit entries used as the hash input of the chain.
 *
 * <p>Object keys are written in lexicographic order at every nesting level, output is compact UTF-8, and the
 * {@code entry_hash} field is never included.
 *
 * @since 0.1.0
 */
public final class CanonicalJson {
  private static final JsonFactory FACTORY = new JsonFactory();

  private CanonicalJson() {}

  /**
   * Serializes every field of {@code entry} except its own hash.
   *
   * @param entry audit entry
   * @return canonical UTF-8 bytes
   */
  public static byte[] hashInput(AuditEntry entry) {
    Map<String, Object> fields = new TreeMap<>();
    fields.put("action", entry.action());
    fields.put("agent_id", entry.agentId());
    fields.put("context", entry.context());
    fields.put("outcome", entry.outcome());
    fields.put("prev_hash", entry.prevHash());
    fields.put("seq", entry.seq());
    fields.put("timestamp", entry.timestamp());
    return write(fields);
  }

  /**
   * Serializes an arbitrary map of JSON-compatible values with sorted keys.
   *
   * @param value map to serialize
   * @return canonical UTF-8 bytes
   */
  public static byte[] write(Map<String, ?> value) {
    ByteArrayOutputStream out = new ByteArrayOutputStream(256);
    try (JsonGenerator generator = FACTORY.createGenerator(out)) {
      writeValue(generator, value);
    } catch (IOException ex) {
      throw new UncheckedIOException("canonical serialization failed", ex);
    }
    return out.toByteArray();
  }

  /**
   * Writes one JSON value, sorting object keys at every level.
   *
   * @param generator open generator
   * @param value map, iterable, string, number, boolean or {@code null}; anything else is written as its string
   * @throws IOException when the generator fails
   */
  public static void writeValue(JsonGenerator generator, Object value) throws IOException {
    if (value == null) {
      generator.writeNull();
    } else if (value instanceof Map<?, ?> map) {
      Map<String, Object> sorted = new TreeMap<>();
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        sorted.put(String.valueOf(entry.getKey()), entry.getValue());
      }
      generator.writeStartObject();
      for (Map.Entry<String, Object> entry : sorted.entrySet()) {
        generator.writeFieldName(entry.getKey());
        writeValue(generator, entry.getValue());
      }
      generator.writeEndObject();
    } else if (value instanceof Iterable<?> items) {
      generator.writeStartArray();
      for (Object item : items) {
        writeValue(generator, item);
      }
      generator.writeEndArray();
    } else if (value instanceof Boolean bool) {
      generator.writeBoolean(bool);
    } else if (value instanceof Integer || value instanceof Long || value instanceof Short
        || value instanceof Byte) {
      generator.writeNumber(((Number) value).longValue());
    } else if (value instanceof Number number) {
      generator.writeNumber(number.toString());
    } else {
      generator.writeString(value.toString());
    }
  }
}
