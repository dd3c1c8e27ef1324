package ca.gc.cra.xpii.infrastructure.audit;

import ca.gc.cra.xpii.application.governance.CanonicalJson;
import ca.gc.cra.xpii.domain.governance.AuditEntry;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Reads and writes audit entries as a JSON array with sorted keys.
 * <p><strong>Why:</strong> An exported log must reproduce every hashed field exactly, so replaying the chain
 * from disk gives the same verdict as replaying it in memory.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from the shared {@link JsonFactory}; safe for concurrent
 * use.</p>
 *
 * @since 0.1.0
 */
public final class AuditJsonCodec {
  private static final Logger log = LoggerFactory.getLogger(AuditJsonCodec.class);

  private final JsonFactory factory = new JsonFactory();

  /**
   * Writes {@code entries} to {@code target}, replacing it atomically where the filesystem allows.
   *
   * @param entries entries in sequence order
   * @param target destination file
   * @throws IOException when writing fails
   */
  public void write(List<AuditEntry> entries, Path target) throws IOException {
    Objects.requireNonNull(entries, "entries");
    Path absolute = target.toAbsolutePath();
    Path parent = absolute.getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    Path tmp = absolute.resolveSibling(absolute.getFileName() + ".tmp");
    try (OutputStream out = Files.newOutputStream(tmp)) {
      write(entries, out);
    }
    Files.move(tmp, absolute, StandardCopyOption.REPLACE_EXISTING);
    log.info("Exported {} audit entries to {}", entries.size(), absolute);
  }

  /**
   * Streams {@code entries} to {@code out} as compact UTF-8 JSON. The stream is not closed.
   *
   * @param entries entries in sequence order
   * @param out destination stream
   * @throws IOException when writing fails
   */
  public void write(List<AuditEntry> entries, OutputStream out) throws IOException {
    try (JsonGenerator generator = factory.createGenerator(out)) {
      generator.disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
      generator.writeStartArray();
      for (AuditEntry entry : entries) {
        CanonicalJson.writeValue(generator, toMap(entry));
      }
      generator.writeEndArray();
    }
  }

  /**
   * Reads entries previously written by {@link #write(List, Path)}.
   *
   * @param source exported file
   * @return entries in file order
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the content is not an audit export
   */
  public List<AuditEntry> read(Path source) throws IOException {
    try (InputStream in = Files.newInputStream(source)) {
      return read(in);
    }
  }

  /**
   * Reads entries from {@code in}. The stream is not closed.
   *
   * @param in JSON array of entries
   * @return entries in document order
   * @throws IOException when reading fails
   * @throws IllegalArgumentException when the content is not an audit export
   */
  public List<AuditEntry> read(InputStream in) throws IOException {
    try (JsonParser parser = factory.createParser(in)) {
      parser.disable(JsonParser.Feature.AUTO_CLOSE_SOURCE);
      JsonToken token = parser.nextToken();
      if (token != JsonToken.START_ARRAY) {
        throw new IllegalArgumentException("audit export must be a JSON array");
      }
      List<AuditEntry> entries = new ArrayList<>();
      while ((token = parser.nextToken()) != JsonToken.END_ARRAY) {
        if (token != JsonToken.START_OBJECT) {
          throw new IllegalArgumentException("audit export element must be an object, found " + token);
        }
        entries.add(fromMap(readObject(parser)));
      }
      return entries;
    }
  }

  private static Map<String, Object> toMap(AuditEntry entry) {
    Map<String, Object> fields = new TreeMap<>();
    fields.put("action", entry.action());
    fields.put("agent_id", entry.agentId());
    fields.put("context", entry.context());
    fields.put("entry_hash", entry.entryHash());
    fields.put("outcome", entry.outcome());
    fields.put("prev_hash", entry.prevHash());
    fields.put("seq", entry.seq());
    fields.put("timestamp", entry.timestamp());
    return fields;
  }

  @SuppressWarnings("unchecked")
  private static AuditEntry fromMap(Map<String, Object> fields) {
    Object context = fields.get("context");
    if (context != null && !(context instanceof Map)) {
      throw new IllegalArgumentException("audit entry context must be an object");
    }
    Object seq = fields.get("seq");
    if (!(seq instanceof Number number)) {
      throw new IllegalArgumentException("audit entry seq must be a number");
    }
    return new AuditEntry(
        number.longValue(),
        requireString(fields, "timestamp"),
        requireString(fields, "agent_id"),
        requireString(fields, "action"),
        (Map<String, Object>) context,
        requireString(fields, "outcome"),
        requireString(fields, "prev_hash"),
        requireString(fields, "entry_hash"));
  }

  private static String requireString(Map<String, Object> fields, String key) {
    Object value = fields.get(key);
    if (!(value instanceof String text)) {
      throw new IllegalArgumentException("audit entry field '" + key + "' must be a string");
    }
    return text;
  }

  private static Object readValue(JsonParser parser, JsonToken token) throws IOException {
    return switch (token) {
      case START_OBJECT -> readObject(parser);
      case START_ARRAY -> readArray(parser);
      case VALUE_STRING -> parser.getText();
      case VALUE_NUMBER_INT -> parser.getLongValue();
      case VALUE_NUMBER_FLOAT -> parser.getDoubleValue();
      case VALUE_TRUE -> Boolean.TRUE;
      case VALUE_FALSE -> Boolean.FALSE;
      case VALUE_NULL -> null;
      default -> throw new IllegalArgumentException("Unsupported JSON token: " + token);
    };
  }

  private static Map<String, Object> readObject(JsonParser parser) throws IOException {
    Map<String, Object> map = new LinkedHashMap<>();
    JsonToken token;
    while ((token = parser.nextToken()) != JsonToken.END_OBJECT) {
      if (token != JsonToken.FIELD_NAME) {
        throw new IllegalArgumentException("Expected field name but found " + token);
      }
      String name = parser.currentName();
      map.put(name, readValue(parser, parser.nextToken()));
    }
    return map;
  }

  private static List<Object> readArray(JsonParser parser) throws IOException {
    List<Object> list = new ArrayList<>();
    JsonToken token;
    while ((token = parser.nextToken()) != JsonToken.END_ARRAY) {
      list.add(readValue(parser, token));
    }
    return list;
  }
}
