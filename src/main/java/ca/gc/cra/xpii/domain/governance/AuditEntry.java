package ca.gc.cra.xpii.domain.governance;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One link of the audit hash chain.
 *
 * <p>{@code entryHash} is the SHA-256 of the canonical serialization of every other field; {@code prevHash} is
 * the {@code entryHash} of the previous entry, or {@link #GENESIS} for the first one. The context map is deep
 * copied into unmodifiable collections on construction; integral numbers are widened to {@link Long}.
 *
 * @param seq position in the log, starting at 0
 * @param timestamp ISO-8601 UTC instant of recording
 * @param agentId identifier of the acting agent
 * @param action action label, for example {@code unpack} or {@code policy_evaluate:staple}
 * @param context forensic context; values are strings, numbers, booleans, lists or nested maps
 * @param outcome outcome label, for example {@code OK}, {@code DENIED} or {@code FAILED: ...}
 * @param prevHash hash of the previous entry
 * @param entryHash hash of this entry
 * @since 0.1.0
 */
public record AuditEntry(
    long seq,
    String timestamp,
    String agentId,
    String action,
    Map<String, Object> context,
    String outcome,
    String prevHash,
    String entryHash) {
  /** {@code prevHash} of the first entry. */
  public static final String GENESIS = "GENESIS";

  public AuditEntry {
    if (seq < 0) {
      throw new IllegalArgumentException("seq must be >= 0");
    }
    Objects.requireNonNull(timestamp, "timestamp");
    Objects.requireNonNull(agentId, "agentId");
    Objects.requireNonNull(action, "action");
    Objects.requireNonNull(outcome, "outcome");
    Objects.requireNonNull(prevHash, "prevHash");
    Objects.requireNonNull(entryHash, "entryHash");
    context = freezeMap(context == null ? Map.of() : context);
  }

  /**
   * Returns a copy with a different outcome and the same hashes, as a tampered entry would look.
   *
   * @param newOutcome replacement outcome
   * @return altered copy
   */
  public AuditEntry withOutcome(String newOutcome) {
    return new AuditEntry(seq, timestamp, agentId, action, context, newOutcome, prevHash, entryHash);
  }

  private static Map<String, Object> freezeMap(Map<?, ?> source) {
    Map<String, Object> copy = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : source.entrySet()) {
      copy.put(String.valueOf(entry.getKey()), freeze(entry.getValue()));
    }
    return Collections.unmodifiableMap(copy);
  }

  private static Object freeze(Object value) {
    if (value instanceof Map<?, ?> map) {
      return freezeMap(map);
    }
    if (value instanceof Iterable<?> iterable) {
      List<Object> copy = new ArrayList<>();
      for (Object item : iterable) {
        copy.add(freeze(item));
      }
      return Collections.unmodifiableList(copy);
    }
    if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
      return ((Number) value).longValue();
    }
    if (value == null || value instanceof String || value instanceof Number || value instanceof Boolean) {
      return value;
    }
    return value.toString();
  }
}
