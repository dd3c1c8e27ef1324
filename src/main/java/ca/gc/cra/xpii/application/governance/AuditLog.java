package ca.gc.cra.xpii.application.governance;

import ca.gc.cra.xpii.application.port.ClockPort;
import ca.gc.cra.xpii.domain.governance.AgentIdentity;
import ca.gc.cra.xpii.domain.governance.AuditEntry;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Append-only, hash-chained ledger of every governed action.
 * <p><strong>Why:</strong> Provides a forensic trail in which altering any historical entry is detectable by
 * recomputation.</p>
 * <p><strong>Thread-safety:</strong> {@link #record} and {@link #export} are mutually exclusive under a single
 * lock. Entries are immutable, so no finer locking is needed.</p>
 * <p><strong>Performance:</strong> Appends hash one small JSON document; {@link #verifyChain()} is O(n).</p>
 * <p><strong>Observability:</strong> Each append is logged at DEBUG.</p>
 *
 * @since 0.1.0
 */
public final class AuditLog {
  private static final Logger log = LoggerFactory.getLogger(AuditLog.class);

  private final AgentIdentity identity;
  private final ClockPort clock;
  private final Object lock = new Object();
  private final List<AuditEntry> entries = new ArrayList<>();
  private String chainHead = AuditEntry.GENESIS;

  /**
   * Creates a log whose entries are attributed to {@code identity}, stamped by the system clock.
   *
   * @param identity acting agent
   */
  public AuditLog(AgentIdentity identity) {
    this(identity, ClockPort.SYSTEM);
  }

  /**
   * Creates a log with an explicit clock.
   *
   * @param identity acting agent
   * @param clock timestamp source
   */
  public AuditLog(AgentIdentity identity, ClockPort clock) {
    this.identity = Objects.requireNonNull(identity, "identity");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Appends an entry with outcome {@code OK}.
   *
   * @param action action label
   * @param context forensic context; may be {@code null}
   * @return the appended entry
   */
  public AuditEntry record(String action, Map<String, ?> context) {
    return record(action, context, "OK");
  }

  /**
   * Appends an entry chained to the current head.
   *
   * @param action action label; must not be {@code null}
   * @param context forensic context; may be {@code null}; deep-copied
   * @param outcome outcome label; must not be {@code null}
   * @return the appended (immutable) entry
   */
  public AuditEntry record(String action, Map<String, ?> context, String outcome) {
    Objects.requireNonNull(action, "action");
    Objects.requireNonNull(outcome, "outcome");
    Map<String, ?> ctx = context == null ? Map.of() : context;
    synchronized (lock) {
      AuditEntry unsigned = new AuditEntry(
          entries.size(),
          clock.now().toString(),
          identity.identityId(),
          action,
          new LinkedHashMap<>(ctx),
          outcome,
          chainHead,
          "");
      AuditEntry entry = new AuditEntry(
          unsigned.seq(),
          unsigned.timestamp(),
          unsigned.agentId(),
          unsigned.action(),
          unsigned.context(),
          unsigned.outcome(),
          unsigned.prevHash(),
          AuditChain.computeHash(unsigned));
      entries.add(entry);
      chainHead = entry.entryHash();
      log.debug("audit seq={} action={} outcome={}", entry.seq(), action, outcome);
      return entry;
    }
  }

  /**
   * Replays the chain from the first entry.
   *
   * @return {@code true} when the log is empty or every entry and link is intact
   */
  public boolean verifyChain() {
    return AuditChain.verify(export());
  }

  /**
   * Returns an immutable snapshot of all entries in sequence order.
   *
   * @return snapshot copy; later appends are not reflected
   */
  public List<AuditEntry> export() {
    synchronized (lock) {
      return List.copyOf(entries);
    }
  }

  /**
   * Returns the number of entries recorded so far.
   *
   * @return entry count
   */
  public int size() {
    synchronized (lock) {
      return entries.size();
    }
  }

  public AgentIdentity identity() {
    return identity;
  }
}
