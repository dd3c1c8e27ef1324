package ca.gc.cra.xpii.application.governance;

import ca.gc.cra.xpii.domain.governance.AuditEntry;
import ca.gc.cra.xpii.domain.util.Sha256;
import java.util.List;
import java.util.Objects;

/**
 * Hashing and replay of the audit hash chain.
 *
 * <p>Works on any ordered list of entries, so a log exported to disk and read back can be checked the same way as
 * the live {@link AuditLog}.
 *
 * @since 0.1.0
 */
public final class AuditChain {
  private AuditChain() {}

  /**
   * Computes the hash an entry must carry.
   *
   * @param entry entry to hash; its own {@code entryHash} is ignored
   * @return SHA-256 hex over the canonical serialization
   */
  public static String computeHash(AuditEntry entry) {
    return Sha256.hex(CanonicalJson.hashInput(entry));
  }

  /**
   * Replays {@code entries} in order.
   *
   * <p>For each entry the hash is recomputed from its stored fields and compared with the stored hash, and the
   * stored previous-hash link is compared with the hash of the entry before it. The first mismatch stops the
   * replay.
   *
   * @param entries entries in sequence order
   * @return report naming the first broken entry, if any
   */
  public static ChainReport inspect(List<AuditEntry> entries) {
    Objects.requireNonNull(entries, "entries");
    String previous = AuditEntry.GENESIS;
    int verified = 0;
    for (AuditEntry entry : entries) {
      String computed = computeHash(entry);
      if (!computed.equals(entry.entryHash())) {
        return new ChainReport(entries.size(), verified, entry.seq(), computed, entry.entryHash());
      }
      if (!previous.equals(entry.prevHash())) {
        return new ChainReport(entries.size(), verified, entry.seq(), previous, entry.prevHash());
      }
      previous = computed;
      verified++;
    }
    return ChainReport.intact(entries.size());
  }

  /**
   * Shorthand for {@code inspect(entries).isIntact()}.
   *
   * @param entries entries in sequence order
   * @return {@code true} when empty or fully consistent
   */
  public static boolean verify(List<AuditEntry> entries) {
    return inspect(entries).isIntact();
  }
}
