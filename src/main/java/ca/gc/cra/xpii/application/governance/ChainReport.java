package ca.gc.cra.xpii.application.governance;

/**
 * Result of replaying an audit hash chain.
 *
 * @param entries number of entries examined
 * @param verified number of leading entries whose links were intact
 * @param brokenAtSeq sequence number of the first broken entry, or {@code -1} when the chain is intact
 * @param expectedHash hash the broken entry should carry (recomputed), or empty
 * @param actualHash hash (or previous-hash link) actually stored on the broken entry, or empty
 * @since 0.1.0
 */
public record ChainReport(
    int entries, int verified, long brokenAtSeq, String expectedHash, String actualHash) {

  static ChainReport intact(int entries) {
    return new ChainReport(entries, entries, -1L, "", "");
  }

  public boolean isIntact() {
    return brokenAtSeq < 0;
  }
}
