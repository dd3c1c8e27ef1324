package ca.gc.cra.xpii.domain.provenance;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.xpii.domain.util.Sha256;
import java.util.Locale;
import org.junit.jupiter.api.Test;

class RevisionMarkerTest {

  @Test
  void deriveIsFirstEightUppercaseHexOfSessionHash() {
    String marker = RevisionMarker.derive("2026-XPII-001");

    assertEquals(Sha256.hex("2026-XPII-001").substring(0, 8).toUpperCase(Locale.ROOT), marker);
    assertTrue(marker.matches("[0-9A-F]{8}"));
  }

  @Test
  void deriveIsStableAndSessionSpecific() {
    assertEquals(RevisionMarker.derive("session-a"), RevisionMarker.derive("session-a"));
    assertNotEquals(RevisionMarker.derive("session-a"), RevisionMarker.derive("session-b"));
  }
}
