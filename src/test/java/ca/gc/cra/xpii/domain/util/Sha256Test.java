package ca.gc.cra.xpii.domain.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class Sha256Test {
  private static final String EMPTY = "e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855";
  private static final String ABC = "ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad";

  @TempDir Path tempDir;

  @Test
  void hexMatchesKnownVectors() {
    assertEquals(EMPTY, Sha256.hex(""));
    assertEquals(ABC, Sha256.hex("abc"));
  }

  @Test
  void streamingHashSpansSeveralBuffers() throws IOException {
    byte[] data = new byte[Sha256.BUFFER_SIZE * 3 + 17];
    Arrays.fill(data, (byte) 'x');
    Path file = Files.write(tempDir.resolve("blob.bin"), data);

    String expected = Sha256.hex(data);
    assertEquals(expected, Sha256.hex(file));
    assertEquals(expected, Sha256.hex(new ByteArrayInputStream(data)));
  }

  @Test
  void isDigestAcceptsOnlySixtyFourHexCharacters() {
    assertTrue(Sha256.isDigest(ABC));
    assertFalse(Sha256.isDigest(ABC.substring(1)));
    assertFalse(Sha256.isDigest(ABC.replace('a', 'g')));
    assertFalse(Sha256.isDigest(null));
  }
}
