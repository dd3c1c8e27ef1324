package ca.gc.cra.xpii.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PathsTest {

  @TempDir Path tempDir;

  @Test
  void requireWritableDirCreatesMissingDirectory() {
    Path dir = tempDir.resolve("work/nested");
    Path validated = Paths.requireWritableDir(dir);
    assertTrue(Files.isDirectory(validated));
  }

  @Test
  void requireWritableDirReturnsCanonicalPath() throws IOException {
    Path dir = Files.createDirectory(tempDir.resolve("existing"));
    assertEquals(dir.toRealPath(), Paths.requireWritableDir(dir));
  }

  @Test
  void requireWritableDirRejectsRegularFile() throws IOException {
    Path file = Files.writeString(tempDir.resolve("file.txt"), "x");
    assertThrows(IllegalArgumentException.class, () -> Paths.requireWritableDir(file));
  }

  @Test
  void resolveWithinKeepsChildrenInsideBase() {
    Path resolved = Paths.resolveWithin(tempDir, "session-1");
    assertEquals(tempDir.toAbsolutePath().normalize().resolve("session-1"), resolved);
    assertThrows(IllegalArgumentException.class, () -> Paths.resolveWithin(tempDir, "../outside"));
    assertThrows(IllegalArgumentException.class, () -> Paths.resolveWithin(tempDir, "."));
  }
}
