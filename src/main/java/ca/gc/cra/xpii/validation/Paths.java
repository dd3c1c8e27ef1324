package ca.gc.cra.xpii.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Filesystem validation for the workspace root under which packages are unpacked.
 * <p><strong>Why:</strong> Unpacking deletes and recreates session directories, so the root must be a real,
 * writable directory and session directories must stay inside it.</p>
 * <p><strong>Thread-safety:</strong> Stateless; filesystem state may change between checks.</p>
 *
 * @implNote Checks use {@link LinkOption#NOFOLLOW_LINKS} so a symlinked root is resolved before use.
 * @since 0.1.0
 * @see Strings
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Validates (creating when missing) a writable directory.
   *
   * @param path candidate directory; must not be {@code null}
   * @return canonical directory path
   * @throws IllegalArgumentException if the path contains control characters, is not a directory, is not writable,
   *     or cannot be created
   */
  public static Path requireWritableDir(Path path) {
    if (path == null) {
      throw new IllegalArgumentException("path must not be null");
    }
    String raw = path.toString();
    for (int i = 0; i < raw.length(); i++) {
      if (Character.isISOControl(raw.charAt(i))) {
        throw new IllegalArgumentException("path must not contain control characters");
      }
    }
    Path normalized = path.toAbsolutePath().normalize();
    try {
      Files.createDirectories(normalized);
      Path real = normalized.toRealPath();
      if (!Files.isDirectory(real, LinkOption.NOFOLLOW_LINKS)) {
        throw new IllegalArgumentException("path is not a directory: " + real);
      }
      if (!Files.isWritable(real)) {
        throw new IllegalArgumentException("directory is not writable: " + real);
      }
      return real;
    } catch (IOException ex) {
      throw new IllegalArgumentException("unable to validate directory " + normalized + ": " + ex.getMessage(), ex);
    }
  }

  /**
   * Resolves {@code child} under {@code base} and rejects results that escape it.
   *
   * @param base directory that must contain the result
   * @param child relative name
   * @return normalized path inside {@code base}
   * @throws IllegalArgumentException if the result is {@code base} itself or lies outside it
   */
  public static Path resolveWithin(Path base, String child) {
    Path normalizedBase = base.toAbsolutePath().normalize();
    Path resolved = normalizedBase.resolve(child).normalize();
    if (!resolved.startsWith(normalizedBase) || resolved.equals(normalizedBase)) {
      throw new IllegalArgumentException("path " + resolved + " escapes allowed base " + normalizedBase);
    }
    return resolved;
  }
}
