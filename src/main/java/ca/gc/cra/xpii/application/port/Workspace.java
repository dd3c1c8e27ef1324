package ca.gc.cra.xpii.application.port;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * <strong>What:</strong> Handle to an ephemeral directory holding one unpacked package.
 * <p><strong>Why:</strong> Carries the fingerprint of the original input from unpack to inject, and owns the
 * directory so that it is removed exactly once whether the pipeline succeeds or fails.</p>
 * <p><strong>Thread-safety:</strong> Owned by a single pipeline invocation; {@link #close()} is idempotent.</p>
 *
 * @since 0.1.0
 */
public final class Workspace implements AutoCloseable {
  private final Path root;
  private final Path source;
  private final String sourceSha256;
  private final AtomicBoolean closed = new AtomicBoolean();

  /**
   * Creates a handle over an already populated directory.
   *
   * @param root workspace directory
   * @param source package the workspace was extracted from
   * @param sourceSha256 SHA-256 hex of the source package bytes
   */
  public Workspace(Path root, Path source, String sourceSha256) {
    this.root = Objects.requireNonNull(root, "root");
    this.source = Objects.requireNonNull(source, "source");
    this.sourceSha256 = Objects.requireNonNull(sourceSha256, "sourceSha256");
  }

  public Path root() {
    return root;
  }

  public Path source() {
    return source;
  }

  /**
   * Returns the fingerprint of the original input package, computed once at unpack time.
   *
   * @return 64-character SHA-256 hex
   */
  public String sourceSha256() {
    return sourceSha256;
  }

  /**
   * Resolves a package-relative part name ({@code /} separated) inside the workspace.
   *
   * @param partName part name such as {@code docProps/core.xml}
   * @return filesystem path of the part (which may not exist)
   */
  public Path part(String partName) {
    Path resolved = root;
    for (String segment : partName.split("/")) {
      if (!segment.isEmpty()) {
        resolved = resolved.resolve(segment);
      }
    }
    return resolved;
  }

  public boolean isClosed() {
    return closed.get();
  }

  /**
   * Deletes the workspace directory tree. Later calls do nothing.
   *
   * @throws UncheckedIOException when the tree cannot be removed
   */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    try {
      deleteTree(root);
    } catch (IOException ex) {
      throw new UncheckedIOException("failed to remove workspace " + root, ex);
    }
  }

  /**
   * Recursively deletes {@code dir} when it exists. Symbolic links are removed, never followed.
   *
   * @param dir directory to delete
   * @throws IOException when deletion fails
   */
  public static void deleteTree(Path dir) throws IOException {
    if (!Files.exists(dir, LinkOption.NOFOLLOW_LINKS)) {
      return;
    }
    Files.walkFileTree(dir, new SimpleFileVisitor<>() {
      @Override
      public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
        Files.delete(file);
        return FileVisitResult.CONTINUE;
      }

      @Override
      public FileVisitResult postVisitDirectory(Path visited, IOException exc) throws IOException {
        if (exc != null) {
          throw exc;
        }
        Files.delete(visited);
        return FileVisitResult.CONTINUE;
      }
    });
  }
}
