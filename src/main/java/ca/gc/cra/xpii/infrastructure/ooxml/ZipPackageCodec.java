package ca.gc.cra.xpii.infrastructure.ooxml;

import ca.gc.cra.xpii.application.port.ArchiveException;
import ca.gc.cra.xpii.application.port.PackageCodec;
import ca.gc.cra.xpii.application.port.Workspace;
import ca.gc.cra.xpii.domain.util.Sha256;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Enumeration;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipException;
import java.util.zip.ZipFile;
import java.util.zip.ZipOutputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link PackageCodec} over {@code java.util.zip}.
 * <p><strong>Why:</strong> OOXML packages are zip containers; editing them means extracting to a directory and
 * zipping the directory back up.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Fingerprint the raw source bytes before anything is extracted.</li>
 *   <li>Reject non-zip input, packages without {@code [Content_Types].xml}, and entries escaping the workspace.</li>
 *   <li>Write members in lexicographic path order with a fixed timestamp so output is reproducible.</li>
 *   <li>Always remove the workspace after packing, and after a failed unpack.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; concurrent calls must use distinct workspace directories.</p>
 * <p><strong>Observability:</strong> Logs unpack and pack summaries at INFO.</p>
 *
 * @since 0.1.0
 */
public final class ZipPackageCodec implements PackageCodec {
  private static final Logger log = LoggerFactory.getLogger(ZipPackageCodec.class);

  /** Timestamp stamped on every packed member; the earliest DOS date. */
  static final LocalDateTime ENTRY_TIME = LocalDateTime.of(1980, 1, 1, 0, 0);

  @Override
  public Workspace unpack(Path source, Path workspaceDir) throws ArchiveException, IOException {
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(workspaceDir, "workspaceDir");
    if (!Files.isRegularFile(source)) {
      throw new NoSuchFileException(source.toString());
    }
    String fingerprint = Sha256.hex(source);
    Path root = workspaceDir.toAbsolutePath().normalize();
    Workspace.deleteTree(root);
    Files.createDirectories(root);

    boolean complete = false;
    try (ZipFile zip = new ZipFile(source.toFile())) {
      if (zip.getEntry(OoxmlNamespaces.CONTENT_TYPES_PART) == null) {
        throw new ArchiveException(source + " is not an OOXML package: missing "
            + OoxmlNamespaces.CONTENT_TYPES_PART);
      }
      int parts = extract(zip, root);
      complete = true;
      log.info("Unpacked {} ({} parts) to {} sha256={}", source, parts, root, fingerprint);
      return new Workspace(root, source, fingerprint);
    } catch (ZipException ex) {
      throw new ArchiveException("invalid zip container " + source + ": " + ex.getMessage(), ex);
    } finally {
      if (!complete) {
        discard(root);
      }
    }
  }

  @Override
  public String pack(Workspace workspace, Path output) throws IOException {
    Objects.requireNonNull(workspace, "workspace");
    Objects.requireNonNull(output, "output");
    try (workspace) {
      List<String> parts = listParts(workspace.root());
      Path target = output.toAbsolutePath().normalize();
      Path parent = target.getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(target));
           ZipOutputStream zip = new ZipOutputStream(out)) {
        zip.setMethod(ZipOutputStream.DEFLATED);
        for (String part : parts) {
          ZipEntry entry = new ZipEntry(part);
          entry.setTimeLocal(ENTRY_TIME);
          zip.putNextEntry(entry);
          Files.copy(workspace.part(part), zip);
          zip.closeEntry();
        }
      }
      String digest = Sha256.hex(target);
      log.info("Packed {} parts to {} sha256={}", parts.size(), target, digest);
      return digest;
    }
  }

  /**
   * Lists every regular file below {@code root} as a {@code /}-separated relative path, sorted.
   *
   * @param root workspace root
   * @return sorted part names
   * @throws IOException when the tree cannot be walked
   */
  static List<String> listParts(Path root) throws IOException {
    try (Stream<Path> files = Files.walk(root)) {
      return files
          .filter(Files::isRegularFile)
          .map(file -> toPartName(root.relativize(file)))
          .sorted()
          .collect(Collectors.toList());
    }
  }

  private static String toPartName(Path relative) {
    List<String> names = new ArrayList<>(relative.getNameCount());
    for (Path name : relative) {
      names.add(name.toString());
    }
    return String.join("/", names);
  }

  private static int extract(ZipFile zip, Path root) throws ArchiveException, IOException {
    int parts = 0;
    Enumeration<? extends ZipEntry> entries = zip.entries();
    while (entries.hasMoreElements()) {
      ZipEntry entry = entries.nextElement();
      Path target = resolveInside(root, entry.getName());
      if (entry.isDirectory()) {
        Files.createDirectories(target);
        continue;
      }
      Files.createDirectories(target.getParent());
      try (InputStream in = zip.getInputStream(entry)) {
        Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
      }
      parts++;
    }
    return parts;
  }

  private static Path resolveInside(Path root, String entryName) throws ArchiveException {
    Path target;
    try {
      target = root.resolve(entryName).normalize();
    } catch (InvalidPathException ex) {
      throw new ArchiveException("zip entry has an unusable name: " + entryName, ex);
    }
    if (!target.startsWith(root)) {
      throw new ArchiveException("zip entry escapes workspace: " + entryName);
    }
    return target;
  }

  private static void discard(Path root) {
    try {
      Workspace.deleteTree(root);
    } catch (IOException ex) {
      log.warn("Failed to remove partial workspace {}", root, ex);
    }
  }
}
