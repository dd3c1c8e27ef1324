package ca.gc.cra.xpii.application.port;

import java.io.IOException;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Port converting between an OOXML zip container and a working directory tree.
 * <p><strong>Role:</strong> First and last phase of the unpack, inject, pack pipeline.</p>
 * <p><strong>Thread-safety:</strong> Implementations are stateless; callers must not share a workspace directory
 * between concurrent invocations.</p>
 *
 * @since 0.1.0
 */
public interface PackageCodec {
  /**
   * Fingerprints {@code source} and extracts it into {@code workspaceDir}, replacing anything already there.
   *
   * @param source package to extract
   * @param workspaceDir directory that will hold the extracted parts; created if absent
   * @return handle owning the populated workspace
   * @throws ArchiveException when {@code source} is not a valid OOXML zip container
   * @throws IOException when the filesystem operation fails
   */
  Workspace unpack(Path source, Path workspaceDir) throws ArchiveException, IOException;

  /**
   * Writes every file of the workspace into a new zip at {@code output}, then destroys the workspace.
   *
   * <p>Packing byte-identical workspaces produces byte-identical archives.
   *
   * @param workspace unpacked package; closed on return whether or not packing succeeded
   * @param output destination archive; replaced if present
   * @return SHA-256 hex of the written archive
   * @throws IOException when writing fails
   */
  String pack(Workspace workspace, Path output) throws IOException;
}
