package ca.gc.cra.xpii.domain.util;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;

/**
 * <strong>What:</strong> SHA-256 helpers producing lower-case hexadecimal digests.
 * <p><strong>Why:</strong> Package fingerprints, revision markers, agent identities and audit chain links all
 * hash with the same primitive and encoding.</p>
 * <p><strong>Thread-safety:</strong> Digests are held per thread; safe for concurrent use.</p>
 * <p><strong>Performance:</strong> Files are streamed through a fixed {@value #BUFFER_SIZE}-byte buffer so large
 * packages never load fully into memory.</p>
 *
 * @since 0.1.0
 */
public final class Sha256 {
  /** Chunk size used when streaming file content into the digest. */
  public static final int BUFFER_SIZE = 8192;
  /** Length of a hex-encoded SHA-256 digest. */
  public static final int HEX_LENGTH = 64;

  private static final ThreadLocal<MessageDigest> DIGEST = ThreadLocal.withInitial(Sha256::initSha256);
  private static final HexFormat HEX = HexFormat.of();

  private Sha256() {}

  /**
   * Hashes the UTF-8 encoding of {@code value}.
   *
   * @param value text to hash; must not be {@code null}
   * @return 64-character lower-case hex digest
   */
  public static String hex(String value) {
    Objects.requireNonNull(value, "value");
    return hex(value.getBytes(StandardCharsets.UTF_8));
  }

  /**
   * Hashes a byte array.
   *
   * @param data bytes to hash; must not be {@code null}
   * @return 64-character lower-case hex digest
   */
  public static String hex(byte[] data) {
    Objects.requireNonNull(data, "data");
    MessageDigest digest = DIGEST.get();
    digest.reset();
    return HEX.formatHex(digest.digest(data));
  }

  /**
   * Streams a file through the digest.
   *
   * @param file file to hash; must exist and be readable
   * @return 64-character lower-case hex digest of the raw file bytes
   * @throws IOException when the file cannot be read
   */
  public static String hex(Path file) throws IOException {
    Objects.requireNonNull(file, "file");
    try (InputStream in = Files.newInputStream(file)) {
      return hex(in);
    }
  }

  /**
   * Streams {@code in} to exhaustion through the digest. The stream is not closed.
   *
   * @param in source stream
   * @return 64-character lower-case hex digest
   * @throws IOException when reading fails
   */
  public static String hex(InputStream in) throws IOException {
    Objects.requireNonNull(in, "in");
    MessageDigest digest = DIGEST.get();
    digest.reset();
    byte[] buffer = new byte[BUFFER_SIZE];
    int read;
    while ((read = in.read(buffer)) != -1) {
      digest.update(buffer, 0, read);
    }
    return HEX.formatHex(digest.digest());
  }

  /**
   * Returns whether {@code value} looks like a hex-encoded SHA-256 digest.
   *
   * @param value candidate; may be {@code null}
   * @return {@code true} for exactly 64 hexadecimal characters
   */
  public static boolean isDigest(String value) {
    if (value == null || value.length() != HEX_LENGTH) {
      return false;
    }
    for (int i = 0; i < value.length(); i++) {
      if (Character.digit(value.charAt(i), 16) < 0) {
        return false;
      }
    }
    return true;
  }

  private static MessageDigest initSha256() {
    try {
      return MessageDigest.getInstance("SHA-256");
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException("SHA-256 not available", ex);
    }
  }
}
