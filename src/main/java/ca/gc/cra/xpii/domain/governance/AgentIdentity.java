package ca.gc.cra.xpii.domain.governance;

import ca.gc.cra.xpii.domain.util.Sha256;
import java.security.SecureRandom;
import java.time.Instant;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * <strong>What:</strong> Cryptographically unique identity of the agent acting on packages in one session.
 * <p><strong>Why:</strong> Every audit entry and policy decision is attributed to a verifiable actor, always
 * distinguishable from human users by the {@code AGENT:} prefix.</p>
 * <p><strong>Thread-safety:</strong> Immutable apart from the revocation flag, which is atomic and one-way.</p>
 *
 * @since 0.1.0
 */
public final class AgentIdentity {
  /** Prefix of every agent identifier. */
  public static final String AGENT_PREFIX = "AGENT";

  private static final int SEED_BYTES = 16;
  private static final int ID_HASH_CHARS = 16;

  private final String name;
  private final String seed;
  private final String identityHash;
  private final Instant createdAt;
  private final AtomicBoolean revoked = new AtomicBoolean();

  private AgentIdentity(String name, String seed, Instant createdAt) {
    this.name = name;
    this.seed = seed;
    this.identityHash = hashOf(name, seed);
    this.createdAt = createdAt;
  }

  /**
   * Creates an identity seeded from a fresh 128-bit random value.
   *
   * @param name agent name; must not be {@code null} or blank
   * @return new identity
   */
  public static AgentIdentity create(String name) {
    return create(name, new SecureRandom(), Instant.now());
  }

  /**
   * Creates an identity from an explicit random source and creation time.
   *
   * @param name agent name; must not be {@code null} or blank
   * @param random seed source
   * @param createdAt creation instant
   * @return new identity
   */
  public static AgentIdentity create(String name, SecureRandom random, Instant createdAt) {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(random, "random");
    Objects.requireNonNull(createdAt, "createdAt");
    if (name.isBlank()) {
      throw new IllegalArgumentException("agent name must not be blank");
    }
    byte[] seedBytes = new byte[SEED_BYTES];
    random.nextBytes(seedBytes);
    return new AgentIdentity(name, HexFormat.of().formatHex(seedBytes), createdAt);
  }

  /**
   * Returns the public identifier, {@code AGENT:} followed by 16 hex characters of the identity hash.
   *
   * @return identity identifier
   */
  public String identityId() {
    return AGENT_PREFIX + ":" + identityHash.substring(0, ID_HASH_CHARS);
  }

  public String name() {
    return name;
  }

  public Instant createdAt() {
    return createdAt;
  }

  public boolean isRevoked() {
    return revoked.get();
  }

  /**
   * Revokes this identity. There is no way back; every later {@link #verify()} fails.
   */
  public void revoke() {
    revoked.set(true);
  }

  /**
   * Recomputes the identity hash from the stored name and seed.
   *
   * @return {@code false} when revoked or when the recomputed hash disagrees with the stored one
   */
  public boolean verify() {
    if (revoked.get()) {
      return false;
    }
    return identityHash.equals(hashOf(name, seed));
  }

  /**
   * Describes the identity for audit export.
   *
   * @return ordered map with {@code identity_id}, {@code name}, {@code created_at} and {@code revoked}
   */
  public Map<String, Object> describe() {
    Map<String, Object> view = new LinkedHashMap<>();
    view.put("identity_id", identityId());
    view.put("name", name);
    view.put("created_at", createdAt.toString());
    view.put("revoked", revoked.get());
    return view;
  }

  @Override
  public String toString() {
    return identityId();
  }

  private static String hashOf(String name, String seed) {
    return Sha256.hex(AGENT_PREFIX + ":" + name + ":" + seed);
  }
}
