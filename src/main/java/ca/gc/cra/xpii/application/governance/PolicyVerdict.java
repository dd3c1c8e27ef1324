package ca.gc.cra.xpii.application.governance;

import java.util.Objects;

/**
 * Verdict of a single policy.
 *
 * @param allowed whether the policy permits the action
 * @param reason human-readable explanation
 * @since 0.1.0
 */
public record PolicyVerdict(boolean allowed, String reason) {
  public PolicyVerdict {
    Objects.requireNonNull(reason, "reason");
  }

  public static PolicyVerdict allow(String reason) {
    return new PolicyVerdict(true, reason);
  }

  public static PolicyVerdict deny(String reason) {
    return new PolicyVerdict(false, reason);
  }
}
