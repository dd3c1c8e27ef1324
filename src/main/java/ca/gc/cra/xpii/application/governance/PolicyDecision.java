package ca.gc.cra.xpii.application.governance;

import java.util.List;

/**
 * Aggregate verdict of every registered policy.
 *
 * @param allowed {@code true} when no policy denied
 * @param failures formatted reasons, {@code [POLICY:<name>] <reason>}, in evaluation order
 * @since 0.1.0
 */
public record PolicyDecision(boolean allowed, List<String> failures) {
  public PolicyDecision {
    failures = failures == null ? List.of() : List.copyOf(failures);
  }

  /**
   * Throws when the decision denied the action.
   *
   * @param action action that was evaluated
   * @throws PolicyDeniedException carrying the failure list when not allowed
   */
  public void requireAllowed(String action) throws PolicyDeniedException {
    if (!allowed) {
      throw new PolicyDeniedException(action, failures);
    }
  }
}
