package ca.gc.cra.xpii.application.governance;

import ca.gc.cra.xpii.application.port.StaplerException;
import java.util.List;

/**
 * Thrown when one or more policies deny a governed action. The denial is already in the audit log.
 *
 * @since 0.1.0
 */
public final class PolicyDeniedException extends StaplerException {
  private final String action;
  private final List<String> failures;

  /**
   * Creates an exception for a denied action.
   *
   * @param action action label
   * @param failures formatted policy failures
   */
  public PolicyDeniedException(String action, List<String> failures) {
    super("Policy denied '" + action + "': " + String.join("; ", failures));
    this.action = action;
    this.failures = List.copyOf(failures);
  }

  public String action() {
    return action;
  }

  public List<String> failures() {
    return failures;
  }
}
