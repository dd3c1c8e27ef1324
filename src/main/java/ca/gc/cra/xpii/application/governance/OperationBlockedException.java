package ca.gc.cra.xpii.application.governance;

import ca.gc.cra.xpii.application.port.StaplerException;

/**
 * Thrown when a governed action is attempted while the operator kill switch is engaged.
 *
 * @since 0.1.0
 */
public final class OperationBlockedException extends StaplerException {
  public OperationBlockedException(String message) {
    super(message);
  }
}
