package ca.gc.cra.xpii.application.governance;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Operator kill switch checked at the start of every governed action.
 * <p><strong>Why:</strong> Lets a human, a monitor thread, or a signal handler stop new pipeline phases without
 * touching agent code.</p>
 * <p><strong>Thread-safety:</strong> The halt flag is an {@link AtomicBoolean}; {@link #halt} and
 * {@link #resume} may run on any thread and are visible to every later {@link #assertActive()}.</p>
 * <p><strong>Observability:</strong> Halt and resume are audited and logged at WARN/INFO.</p>
 *
 * @implNote A phase already running is not interrupted; only new phases are refused.
 * @since 0.1.0
 */
public final class OperatorControl {
  private static final Logger log = LoggerFactory.getLogger(OperatorControl.class);
  public static final String DEFAULT_HALT_REASON = "Operator emergency stop";
  public static final String DEFAULT_RESUME_REASON = "Operator resumed operations";

  private final AuditLog auditLog;
  private final AtomicBoolean halted = new AtomicBoolean();

  public OperatorControl(AuditLog auditLog) {
    this.auditLog = Objects.requireNonNull(auditLog, "auditLog");
  }

  public boolean isHalted() {
    return halted.get();
  }

  public void halt() {
    halt(DEFAULT_HALT_REASON);
  }

  /**
   * Engages the kill switch. Halting twice records two entries.
   *
   * @param reason operator-supplied reason
   */
  public void halt(String reason) {
    halted.set(true);
    auditLog.record("operator_halt", Map.of("reason", String.valueOf(reason)), "HALTED");
    log.warn("Operator halt engaged: {}", reason);
  }

  public void resume() {
    resume(DEFAULT_RESUME_REASON);
  }

  /**
   * Releases the kill switch.
   *
   * @param reason operator-supplied reason
   */
  public void resume(String reason) {
    halted.set(false);
    auditLog.record("operator_resume", Map.of("reason", String.valueOf(reason)), "RESUMED");
    log.info("Operator resumed operations: {}", reason);
  }

  /**
   * Refuses to proceed while halted.
   *
   * @throws OperationBlockedException when the kill switch is engaged
   */
  public void assertActive() throws OperationBlockedException {
    if (halted.get()) {
      throw new OperationBlockedException(
          "Operation blocked: operator kill-switch is active. Human authorization required to resume.");
    }
  }

  /**
   * Like {@link #assertActive()}, but records the refused action before throwing.
   *
   * @param action action that was attempted
   * @throws OperationBlockedException when the kill switch is engaged
   */
  public void assertActive(String action) throws OperationBlockedException {
    try {
      assertActive();
    } catch (OperationBlockedException ex) {
      auditLog.record("operator_blocked", Map.of("attempted_action", action), "BLOCKED");
      log.warn("Blocked {} while operator halt is engaged", action);
      throw ex;
    }
  }
}
