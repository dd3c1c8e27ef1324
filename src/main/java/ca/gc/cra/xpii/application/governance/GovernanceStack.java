package ca.gc.cra.xpii.application.governance;

import ca.gc.cra.xpii.application.port.ClockPort;
import ca.gc.cra.xpii.domain.governance.AgentIdentity;
import java.util.Objects;

/**
 * Identity, audit log, policy engine and operator control wired for one agent session.
 *
 * @param identity acting agent
 * @param auditLog ledger shared by the other components
 * @param policyEngine policy gate recording to {@code auditLog}
 * @param operatorControl kill switch recording to {@code auditLog}
 * @since 0.1.0
 */
public record GovernanceStack(
    AgentIdentity identity,
    AuditLog auditLog,
    PolicyEngine policyEngine,
    OperatorControl operatorControl) {
  /** Agent name used when none is configured. */
  public static final String DEFAULT_AGENT_NAME = "XPII-STAPLER";

  public GovernanceStack {
    Objects.requireNonNull(identity, "identity");
    Objects.requireNonNull(auditLog, "auditLog");
    Objects.requireNonNull(policyEngine, "policyEngine");
    Objects.requireNonNull(operatorControl, "operatorControl");
  }

  public static GovernanceStack create() {
    return create(DEFAULT_AGENT_NAME);
  }

  public static GovernanceStack create(String agentName) {
    return create(agentName, ClockPort.SYSTEM);
  }

  /**
   * Creates a fresh identity and wires the components around it.
   *
   * @param agentName agent name
   * @param clock clock for audit timestamps
   * @return wired stack
   */
  public static GovernanceStack create(String agentName, ClockPort clock) {
    AgentIdentity identity = AgentIdentity.create(agentName);
    AuditLog auditLog = new AuditLog(identity, clock);
    return new GovernanceStack(identity, auditLog, new PolicyEngine(auditLog), new OperatorControl(auditLog));
  }
}
