package ca.gc.cra.xpii.application.governance;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class GovernanceStackTest {

  @Test
  void componentsShareOneAuditLog() {
    GovernanceStack stack = GovernanceStack.create();

    assertEquals(GovernanceStack.DEFAULT_AGENT_NAME, stack.identity().name());
    assertSame(stack.identity(), stack.auditLog().identity());

    stack.operatorControl().halt("t");
    stack.policyEngine().evaluate("noop", null);

    assertEquals(2, stack.auditLog().size());
    assertTrue(stack.auditLog().verifyChain());
  }
}
