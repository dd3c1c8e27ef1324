package ca.gc.cra.xpii.application.governance;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.xpii.domain.governance.AuditEntry;
import java.util.List;
import org.junit.jupiter.api.Test;

class OperatorControlTest {

  @Test
  void haltBlocksAndResumeReleases() {
    GovernanceStack stack = GovernanceStack.create("agent");
    OperatorControl control = stack.operatorControl();

    assertFalse(control.isHalted());
    assertDoesNotThrow(() -> control.assertActive());

    control.halt("maintenance");
    assertTrue(control.isHalted());
    assertThrows(OperationBlockedException.class, () -> control.assertActive());

    control.resume();
    assertFalse(control.isHalted());
    assertDoesNotThrow(() -> control.assertActive());

    List<AuditEntry> entries = stack.auditLog().export();
    assertEquals("operator_halt", entries.get(0).action());
    assertEquals("HALTED", entries.get(0).outcome());
    assertEquals("maintenance", entries.get(0).context().get("reason"));
    assertEquals("operator_resume", entries.get(1).action());
    assertEquals("RESUMED", entries.get(1).outcome());
  }

  @Test
  void repeatedHaltRecordsEachTime() {
    GovernanceStack stack = GovernanceStack.create();
    stack.operatorControl().halt();
    stack.operatorControl().halt();

    assertEquals(2, stack.auditLog().size());
    assertEquals(OperatorControl.DEFAULT_HALT_REASON, stack.auditLog().export().get(1).context().get("reason"));
  }

  @Test
  void blockedAttemptIsAuditedBeforeThrowing() {
    GovernanceStack stack = GovernanceStack.create("agent");
    stack.operatorControl().halt();

    assertThrows(OperationBlockedException.class, () -> stack.operatorControl().assertActive("unpack"));

    AuditEntry blocked = stack.auditLog().export().get(1);
    assertEquals("operator_blocked", blocked.action());
    assertEquals("BLOCKED", blocked.outcome());
    assertEquals("unpack", blocked.context().get("attempted_action"));
  }

  @Test
  void haltFromAnotherThreadIsVisible() throws InterruptedException {
    GovernanceStack stack = GovernanceStack.create("agent");
    Thread operator = new Thread(() -> stack.operatorControl().halt("remote"));
    operator.start();
    operator.join();

    assertThrows(OperationBlockedException.class, () -> stack.operatorControl().assertActive());
  }
}
