package ca.gc.cra.xpii.application.governance;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.xpii.domain.governance.AgentIdentity;
import ca.gc.cra.xpii.domain.governance.AuditEntry;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PolicyEngineTest {
  private AgentIdentity identity;
  private AuditLog auditLog;
  private PolicyEngine engine;

  @BeforeEach
  void setUp() {
    identity = AgentIdentity.create("agent");
    auditLog = new AuditLog(identity);
    engine = new PolicyEngine(auditLog);
  }

  @Test
  void builtinsRegisteredInOrder() {
    assertEquals(
        List.of("identity_must_be_valid", "no_empty_author", "no_path_traversal"), engine.policyNames());
  }

  @Test
  void reRegisteringReplacesPolicyInPlace() {
    List<String> invoked = new ArrayList<>();
    engine.register(BuiltinPolicies.NO_EMPTY_AUTHOR, ctx -> {
      invoked.add("override");
      return PolicyVerdict.allow("authorless staples permitted");
    });

    PolicyDecision decision = engine.evaluate("staple", context("", "in.docx", "out.docx"));

    assertTrue(decision.allowed(), decision.failures().toString());
    assertEquals(List.of("override"), invoked);
    assertEquals(
        List.of("identity_must_be_valid", "no_empty_author", "no_path_traversal"), engine.policyNames());
    assertEquals(3L, ((Number) auditLog.export().get(0).context().get("policy_count")).longValue());
  }

  @Test
  void validContextAllowedAndAudited() {
    PolicyDecision decision = engine.evaluate("staple", context("Axiom", "in.docx", "out.docx"));

    assertTrue(decision.allowed());
    assertTrue(decision.failures().isEmpty());
    AuditEntry entry = auditLog.export().get(0);
    assertEquals("policy_evaluate:staple", entry.action());
    assertEquals("ALLOWED", entry.outcome());
    assertEquals(3L, ((Number) entry.context().get("policy_count")).longValue());
    assertEquals(List.of(), entry.context().get("failures"));
  }

  @Test
  void emptyAuthorDeniedNamingPolicy() {
    PolicyDecision decision = engine.evaluate("staple", context("   ", "in.docx", "out.docx"));

    assertFalse(decision.allowed());
    assertEquals(1, decision.failures().size());
    assertTrue(decision.failures().get(0).startsWith("[POLICY:no_empty_author] "));
    assertEquals("DENIED", auditLog.export().get(0).outcome());

    PolicyDeniedException ex =
        assertThrows(PolicyDeniedException.class, () -> decision.requireAllowed("staple"));
    assertEquals("staple", ex.action());
    assertEquals(decision.failures(), ex.failures());
  }

  @Test
  void pathTraversalDeniedForInputOrOutput() {
    assertFalse(engine.evaluate("staple", context("a", "../secret.docx", "out.docx")).allowed());
    PolicyDecision decision = engine.evaluate("staple", context("a", "in.docx", "x/../../out.docx"));
    assertTrue(decision.failures().get(0).contains("output_path"));
  }

  @Test
  void revokedOrMissingIdentityDenied() {
    identity.revoke();
    PolicyDecision revoked = engine.evaluate("staple", context("a", "in.docx", "out.docx"));
    assertTrue(revoked.failures().get(0).startsWith("[POLICY:identity_must_be_valid]"));

    Map<String, Object> noIdentity = new HashMap<>(context("a", "in.docx", "out.docx"));
    noIdentity.remove(BuiltinPolicies.IDENTITY);
    assertFalse(engine.evaluate("staple", noIdentity).allowed());
  }

  @Test
  void customPoliciesRunAfterBuiltinsAndCollectEveryFailure() {
    List<String> calls = new ArrayList<>();
    engine.register("first_custom", ctx -> {
      calls.add("first");
      return PolicyVerdict.deny("always");
    });
    engine.register("second_custom", ctx -> {
      calls.add("second");
      return PolicyVerdict.allow("fine");
    });

    PolicyDecision decision = engine.evaluate("verify", context("", "in.docx", "out.docx"));

    assertEquals(List.of("first", "second"), calls);
    assertEquals(2, decision.failures().size());
    assertTrue(decision.failures().get(0).startsWith("[POLICY:no_empty_author]"));
    assertEquals("[POLICY:first_custom] always", decision.failures().get(1));
  }

  @Test
  void everyEvaluationIsAudited() {
    engine.evaluate("a", context("x", "i", "o"));
    engine.evaluate("b", context("", "i", "o"));
    engine.evaluate("c", null);

    assertEquals(3, auditLog.size());
    assertTrue(auditLog.verifyChain());
  }

  private Map<String, Object> context(String author, String input, String output) {
    Map<String, Object> context = new HashMap<>();
    context.put(BuiltinPolicies.IDENTITY, identity);
    context.put(BuiltinPolicies.AUTHOR, author);
    context.put(BuiltinPolicies.INPUT_PATH, input);
    context.put(BuiltinPolicies.OUTPUT_PATH, output);
    return context;
  }
}
