package ca.gc.cra.xpii.application.governance;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Registry of named deterministic policies evaluated before every governed action.
 * <p><strong>Why:</strong> Keeps authorization rules as code whose every verdict is written to the audit log,
 * including denials.</p>
 * <p><strong>Thread-safety:</strong> Registration and evaluation synchronize on the registry; policies run in
 * insertion order.</p>
 * <p><strong>Observability:</strong> Denials are logged at WARN.</p>
 *
 * @since 0.1.0
 */
public final class PolicyEngine {
  private static final Logger log = LoggerFactory.getLogger(PolicyEngine.class);

  private final AuditLog auditLog;
  private final Map<String, Policy> policies = new LinkedHashMap<>();

  /**
   * Creates an engine with the built-in policies registered.
   *
   * @param auditLog log receiving one entry per evaluation
   */
  public PolicyEngine(AuditLog auditLog) {
    this.auditLog = Objects.requireNonNull(auditLog, "auditLog");
    register(BuiltinPolicies.IDENTITY_MUST_BE_VALID, BuiltinPolicies::identityMustBeValid);
    register(BuiltinPolicies.NO_EMPTY_AUTHOR, BuiltinPolicies::noEmptyAuthor);
    register(BuiltinPolicies.NO_PATH_TRAVERSAL, BuiltinPolicies::noPathTraversal);
  }

  /**
   * Adds or replaces a named policy. A replaced policy keeps its original position.
   *
   * @param name unique policy name
   * @param policy predicate; not invoked here
   */
  public void register(String name, Policy policy) {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(policy, "policy");
    if (name.isBlank()) {
      throw new IllegalArgumentException("policy name must not be blank");
    }
    synchronized (policies) {
      policies.put(name, policy);
    }
  }

  /**
   * Returns the registered policy names in evaluation order.
   *
   * @return unmodifiable list of names
   */
  public List<String> policyNames() {
    synchronized (policies) {
      return List.copyOf(policies.keySet());
    }
  }

  /**
   * Runs every policy against {@code context} and records the decision.
   *
   * @param action action label; recorded as {@code policy_evaluate:<action>}
   * @param context action context; may be {@code null}
   * @return aggregate decision
   */
  public PolicyDecision evaluate(String action, Map<String, ?> context) {
    Objects.requireNonNull(action, "action");
    Map<String, Object> copy = new LinkedHashMap<>();
    if (context != null) {
      copy.putAll(context);
    }
    Map<String, Object> ctx = Collections.unmodifiableMap(copy);
    Map<String, Policy> snapshot;
    synchronized (policies) {
      snapshot = new LinkedHashMap<>(policies);
    }

    List<String> failures = new ArrayList<>();
    for (Map.Entry<String, Policy> entry : snapshot.entrySet()) {
      PolicyVerdict verdict = entry.getValue().evaluate(ctx);
      if (!verdict.allowed()) {
        failures.add("[POLICY:" + entry.getKey() + "] " + verdict.reason());
      }
    }

    boolean allowed = failures.isEmpty();
    Map<String, Object> auditContext = new LinkedHashMap<>();
    auditContext.put("policy_count", snapshot.size());
    auditContext.put("failures", failures);
    auditLog.record("policy_evaluate:" + action, auditContext, allowed ? "ALLOWED" : "DENIED");
    if (!allowed) {
      log.warn("Policy denied action {}: {}", action, failures);
    }
    return new PolicyDecision(allowed, failures);
  }
}
