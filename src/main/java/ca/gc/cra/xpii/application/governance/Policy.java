package ca.gc.cra.xpii.application.governance;

import java.util.Map;

/**
 * Deterministic predicate over an action context.
 *
 * <p>Implementations must be pure: same context, same verdict, no side effects.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface Policy {
  /**
   * Evaluates the context.
   *
   * @param context action context; never {@code null}, values may be {@code null}
   * @return verdict with a reason
   */
  PolicyVerdict evaluate(Map<String, Object> context);
}
