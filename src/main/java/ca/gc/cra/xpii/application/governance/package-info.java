/**
 * <strong>Purpose:</strong> Governance stack that authorizes and records every pipeline action.
 * <p><strong>Pipeline role:</strong> Use cases call {@link ca.gc.cra.xpii.application.governance.OperatorControl}
 * first, then {@link ca.gc.cra.xpii.application.governance.PolicyEngine}; every decision lands in the
 * hash-chained {@link ca.gc.cra.xpii.application.governance.AuditLog}.
 * <p><strong>Concurrency:</strong> The audit log serializes appends and snapshots behind one lock; the operator
 * halt flag is atomic and may be flipped from any thread.
 * <p><strong>Security:</strong> Chain verification recomputes every hash; there is no partial trust.
 *
 * @since 0.1.0
 */
package ca.gc.cra.xpii.application.governance;
