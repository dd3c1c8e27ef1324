/**
 * <strong>Purpose:</strong> Governance value types: agent identities and hash-chained audit entries.
 * <p><strong>Concurrency:</strong> {@link ca.gc.cra.xpii.domain.governance.AuditEntry} is immutable;
 * {@link ca.gc.cra.xpii.domain.governance.AgentIdentity} only mutates its revocation flag, atomically.
 * <p><strong>Security:</strong> Identity seeds come from {@link java.security.SecureRandom}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.xpii.domain.governance;
