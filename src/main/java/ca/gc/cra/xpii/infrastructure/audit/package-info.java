/**
 * Offline persistence of the audit hash chain as a JSON array, so an exported log can be re-read and replayed
 * with {@link ca.gc.cra.xpii.application.governance.AuditChain#inspect(java.util.List)}.
 */
package ca.gc.cra.xpii.infrastructure.audit;
