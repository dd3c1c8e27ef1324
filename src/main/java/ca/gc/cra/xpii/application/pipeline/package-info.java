/**
 * <strong>Purpose:</strong> Governed use cases that run the stapler pipeline phases behind the operator gate and
 * the policy engine.
 * <p><strong>Pipeline:</strong> staple = gate, policy, unpack, inject, pack; verify = gate, policy, verify.
 * <p><strong>Concurrency:</strong> Each invocation is synchronous; concurrent invocations use distinct
 * workspace directories.
 * <p><strong>Observability:</strong> Every phase writes one audit entry; outcomes are counted through
 * {@link ca.gc.cra.xpii.application.port.MetricsPort}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.xpii.application.pipeline;
