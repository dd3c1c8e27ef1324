/**
 * <strong>Purpose:</strong> Logging hygiene helpers applied before user-supplied text reaches the logs.
 * <p><strong>Concurrency:</strong> Stateless helpers; thread-safe.
 * <p><strong>Observability:</strong> Works with SLF4J/Logback; no custom metrics.
 *
 * @since 0.1.0
 */
package ca.gc.cra.xpii.logging;
