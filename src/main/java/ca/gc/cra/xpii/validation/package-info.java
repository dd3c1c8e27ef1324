/**
 * <strong>Purpose:</strong> Input validation for configuration values and filesystem locations.
 * <p><strong>Concurrency:</strong> Stateless utilities.
 * <p><strong>Errors:</strong> Violations raise {@link java.lang.IllegalArgumentException}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.xpii.validation;
