/**
 * <strong>Purpose:</strong> Configuration loading and the composition root that wires ports to adapters.
 * <p><strong>Concurrency:</strong> Configuration records are immutable; loaders are stateless.
 * <p><strong>Errors:</strong> Invalid values raise {@link java.lang.IllegalArgumentException} naming the key.
 *
 * @since 0.1.0
 */
package ca.gc.cra.xpii.config;
