/**
 * <strong>Purpose:</strong> Provenance value types embedded into, and read back from, OOXML packages.
 * <p><strong>Pipeline role:</strong> Produced by the inject phase of unpack, inject, pack; consumed by verify.
 * <p><strong>Concurrency:</strong> Immutable records and stateless helpers.
 * <p><strong>Security:</strong> The fingerprint always refers to the original input bytes, never the stapled output.
 *
 * @since 0.1.0
 */
package ca.gc.cra.xpii.domain.provenance;
