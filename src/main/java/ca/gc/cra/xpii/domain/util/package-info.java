/**
 * Domain utility classes for hashing and hex encoding.
 * <p><strong>Role:</strong> Domain support functions reused by the provenance pipeline and the governance stack.</p>
 * <p><strong>Concurrency:</strong> Utilities are stateless; safe to call concurrently.</p>
 * <p><strong>Performance:</strong> Streaming digests use a fixed 8 KiB buffer regardless of input size.</p>
 * <p><strong>Metrics:</strong> Do not emit metrics; callers observe usage.</p>
 */
package ca.gc.cra.xpii.domain.util;
