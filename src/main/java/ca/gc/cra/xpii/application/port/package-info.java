/**
 * <strong>Purpose:</strong> Ports separating the governed use cases from the zip, XML, clock and metrics adapters.
 * <p><strong>Pipeline role:</strong> {@link ca.gc.cra.xpii.application.port.PackageCodec} covers unpack and pack,
 * {@link ca.gc.cra.xpii.application.port.ProvenanceInjector} the edit phase, and
 * {@link ca.gc.cra.xpii.application.port.ProvenanceVerifier} read-back.
 * <p><strong>Concurrency:</strong> Pipeline ports are synchronous; concurrent sessions need distinct workspaces.
 * <p><strong>Errors:</strong> Failures surface as subclasses of {@link ca.gc.cra.xpii.application.port.StaplerException}
 * or {@link java.io.IOException}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.xpii.application.port;
