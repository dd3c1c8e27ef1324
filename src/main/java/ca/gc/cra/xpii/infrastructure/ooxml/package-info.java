/**
 * <strong>Purpose:</strong> OOXML adapters for the unpack, inject, pack pipeline and provenance read-back.
 * <p><strong>Pipeline role:</strong> {@link ca.gc.cra.xpii.infrastructure.ooxml.ZipPackageCodec} moves packages
 * between zip and directory form; {@link ca.gc.cra.xpii.infrastructure.ooxml.OoxmlProvenanceInjector} edits
 * {@code docProps/core.xml}, {@code word/settings.xml} and {@code word/document.xml};
 * {@link ca.gc.cra.xpii.infrastructure.ooxml.OoxmlProvenanceVerifier} reads the core properties back.
 * <p><strong>Concurrency:</strong> Adapters are stateless; workspaces must not be shared between threads.
 * <p><strong>Security:</strong> Zip entries may not escape the workspace and XML parsing refuses DOCTYPEs.
 *
 * @since 0.1.0
 */
package ca.gc.cra.xpii.infrastructure.ooxml;
