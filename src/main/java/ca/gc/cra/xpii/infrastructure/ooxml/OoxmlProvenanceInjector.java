package ca.gc.cra.xpii.infrastructure.ooxml;

import ca.gc.cra.xpii.application.port.ClockPort;
import ca.gc.cra.xpii.application.port.MalformedArchiveException;
import ca.gc.cra.xpii.application.port.ProvenanceInjector;
import ca.gc.cra.xpii.application.port.Workspace;
import ca.gc.cra.xpii.domain.provenance.ProvenanceRecord;
import ca.gc.cra.xpii.domain.provenance.RevisionMarker;
import ca.gc.cra.xpii.logging.Logs;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;

/**
 * <strong>What:</strong> Edit phase of the pipeline; stamps provenance into the parts of an unpacked package.
 * <p><strong>Why:</strong> Binds author and session to the fingerprint of the original input inside the document
 * itself, where it travels with the file.</p>
 * <p><strong>Role:</strong> {@link ProvenanceInjector} adapter operating on a {@link Workspace}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>{@code docProps/core.xml}: creator, provenance description, W3CDTF modification time.</li>
 *   <li>{@code word/settings.xml}: one revision marker derived from the session id, never duplicated.</li>
 *   <li>{@code word/document.xml}: re-serialized without content change.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless apart from the injected clock; safe across distinct workspaces.</p>
 * <p><strong>Observability:</strong> Logs the stamped session at INFO and per-part edits at DEBUG.</p>
 *
 * @implNote Absent parts are skipped rather than created.
 * @since 0.1.0
 */
public final class OoxmlProvenanceInjector implements ProvenanceInjector {
  private static final Logger log = LoggerFactory.getLogger(OoxmlProvenanceInjector.class);
  private static final DateTimeFormatter SESSION_FORMAT = DateTimeFormatter.ofPattern("yyyyMMddHHmmss");
  private static final DateTimeFormatter MODIFIED_FORMAT =
      DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss'Z'").withZone(ZoneOffset.UTC);
  private static final int LOG_AUTHOR_BYTES = 64;

  private final ClockPort clock;
  private final ZoneId sessionZone;

  public OoxmlProvenanceInjector() {
    this(ClockPort.SYSTEM, ZoneId.systemDefault());
  }

  /**
   * Creates an injector.
   *
   * @param clock source of the modification time and generated session ids
   * @param sessionZone zone in which generated session ids are expressed
   */
  public OoxmlProvenanceInjector(ClockPort clock, ZoneId sessionZone) {
    this.clock = Objects.requireNonNull(clock, "clock");
    this.sessionZone = Objects.requireNonNull(sessionZone, "sessionZone");
  }

  @Override
  public ProvenanceRecord inject(Workspace workspace, String author, String sessionId)
      throws MalformedArchiveException, IOException {
    Objects.requireNonNull(workspace, "workspace");
    Objects.requireNonNull(author, "author");
    Instant now = clock.now();
    String session = sessionId == null || sessionId.isBlank() ? generateSessionId(now) : sessionId;
    ProvenanceRecord record =
        new ProvenanceRecord(author, session, workspace.sourceSha256(), MODIFIED_FORMAT.format(now));

    editCoreProperties(workspace, record);
    editSettings(workspace, session);
    normalizeDocument(workspace);

    log.info("Injected provenance session={} author={} fingerprint={}",
        session, Logs.truncate(author, LOG_AUTHOR_BYTES), record.fingerprint());
    return record;
  }

  /**
   * Formats a session identifier ({@code yyyyMMddHHmmss}) in the configured zone.
   *
   * @param instant moment to format
   * @return fourteen-digit session identifier
   */
  String generateSessionId(Instant instant) {
    return SESSION_FORMAT.format(instant.atZone(sessionZone));
  }

  private void editCoreProperties(Workspace workspace, ProvenanceRecord record)
      throws MalformedArchiveException, IOException {
    Path part = workspace.part(OoxmlNamespaces.CORE_PART);
    if (!Files.isRegularFile(part)) {
      log.debug("{} absent; skipping core properties", OoxmlNamespaces.CORE_PART);
      return;
    }
    Document document = XmlParts.parse(part, OoxmlNamespaces.CORE_PART);
    CorePropertiesEditor.apply(document, record);
    XmlParts.write(document, part);
    log.debug("Stamped creator and description into {}", OoxmlNamespaces.CORE_PART);
  }

  private void editSettings(Workspace workspace, String session)
      throws MalformedArchiveException, IOException {
    Path part = workspace.part(OoxmlNamespaces.SETTINGS_PART);
    if (!Files.isRegularFile(part)) {
      log.debug("{} absent; skipping revision marker", OoxmlNamespaces.SETTINGS_PART);
      return;
    }
    String marker = RevisionMarker.derive(session);
    Document document = XmlParts.parse(part, OoxmlNamespaces.SETTINGS_PART);
    boolean added = SettingsEditor.addRevisionMarker(document, marker);
    XmlParts.write(document, part);
    log.debug("Revision marker {} {}", marker, added ? "added" : "already present");
  }

  private void normalizeDocument(Workspace workspace) throws MalformedArchiveException, IOException {
    Path part = workspace.part(OoxmlNamespaces.DOCUMENT_PART);
    if (!Files.isRegularFile(part)) {
      return;
    }
    XmlParts.write(XmlParts.parse(part, OoxmlNamespaces.DOCUMENT_PART), part);
  }
}
