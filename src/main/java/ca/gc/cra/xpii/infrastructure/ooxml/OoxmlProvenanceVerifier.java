package ca.gc.cra.xpii.infrastructure.ooxml;

import ca.gc.cra.xpii.application.port.MalformedArchiveException;
import ca.gc.cra.xpii.application.port.ProvenanceVerifier;
import ca.gc.cra.xpii.domain.provenance.ProvenanceDescription;
import ca.gc.cra.xpii.domain.provenance.ProvenanceRecord;
import ca.gc.cra.xpii.domain.provenance.VerificationResult;
import ca.gc.cra.xpii.domain.provenance.VerificationStatus;
import ca.gc.cra.xpii.logging.Logs;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.zip.ZipEntry;
import java.util.zip.ZipException;
import java.util.zip.ZipFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

/**
 * Reads stapled provenance from {@code docProps/core.xml} without extracting or modifying the package.
 *
 * @since 0.1.0
 */
public final class OoxmlProvenanceVerifier implements ProvenanceVerifier {
  private static final Logger log = LoggerFactory.getLogger(OoxmlProvenanceVerifier.class);
  private static final int LOG_DESCRIPTION_BYTES = 160;

  @Override
  public VerificationResult verify(Path pkg) throws IOException {
    Objects.requireNonNull(pkg, "pkg");
    if (!Files.isRegularFile(pkg)) {
      throw new NoSuchFileException(pkg.toString());
    }
    try (ZipFile zip = new ZipFile(pkg.toFile())) {
      ZipEntry core = zip.getEntry(OoxmlNamespaces.CORE_PART);
      if (core == null) {
        return VerificationResult.failed(
            VerificationStatus.NO_METADATA, "package has no " + OoxmlNamespaces.CORE_PART);
      }
      Document document;
      try (InputStream in = zip.getInputStream(core)) {
        document = XmlParts.parse(in, OoxmlNamespaces.CORE_PART);
      }
      return read(document.getDocumentElement());
    } catch (ZipException ex) {
      log.warn("Unreadable package {}: {}", pkg, ex.getMessage());
      return VerificationResult.failed(VerificationStatus.MALFORMED_ARCHIVE, ex.getMessage());
    } catch (MalformedArchiveException ex) {
      log.warn("Malformed core properties in {}: {}", pkg, ex.getMessage());
      return VerificationResult.failed(VerificationStatus.MALFORMED_ARCHIVE, ex.getMessage());
    }
  }

  private static VerificationResult read(Element root) {
    String description = XmlParts.childText(root, OoxmlNamespaces.DC, "description");
    if (!ProvenanceDescription.isStapled(description)) {
      return VerificationResult.failed(VerificationStatus.NO_PROVENANCE,
          description == null ? "no description" : "description carries no provenance marker");
    }
    log.debug("Parsing provenance description {}", Logs.truncate(description, LOG_DESCRIPTION_BYTES));
    Map<String, String> fields = ProvenanceDescription.parse(description);
    ProvenanceRecord record = new ProvenanceRecord(
        orUnknown(XmlParts.childRawText(root, OoxmlNamespaces.DC, "creator")),
        fields.getOrDefault(ProvenanceDescription.SESSION_KEY, ""),
        fields.get(ProvenanceDescription.FINGERPRINT_KEY),
        orUnknown(XmlParts.childText(root, OoxmlNamespaces.DCTERMS, "modified")));
    return VerificationResult.verified(record, fields);
  }

  private static String orUnknown(String value) {
    return value == null ? ProvenanceRecord.UNKNOWN : value;
  }
}
