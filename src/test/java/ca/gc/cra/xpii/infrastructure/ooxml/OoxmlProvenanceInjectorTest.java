package ca.gc.cra.xpii.infrastructure.ooxml;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.xpii.application.port.ClockPort;
import ca.gc.cra.xpii.application.port.MalformedArchiveException;
import ca.gc.cra.xpii.application.port.Workspace;
import ca.gc.cra.xpii.domain.provenance.ProvenanceRecord;
import ca.gc.cra.xpii.domain.provenance.RevisionMarker;
import ca.gc.cra.xpii.testutil.DocxFixtures;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.xml.parsers.DocumentBuilderFactory;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;

class OoxmlProvenanceInjectorTest {
  private static final Instant NOW = Instant.parse("2026-04-02T09:15:30Z");
  private static final ClockPort CLOCK = NOW::toEpochMilli;

  private final ZipPackageCodec codec = new ZipPackageCodec();
  private final OoxmlProvenanceInjector injector = new OoxmlProvenanceInjector(CLOCK, ZoneOffset.UTC);

  @TempDir Path tempDir;

  @Test
  void stampsCreatorDescriptionAndModified() throws Exception {
    Path source = DocxFixtures.minimalDocx(tempDir.resolve("in.docx"), "Old");

    try (Workspace workspace = codec.unpack(source, tempDir.resolve("ws"))) {
      ProvenanceRecord record = injector.inject(workspace, "Axiom", "2026-XPII-001");

      assertEquals("Axiom", record.author());
      assertEquals("2026-XPII-001", record.sessionId());
      assertEquals(workspace.sourceSha256(), record.fingerprint());
      assertEquals("2026-04-02T09:15:30Z", record.modifiedAt());

      Element root = parse(workspace.part(DocxFixtures.CORE)).getDocumentElement();
      assertEquals("Axiom", text(root, OoxmlNamespaces.DC, "creator"));
      assertEquals("XPII-CHAIN-PROVENANCE: 2026-XPII-001 | XPII-CHAIN-SHA256: " + workspace.sourceSha256(),
          text(root, OoxmlNamespaces.DC, "description"));
      Element modified = (Element) root.getElementsByTagNameNS(OoxmlNamespaces.DCTERMS, "modified").item(0);
      assertEquals("2026-04-02T09:15:30Z", modified.getTextContent());
      assertEquals("dcterms:W3CDTF", modified.getAttributeNS(OoxmlNamespaces.XSI, "type"));
      assertEquals(1, root.getElementsByTagNameNS(OoxmlNamespaces.DC, "creator").getLength());
    }
  }

  @Test
  void revisionMarkerAddedOnceForRepeatedSession() throws Exception {
    Path source = DocxFixtures.minimalDocx(tempDir.resolve("in.docx"), "Old");

    try (Workspace workspace = codec.unpack(source, tempDir.resolve("ws"))) {
      injector.inject(workspace, "Axiom", "2026-XPII-001");
      injector.inject(workspace, "Axiom", "2026-XPII-001");

      List<String> markers = rsids(workspace.part(DocxFixtures.SETTINGS));
      assertEquals(List.of(RevisionMarker.derive("2026-XPII-001")), markers);

      injector.inject(workspace, "Axiom", "another-session");
      assertEquals(2, rsids(workspace.part(DocxFixtures.SETTINGS)).size());
    }
  }

  @Test
  void blankSessionGeneratesTimestampId() throws Exception {
    Path source = DocxFixtures.minimalDocx(tempDir.resolve("in.docx"), "Old");

    try (Workspace workspace = codec.unpack(source, tempDir.resolve("ws"))) {
      assertEquals("20260402091530", injector.inject(workspace, "Axiom", "  ").sessionId());
      assertEquals("20260402091530", injector.inject(workspace, "Axiom", null).sessionId());
    }
  }

  @Test
  void absentPartsAreSkippedAndOtherPartsUntouched() throws Exception {
    Map<String, byte[]> parts = new LinkedHashMap<>();
    parts.put(DocxFixtures.CONTENT_TYPES, DocxFixtures.utf8(DocxFixtures.contentTypes()));
    parts.put(DocxFixtures.MEDIA, new byte[] {1, 2, 3});
    Path source = DocxFixtures.write(tempDir.resolve("bare.docx"), parts);

    try (Workspace workspace = codec.unpack(source, tempDir.resolve("ws"))) {
      ProvenanceRecord record = injector.inject(workspace, "Axiom", "s");

      assertEquals(workspace.sourceSha256(), record.fingerprint());
      assertFalse(Files.exists(workspace.part(DocxFixtures.CORE)));
      assertFalse(Files.exists(workspace.part(DocxFixtures.SETTINGS)));
      assertArrayEquals(new byte[] {1, 2, 3}, Files.readAllBytes(workspace.part(DocxFixtures.MEDIA)));
    }
  }

  @Test
  void documentPartKeepsItsContent() throws Exception {
    Path source = DocxFixtures.minimalDocx(tempDir.resolve("in.docx"), "Old");

    try (Workspace workspace = codec.unpack(source, tempDir.resolve("ws"))) {
      injector.inject(workspace, "Axiom", "s");

      Document document = parse(workspace.part(DocxFixtures.DOCUMENT));
      assertEquals("Hello, provenance", document.getElementsByTagNameNS(DocxFixtures.W_NS, "t").item(0)
          .getTextContent());
    }
  }

  @Test
  void malformedCorePropertiesRaiseMalformedArchive() throws Exception {
    Map<String, byte[]> parts = new LinkedHashMap<>(DocxFixtures.minimalParts("Old"));
    parts.put(DocxFixtures.CORE, DocxFixtures.utf8("<cp:coreProperties><unclosed>"));
    Path source = DocxFixtures.write(tempDir.resolve("broken.docx"), parts);

    try (Workspace workspace = codec.unpack(source, tempDir.resolve("ws"))) {
      MalformedArchiveException ex = assertThrows(MalformedArchiveException.class,
          () -> injector.inject(workspace, "Axiom", "s"));
      assertEquals(DocxFixtures.CORE, ex.part());
      assertTrue(ex.getMessage().startsWith(DocxFixtures.CORE + ": "));
    }
  }

  @Test
  void createsDescriptionAndModifiedWhenCorePropertiesAreEmpty() throws Exception {
    Map<String, byte[]> parts = new LinkedHashMap<>(DocxFixtures.minimalParts("Old"));
    parts.put(DocxFixtures.CORE, DocxFixtures.utf8(
        "<cp:coreProperties xmlns:cp=\"" + OoxmlNamespaces.CP + "\"/>"));
    Path source = DocxFixtures.write(tempDir.resolve("empty-core.docx"), parts);

    try (Workspace workspace = codec.unpack(source, tempDir.resolve("ws"))) {
      injector.inject(workspace, "Axiom", "s");

      Element root = parse(workspace.part(DocxFixtures.CORE)).getDocumentElement();
      assertEquals("Axiom", text(root, OoxmlNamespaces.DC, "creator"));
      assertEquals("2026-04-02T09:15:30Z", text(root, OoxmlNamespaces.DCTERMS, "modified"));
      Element modified = (Element) root.getElementsByTagNameNS(OoxmlNamespaces.DCTERMS, "modified").item(0);
      assertTrue(modified.getAttributeNS(OoxmlNamespaces.XSI, "type").endsWith(":W3CDTF"));
    }
  }

  @Test
  void settingsWithoutRsidsGetContainer() throws Exception {
    Path source = DocxFixtures.minimalDocx(tempDir.resolve("in.docx"), "Old");

    try (Workspace workspace = codec.unpack(source, tempDir.resolve("ws"))) {
      injector.inject(workspace, "Axiom", "s");
      Document settings = parse(workspace.part(DocxFixtures.SETTINGS));
      assertEquals(1, settings.getElementsByTagNameNS(DocxFixtures.W_NS, "rsids").getLength());
    }
  }

  static Document parse(Path file) throws Exception {
    DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
    factory.setNamespaceAware(true);
    return factory.newDocumentBuilder().parse(file.toFile());
  }

  static String text(Element root, String namespace, String localName) {
    NodeList nodes = root.getElementsByTagNameNS(namespace, localName);
    return nodes.getLength() == 0 ? null : nodes.item(0).getTextContent();
  }

  private static List<String> rsids(Path settings) throws Exception {
    NodeList nodes = parse(settings).getElementsByTagNameNS(DocxFixtures.W_NS, "rsid");
    List<String> values = new ArrayList<>();
    for (int i = 0; i < nodes.getLength(); i++) {
      values.add(((Element) nodes.item(i)).getAttributeNS(DocxFixtures.W_NS, "val"));
    }
    return values;
  }
}
