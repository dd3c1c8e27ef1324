package ca.gc.cra.xpii.infrastructure.ooxml;

import ca.gc.cra.xpii.domain.provenance.ProvenanceRecord;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

/**
 * Stamps author, provenance description and modification time into {@code docProps/core.xml}.
 *
 * @since 0.1.0
 */
final class CorePropertiesEditor {
  static final String W3CDTF = "W3CDTF";

  private CorePropertiesEditor() {}

  /**
   * Sets (creating where missing) {@code dc:creator}, {@code dc:description} and {@code dcterms:modified}.
   *
   * @param document parsed core properties
   * @param record provenance to stamp
   */
  static void apply(Document document, ProvenanceRecord record) {
    Element root = document.getDocumentElement();

    XmlParts.getOrCreate(root, OoxmlNamespaces.DC, "dc", "creator").setTextContent(record.author());
    XmlParts.getOrCreate(root, OoxmlNamespaces.DC, "dc", "description").setTextContent(record.description());

    String dctermsPrefix = XmlParts.ensurePrefix(root, OoxmlNamespaces.DCTERMS, "dcterms");
    String xsiPrefix = XmlParts.ensurePrefix(root, OoxmlNamespaces.XSI, "xsi");
    Element modified = XmlParts.getOrCreate(root, OoxmlNamespaces.DCTERMS, dctermsPrefix, "modified");
    modified.setAttributeNS(OoxmlNamespaces.XSI, xsiPrefix + ":type", dctermsPrefix + ":" + W3CDTF);
    modified.setTextContent(record.modifiedAt());
  }
}
