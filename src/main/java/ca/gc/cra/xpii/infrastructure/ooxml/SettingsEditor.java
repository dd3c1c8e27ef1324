package ca.gc.cra.xpii.infrastructure.ooxml;

import org.w3c.dom.Document;
import org.w3c.dom.Element;

/**
 * Adds a revision save identifier to the {@code w:rsids} collection of {@code word/settings.xml}.
 *
 * @since 0.1.0
 */
final class SettingsEditor {
  private SettingsEditor() {}

  /**
   * Appends {@code <w:rsid w:val="marker"/>} unless an entry with that value already exists.
   *
   * @param document parsed settings part
   * @param marker eight-character revision marker
   * @return {@code true} when a new entry was appended
   */
  static boolean addRevisionMarker(Document document, String marker) {
    Element root = document.getDocumentElement();
    Element rsids = XmlParts.getOrCreate(root, OoxmlNamespaces.W, "w", "rsids");
    for (Element rsid : XmlParts.children(rsids, OoxmlNamespaces.W, "rsid")) {
      if (marker.equalsIgnoreCase(rsid.getAttributeNS(OoxmlNamespaces.W, "val"))) {
        return false;
      }
    }
    String prefix = XmlParts.ensurePrefix(root, OoxmlNamespaces.W, "w");
    Element rsid = document.createElementNS(OoxmlNamespaces.W, prefix + ":rsid");
    rsid.setAttributeNS(OoxmlNamespaces.W, prefix + ":val", marker);
    rsids.appendChild(rsid);
    return true;
  }
}
