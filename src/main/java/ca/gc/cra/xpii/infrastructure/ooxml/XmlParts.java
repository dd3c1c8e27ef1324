package ca.gc.cra.xpii.infrastructure.ooxml;

import ca.gc.cra.xpii.application.port.MalformedArchiveException;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.xml.sax.ErrorHandler;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

/**
 * Namespace-aware DOM parsing and UTF-8 serialization of package parts.
 *
 * <p>Parsing refuses DOCTYPE declarations and external entities. Serialization always writes an XML declaration
 * and keeps {@code standalone="yes"} when the source declared it.
 *
 * @since 0.1.0
 */
final class XmlParts {
  private static final Logger log = LoggerFactory.getLogger(XmlParts.class);
  private static final String DISALLOW_DOCTYPE = "http://apache.org/xml/features/disallow-doctype-decl";

  private static final ErrorHandler STRICT = new ErrorHandler() {
    @Override
    public void warning(SAXParseException ex) {
      log.debug("XML warning at line {}: {}", ex.getLineNumber(), ex.getMessage());
    }

    @Override
    public void error(SAXParseException ex) throws SAXException {
      throw ex;
    }

    @Override
    public void fatalError(SAXParseException ex) throws SAXException {
      throw ex;
    }
  };

  private XmlParts() {}

  static Document parse(Path file, String partName) throws MalformedArchiveException, IOException {
    try (InputStream in = Files.newInputStream(file)) {
      return parse(in, partName);
    }
  }

  static Document parse(InputStream in, String partName) throws MalformedArchiveException, IOException {
    try {
      DocumentBuilder builder = newBuilder();
      builder.setErrorHandler(STRICT);
      return builder.parse(in);
    } catch (SAXException ex) {
      throw new MalformedArchiveException(partName, ex);
    }
  }

  static void write(Document document, Path file) throws IOException {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    try {
      TransformerFactory factory = TransformerFactory.newInstance();
      factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_DTD, "");
      factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_STYLESHEET, "");
      Transformer transformer = factory.newTransformer();
      transformer.setOutputProperty(OutputKeys.METHOD, "xml");
      transformer.setOutputProperty(OutputKeys.ENCODING, "UTF-8");
      transformer.setOutputProperty(OutputKeys.OMIT_XML_DECLARATION, "no");
      transformer.setOutputProperty(OutputKeys.INDENT, "no");
      if (document.getXmlStandalone()) {
        transformer.setOutputProperty(OutputKeys.STANDALONE, "yes");
      }
      transformer.transform(new DOMSource(document), new StreamResult(out));
    } catch (TransformerException ex) {
      throw new IOException("failed to serialize " + file + ": " + ex.getMessage(), ex);
    }
    Files.write(file, out.toByteArray());
  }

  static Element firstChild(Element parent, String namespace, String localName) {
    for (Node node = parent.getFirstChild(); node != null; node = node.getNextSibling()) {
      if (matches(node, namespace, localName)) {
        return (Element) node;
      }
    }
    return null;
  }

  static List<Element> children(Element parent, String namespace, String localName) {
    List<Element> found = new ArrayList<>();
    for (Node node = parent.getFirstChild(); node != null; node = node.getNextSibling()) {
      if (matches(node, namespace, localName)) {
        found.add((Element) node);
      }
    }
    return found;
  }

  /**
   * Returns the trimmed text of the first matching child, or {@code null} when absent or blank.
   */
  static String childText(Element parent, String namespace, String localName) {
    Element child = firstChild(parent, namespace, localName);
    if (child == null) {
      return null;
    }
    String text = child.getTextContent();
    return text == null || text.isBlank() ? null : text.trim();
  }

  /**
   * Returns the untrimmed text of the first matching child, or {@code null} when the child is absent.
   */
  static String childRawText(Element parent, String namespace, String localName) {
    Element child = firstChild(parent, namespace, localName);
    return child == null ? null : child.getTextContent();
  }

  /**
   * Returns the prefix bound to {@code namespace} on {@code root}, declaring {@code preferred} when unbound.
   */
  static String ensurePrefix(Element root, String namespace, String preferred) {
    String prefix = root.lookupPrefix(namespace);
    if (prefix != null) {
      return prefix;
    }
    root.setAttributeNS(XMLConstants.XMLNS_ATTRIBUTE_NS_URI, "xmlns:" + preferred, namespace);
    return preferred;
  }

  /**
   * Returns the first matching child of {@code root}, appending a new one when absent.
   */
  static Element getOrCreate(Element root, String namespace, String preferredPrefix, String localName) {
    Element existing = firstChild(root, namespace, localName);
    if (existing != null) {
      return existing;
    }
    String prefix = ensurePrefix(root, namespace, preferredPrefix);
    Element created = root.getOwnerDocument().createElementNS(namespace, prefix + ":" + localName);
    root.appendChild(created);
    return created;
  }

  private static boolean matches(Node node, String namespace, String localName) {
    return node.getNodeType() == Node.ELEMENT_NODE
        && namespace.equals(node.getNamespaceURI())
        && localName.equals(node.getLocalName());
  }

  private static DocumentBuilder newBuilder() {
    try {
      DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
      factory.setNamespaceAware(true);
      factory.setFeature(DISALLOW_DOCTYPE, true);
      factory.setXIncludeAware(false);
      factory.setExpandEntityReferences(false);
      return factory.newDocumentBuilder();
    } catch (ParserConfigurationException ex) {
      throw new IllegalStateException("XML parser does not support secure configuration", ex);
    }
  }
}
