package ca.gc.cra.xpii.infrastructure.ooxml;

/**
 * Namespace URIs and part names of the OOXML parts the pipeline touches.
 *
 * @since 0.1.0
 */
public final class OoxmlNamespaces {
  /** WordprocessingML main namespace ({@code w}). */
  public static final String W = "http://schemas.openxmlformats.org/wordprocessingml/2006/main";
  /** Package core properties ({@code cp}). */
  public static final String CP = "http://schemas.openxmlformats.org/package/2006/metadata/core-properties";
  /** Dublin Core elements ({@code dc}). */
  public static final String DC = "http://purl.org/dc/elements/1.1/";
  /** Dublin Core terms ({@code dcterms}). */
  public static final String DCTERMS = "http://purl.org/dc/terms/";
  /** XML Schema instance ({@code xsi}). */
  public static final String XSI = "http://www.w3.org/2001/XMLSchema-instance";

  public static final String CONTENT_TYPES_PART = "[Content_Types].xml";
  public static final String CORE_PART = "docProps/core.xml";
  public static final String SETTINGS_PART = "word/settings.xml";
  public static final String DOCUMENT_PART = "word/document.xml";

  private OoxmlNamespaces() {}
}
