package com.gentoro.cdafinder.document;

import com.gentoro.cdafinder.exception.DocumentParseException;
import com.gentoro.cdafinder.logging.LoggingService;
import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import org.slf4j.Logger;
import org.w3c.dom.Attr;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.NodeList;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

/**
 * Reads CDA XML into an immutable {@link CdaDocument}.
 *
 * <p>Parsing is namespace aware, rejects DOCTYPE declarations and never resolves external
 * entities. Any failure is reported as a {@link DocumentParseException}; there is no partial
 * result.
 */
public class CdaDocumentParser {
  private static final Logger log = LoggingService.getLogger(CdaDocumentParser.class);

  public CdaDocument parse(Path file) {
    if (file == null) throw new DocumentParseException("No XML file given");
    try (InputStream in = Files.newInputStream(file)) {
      return parse(in, file.toString());
    } catch (NoSuchFileException e) {
      throw new DocumentParseException("XML file not found: " + file, e);
    } catch (IOException e) {
      throw new DocumentParseException("Error reading XML file: " + file, e);
    }
  }

  public CdaDocument parse(InputStream in, String source) {
    return parse(new InputSource(in), source);
  }

  public CdaDocument parseString(String xml, String source) {
    return parse(new InputSource(new StringReader(xml)), source);
  }

  private CdaDocument parse(InputSource input, String source) {
    Document dom;
    try {
      DocumentBuilder db = newFactory().newDocumentBuilder();
      db.setErrorHandler(new StrictErrorHandler(source));
      db.setEntityResolver((publicId, systemId) -> new InputSource(new StringReader("")));
      dom = db.parse(input);
    } catch (SAXException e) {
      throw new DocumentParseException("Error parsing XML file: " + e.getMessage(), e)
          .withContext("source", source);
    } catch (IOException e) {
      throw new DocumentParseException("Error reading XML from " + source, e);
    } catch (ParserConfigurationException e) {
      throw new DocumentParseException("XML parser is not available", e);
    }

    CdaDocument.Builder builder = CdaDocument.builder(source);
    append(builder, -1, dom.getDocumentElement());
    CdaDocument document = builder.build();
    log.debug("Parsed {} with {} elements", source, document.size());
    return document;
  }

  private static DocumentBuilderFactory newFactory() throws ParserConfigurationException {
    DocumentBuilderFactory dbf = DocumentBuilderFactory.newInstance();
    dbf.setNamespaceAware(true);
    dbf.setValidating(false);
    dbf.setXIncludeAware(false);
    dbf.setExpandEntityReferences(false);
    dbf.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
    dbf.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
    return dbf;
  }

  private static void append(CdaDocument.Builder builder, int parent, Element element) {
    String localName =
        element.getLocalName() != null ? element.getLocalName() : element.getTagName();
    int index =
        builder.add(
            parent,
            element.getNamespaceURI(),
            localName,
            attributesOf(element),
            leadingText(element));

    NodeList children = element.getChildNodes();
    for (int i = 0; i < children.getLength(); i++) {
      if (children.item(i) instanceof Element child) {
        append(builder, index, child);
      }
    }
  }

  private static Map<String, String> attributesOf(Element element) {
    Map<String, String> attributes = new LinkedHashMap<>();
    NamedNodeMap map = element.getAttributes();
    for (int i = 0; i < map.getLength(); i++) {
      Attr attr = (Attr) map.item(i);
      if (XMLConstants.XMLNS_ATTRIBUTE_NS_URI.equals(attr.getNamespaceURI())) continue;
      attributes.put(attr.getName(), attr.getValue());
    }
    return attributes;
  }

  /** Character data before the first child element, trimmed; null when blank. */
  private static String leadingText(Element element) {
    StringBuilder sb = new StringBuilder();
    NodeList children = element.getChildNodes();
    for (int i = 0; i < children.getLength(); i++) {
      org.w3c.dom.Node child = children.item(i);
      short type = child.getNodeType();
      if (type == org.w3c.dom.Node.ELEMENT_NODE) break;
      if (type == org.w3c.dom.Node.TEXT_NODE || type == org.w3c.dom.Node.CDATA_SECTION_NODE) {
        sb.append(child.getNodeValue());
      }
    }
    String text = sb.toString().trim();
    return text.isEmpty() ? null : text;
  }

  private static final class StrictErrorHandler implements ErrorHandler {
    private final String source;

    StrictErrorHandler(String source) {
      this.source = source;
    }

    @Override
    public void warning(SAXParseException e) {
      log.warn("{}:{}: {}", source, e.getLineNumber(), e.getMessage());
    }

    @Override
    public void error(SAXParseException e) throws SAXException {
      throw e;
    }

    @Override
    public void fatalError(SAXParseException e) throws SAXException {
      throw e;
    }
  }
}
