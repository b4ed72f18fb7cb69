package fr.lapetina.tr064.infrastructure.discovery;

import fr.lapetina.tr064.domain.error.MalformedDescriptorException;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * DOM helpers shared by the descriptor parsers and the SOAP layer.
 * Elements are matched by local name so that namespace prefixes do not matter.
 */
public final class XmlSupport {

    private static final DocumentBuilderFactory FACTORY = createFactory();

    // Reports through exceptions only, never on stderr
    private static final ErrorHandler SILENT = new ErrorHandler() {
        @Override
        public void warning(SAXParseException exception) {
        }

        @Override
        public void error(SAXParseException exception) throws SAXException {
            throw exception;
        }

        @Override
        public void fatalError(SAXParseException exception) throws SAXException {
            throw exception;
        }
    };

    private XmlSupport() {
    }

    private static DocumentBuilderFactory createFactory() {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(true);
        factory.setXIncludeAware(false);
        factory.setExpandEntityReferences(false);
        try {
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
            factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser does not support secure processing", e);
        }
        return factory;
    }

    /**
     * Parses a document.
     *
     * @throws MalformedDescriptorException if the text is not well-formed XML
     */
    public static Document parse(String xml) {
        return tryParse(xml).orElseThrow(() ->
                new MalformedDescriptorException("Document is not well-formed XML"));
    }

    /**
     * Parses a document, returning empty when the text is not well-formed XML.
     */
    public static Optional<Document> tryParse(String xml) {
        if (xml == null || xml.isBlank()) {
            return Optional.empty();
        }
        try {
            DocumentBuilder builder;
            synchronized (FACTORY) {
                builder = FACTORY.newDocumentBuilder();
            }
            builder.setErrorHandler(SILENT);
            return Optional.of(builder.parse(new InputSource(new StringReader(xml.strip()))));
        } catch (SAXException | IOException e) {
            return Optional.empty();
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser misconfigured", e);
        }
    }

    public static String localName(Node node) {
        String name = node.getLocalName();
        if (name != null) {
            return name;
        }
        String qualified = node.getNodeName();
        int colon = qualified.indexOf(':');
        return colon < 0 ? qualified : qualified.substring(colon + 1);
    }

    public static List<Element> childElements(Element parent) {
        List<Element> result = new ArrayList<>();
        NodeList children = parent.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            Node node = children.item(i);
            if (node.getNodeType() == Node.ELEMENT_NODE) {
                result.add((Element) node);
            }
        }
        return result;
    }

    public static List<Element> childElements(Element parent, String localName) {
        return childElements(parent).stream()
                .filter(element -> localName.equals(localName(element)))
                .toList();
    }

    public static Optional<Element> child(Element parent, String localName) {
        return childElements(parent).stream()
                .filter(element -> localName.equals(localName(element)))
                .findFirst();
    }

    /**
     * Returns the trimmed text of the first child with the given name, or null.
     */
    public static String childText(Element parent, String localName) {
        return child(parent, localName).map(XmlSupport::text).orElse(null);
    }

    public static String text(Element element) {
        String content = element.getTextContent();
        return content == null ? "" : content.trim();
    }

    /**
     * Returns the first element anywhere below {@code root} with the given local name.
     */
    public static Optional<Element> findFirst(Element root, String localName) {
        NodeList nodes = root.getElementsByTagNameNS("*", localName);
        if (nodes.getLength() > 0) {
            return Optional.of((Element) nodes.item(0));
        }
        return Optional.empty();
    }
}
