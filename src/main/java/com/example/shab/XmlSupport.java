package com.example.shab;

import com.rometools.rome.io.XmlReader;
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
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.StringWriter;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Namespace-agnostic DOM helpers shared by the classifier and the parser. SHAB exports
 * put the root element in a versioned namespace and leave most children unqualified,
 * so lookups go by local name only.
 */
final class XmlSupport {
    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE,
            DateTimeFormatter.ofPattern("dd.MM.yyyy"),
            DateTimeFormatter.BASIC_ISO_DATE);
    private static final List<DateTimeFormatter> TIME_FORMATS = List.of(
            DateTimeFormatter.ofPattern("HH:mm:ss"),
            DateTimeFormatter.ofPattern("HH:mm"),
            DateTimeFormatter.ofPattern("HH.mm"));

    private static final ErrorHandler STRICT = new ErrorHandler() {
        @Override
        public void warning(SAXParseException e) {
        }

        @Override
        public void error(SAXParseException e) throws SAXException {
            throw e;
        }

        @Override
        public void fatalError(SAXParseException e) throws SAXException {
            throw e;
        }
    };

    private XmlSupport() {
    }

    /**
     * Decodes raw XML bytes honouring the BOM and the encoding declared in the prolog.
     */
    static String decode(byte[] raw) throws IOException {
        try (Reader reader = new XmlReader(new ByteArrayInputStream(raw))) {
            StringBuilder sb = new StringBuilder(raw.length);
            char[] buf = new char[4096];
            int n;
            while ((n = reader.read(buf)) != -1) {
                sb.append(buf, 0, n);
            }
            return sb.toString();
        }
    }

    static Document parseDocument(String xml, String publicationId) throws ParseException {
        if (xml == null || xml.isBlank()) {
            throw new ParseException(publicationId, "Empty XML document");
        }
        try {
            DocumentBuilder builder = newBuilder();
            return builder.parse(new InputSource(new StringReader(xml)));
        } catch (SAXException e) {
            throw new ParseException(publicationId, "XML is not well-formed: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new ParseException(publicationId, "Unable to read XML: " + e.getMessage(), e);
        }
    }

    private static DocumentBuilder newBuilder() {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setExpandEntityReferences(false);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
            factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
            DocumentBuilder builder = factory.newDocumentBuilder();
            builder.setErrorHandler(STRICT);
            return builder;
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser is not available", e);
        }
    }

    static String localName(Node node) {
        String name = node.getLocalName();
        return name != null ? name : node.getNodeName();
    }

    static List<Element> children(Element parent, String localName) {
        List<Element> result = new ArrayList<>();
        if (parent == null) {
            return result;
        }
        NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node node = nodes.item(i);
            if (node.getNodeType() == Node.ELEMENT_NODE && localName.equals(localName(node))) {
                result.add((Element) node);
            }
        }
        return result;
    }

    static Element child(Element parent, String localName) {
        List<Element> found = children(parent, localName);
        return found.isEmpty() ? null : found.get(0);
    }

    /** Document-order descendants with the given local name. */
    static List<Element> descendants(Element parent, String localName) {
        List<Element> result = new ArrayList<>();
        if (parent == null) {
            return result;
        }
        NodeList nodes = parent.getElementsByTagNameNS("*", localName);
        for (int i = 0; i < nodes.getLength(); i++) {
            result.add((Element) nodes.item(i));
        }
        return result;
    }

    /** Trimmed text of the first direct child with that name, null when absent or blank. */
    static String text(Element parent, String localName) {
        return textOf(child(parent, localName));
    }

    static String textOf(Element element) {
        if (element == null) {
            return null;
        }
        String value = element.getTextContent();
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }

    static boolean hasElementChildren(Element element) {
        if (element == null) {
            return false;
        }
        NodeList nodes = element.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            if (nodes.item(i).getNodeType() == Node.ELEMENT_NODE) {
                return true;
            }
        }
        return false;
    }

    /**
     * Markup inside an element exactly as a consumer would render it: escaped HTML text is
     * returned unescaped, embedded element children are serialised back to markup.
     */
    static String innerMarkup(Element element) {
        if (element == null) {
            return null;
        }
        if (!hasElementChildren(element)) {
            return textOf(element);
        }
        NodeList nodes = element.getChildNodes();
        StringBuilder sb = new StringBuilder();
        try {
            Transformer transformer = TransformerFactory.newInstance().newTransformer();
            transformer.setOutputProperty(OutputKeys.OMIT_XML_DECLARATION, "yes");
            transformer.setOutputProperty(OutputKeys.METHOD, "xml");
            for (int i = 0; i < nodes.getLength(); i++) {
                Node node = nodes.item(i);
                if (node.getNodeType() == Node.ELEMENT_NODE) {
                    StringWriter out = new StringWriter();
                    transformer.transform(new DOMSource(node), new StreamResult(out));
                    sb.append(out);
                } else if (node.getNodeType() == Node.TEXT_NODE || node.getNodeType() == Node.CDATA_SECTION_NODE) {
                    sb.append(escape(node.getNodeValue()));
                }
            }
        } catch (TransformerException e) {
            throw new IllegalStateException("Unable to serialise markup of <" + localName(element) + ">", e);
        }
        String markup = sb.toString().trim();
        return markup.isEmpty() ? null : markup;
    }

    private static String escape(String text) {
        return text.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;");
    }

    /**
     * @return null for a blank value
     * @throws DateTimeParseException when no supported format matches
     */
    static LocalDate parseDate(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String v = value.trim();
        // SHAB sometimes sends timestamps where a date is expected
        if (v.length() > 10 && v.charAt(4) == '-' && v.charAt(10) == 'T') {
            v = v.substring(0, 10);
        }
        for (DateTimeFormatter format : DATE_FORMATS) {
            try {
                return LocalDate.parse(v, format);
            } catch (DateTimeParseException ignored) {
                // next format
            }
        }
        throw new DateTimeParseException("Unsupported date: " + value, value, 0);
    }

    /**
     * @return null for a blank value
     * @throws DateTimeParseException when no supported format matches
     */
    static LocalTime parseTime(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        for (DateTimeFormatter format : TIME_FORMATS) {
            try {
                return LocalTime.parse(value.trim(), format);
            } catch (DateTimeParseException ignored) {
                // next format
            }
        }
        throw new DateTimeParseException("Unsupported time: " + value, value, 0);
    }

    static String joinNonBlank(String separator, String... parts) {
        StringBuilder sb = new StringBuilder();
        for (String part : parts) {
            if (part == null || part.isBlank()) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append(separator);
            }
            sb.append(part.trim());
        }
        return sb.length() == 0 ? null : sb.toString();
    }

    static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
