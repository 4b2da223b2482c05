package com.example.shab;

import lombok.extern.slf4j.Slf4j;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Decides from namespace and rubric markers whether a SHAB document is a
 * debt-enforcement auction before any full parsing happens.
 */
@Slf4j
public class PublicationClassifier {
    private static final String AUCTION_MARKER = "SB01";
    private static final Pattern COMMERCIAL_REGISTER_MARKER = Pattern.compile("\\bHR\\d{2}");

    public PublicationType classify(String xml) throws ParseException {
        return classify(xml, null);
    }

    /**
     * @throws ParseException only when the document is not well-formed
     */
    public PublicationType classify(String xml, String publicationId) throws ParseException {
        Document doc = XmlSupport.parseDocument(xml, publicationId);
        PublicationType type = classify(doc);
        log.debug("Publication {} classified as {}", publicationId, type);
        return type;
    }

    PublicationType classify(Document doc) {
        Element root = doc.getDocumentElement();

        PublicationType byNamespace = fromMarker(root.getNamespaceURI());
        if (byNamespace == PublicationType.UNKNOWN) {
            byNamespace = fromMarker(root.getPrefix());
        }
        if (byNamespace != PublicationType.UNKNOWN) {
            return byNamespace;
        }

        Element meta = XmlSupport.child(root, "meta");
        PublicationType bySubRubric = fromMarker(XmlSupport.text(meta, "subRubric"));
        if (bySubRubric != PublicationType.UNKNOWN) {
            return bySubRubric;
        }
        String rubric = XmlSupport.text(meta, "rubric");
        if (rubric != null && rubric.trim().equalsIgnoreCase("HR")) {
            return PublicationType.OTHER;
        }
        return PublicationType.UNKNOWN;
    }

    private PublicationType fromMarker(String marker) {
        if (marker == null || marker.isBlank()) {
            return PublicationType.UNKNOWN;
        }
        String upper = marker.toUpperCase(Locale.ROOT);
        if (upper.contains(AUCTION_MARKER)) {
            return PublicationType.AUCTION;
        }
        if (COMMERCIAL_REGISTER_MARKER.matcher(upper).find()) {
            return PublicationType.OTHER;
        }
        return PublicationType.UNKNOWN;
    }
}
