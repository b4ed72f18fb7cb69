package fr.lapetina.tr064.infrastructure.soap;

import fr.lapetina.tr064.domain.error.ErrorKind;
import fr.lapetina.tr064.domain.error.ProtocolException;
import fr.lapetina.tr064.domain.error.RouterAuthorizationException;
import fr.lapetina.tr064.domain.error.RouterConnectionException;
import fr.lapetina.tr064.domain.error.RouterException;
import fr.lapetina.tr064.infrastructure.discovery.XmlSupport;
import fr.lapetina.tr064.infrastructure.http.RouterResponse;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Maps a failed action response onto the exception hierarchy.
 *
 * <ul>
 *   <li>HTML or otherwise non-XML body: connection error carrying the page text,
 *       authorization error for HTTP 401</li>
 *   <li>SOAP fault: {@link ProtocolException} of the kind matching the UPnP error code</li>
 * </ul>
 */
public final class ErrorMapper {

    private static final Pattern TAG = Pattern.compile("<[^>]*>");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private ErrorMapper() {
    }

    public static RouterException toException(int statusCode, String body) {
        Optional<Document> document = RouterResponse.looksLikeHtml(body)
                ? Optional.empty()
                : XmlSupport.tryParse(body);

        if (document.isEmpty()) {
            String message = "Unable to perform operation. " + stripTags(body);
            if (statusCode == 401) {
                return new RouterAuthorizationException(message.trim());
            }
            return new RouterConnectionException(message.trim());
        }
        return toProtocolException(statusCode, document.get().getDocumentElement());
    }

    private static ProtocolException toProtocolException(int statusCode, Element root) {
        String errorCode = XmlSupport.findFirst(root, "errorCode").map(XmlSupport::text).orElse(null);
        String errorDescription = XmlSupport.findFirst(root, "errorDescription").map(XmlSupport::text).orElse(null);

        List<String> lines = new ArrayList<>();
        XmlSupport.findFirst(root, "detail").ifPresent(detail -> collectLeaves(detail, lines));
        if (lines.isEmpty()) {
            lines.add("HTTP status " + statusCode);
        }

        return new ProtocolException(ErrorKind.fromCode(errorCode), errorCode, errorDescription,
                String.join("\n", lines));
    }

    private static void collectLeaves(Element element, List<String> lines) {
        List<Element> children = XmlSupport.childElements(element);
        for (Element child : children) {
            if (XmlSupport.childElements(child).isEmpty()) {
                lines.add(XmlSupport.localName(child) + ": " + XmlSupport.text(child));
            } else {
                collectLeaves(child, lines);
            }
        }
    }

    static String stripTags(String body) {
        if (body == null) {
            return "";
        }
        String text = TAG.matcher(body).replaceAll(" ");
        return WHITESPACE.matcher(text).replaceAll(" ").trim();
    }
}
