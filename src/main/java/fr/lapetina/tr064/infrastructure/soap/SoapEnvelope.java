package fr.lapetina.tr064.infrastructure.soap;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds SOAP 1.1 request envelopes and headers for router actions.
 */
public final class SoapEnvelope {

    static final String ENVELOPE_NAMESPACE = "http://schemas.xmlsoap.org/soap/envelope/";
    static final String ENCODING_STYLE = "http://schemas.xmlsoap.org/soap/encoding/";

    private SoapEnvelope() {
    }

    /**
     * Builds the request body. Arguments are written in iteration order of the map.
     */
    public static String build(String serviceType, String actionName, Map<String, ?> arguments) {
        StringBuilder body = new StringBuilder();
        if (arguments != null) {
            arguments.forEach((name, value) -> body
                    .append('<').append(name).append('>')
                    .append(encodeValue(value))
                    .append("</").append(name).append('>'));
        }
        return "<?xml version=\"1.0\" encoding=\"utf-8\"?>"
                + "<s:Envelope s:encodingStyle=\"" + ENCODING_STYLE + "\" xmlns:s=\"" + ENVELOPE_NAMESPACE + "\">"
                + "<s:Body>"
                + "<u:" + actionName + " xmlns:u=\"" + serviceType + "\">"
                + body
                + "</u:" + actionName + ">"
                + "</s:Body>"
                + "</s:Envelope>";
    }

    /**
     * Returns the HTTP headers for an action request.
     */
    public static Map<String, String> headers(String serviceType, String actionName) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Content-Type", "text/xml; charset=\"utf-8\"");
        headers.put("SOAPACTION", serviceType + "#" + actionName);
        return headers;
    }

    /**
     * Encodes one argument value. Booleans and null become 1 or 0, everything else is XML-escaped text.
     */
    static String encodeValue(Object value) {
        if (value == null) {
            return "0";
        }
        if (value instanceof Boolean) {
            return ((Boolean) value) ? "1" : "0";
        }
        return escape(value.toString());
    }

    static String escape(String text) {
        StringBuilder escaped = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '&' -> escaped.append("&amp;");
                case '<' -> escaped.append("&lt;");
                case '>' -> escaped.append("&gt;");
                case '"' -> escaped.append("&quot;");
                case '\'' -> escaped.append("&#x27;");
                default -> escaped.append(c);
            }
        }
        return escaped.toString();
    }
}
