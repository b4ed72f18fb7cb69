package fr.lapetina.tr064.infrastructure.http;

import java.util.Locale;

/**
 * Status, content type and body of a router answer.
 */
public record RouterResponse(int statusCode, String contentType, String body) {

    public boolean isSuccess() {
        return statusCode == 200;
    }

    public boolean isHtml() {
        if (contentType != null && contentType.toLowerCase(Locale.ROOT).contains("text/html")) {
            return true;
        }
        return looksLikeHtml(body);
    }

    /**
     * Tests whether a body starts with an html tag, ignoring case and leading whitespace.
     */
    public static boolean looksLikeHtml(String body) {
        if (body == null) {
            return false;
        }
        String trimmed = body.stripLeading();
        return trimmed.regionMatches(true, 0, "<html", 0, 5)
                || trimmed.regionMatches(true, 0, "<!doctype html", 0, 14);
    }
}
