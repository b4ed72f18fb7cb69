package fr.lapetina.tr064.infrastructure.http;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Parsed {@code WWW-Authenticate: Digest ...} challenge.
 *
 * @param qop the offered quality of protection, null for the legacy RFC 2069 scheme
 */
public record DigestChallenge(
        String realm,
        String nonce,
        String qop,
        String opaque,
        String algorithm
) {

    private static final String SCHEME = "digest";

    /**
     * Parses a challenge header. Returns null when the header is not a digest challenge
     * or carries no nonce.
     */
    public static DigestChallenge parse(String header) {
        if (header == null) {
            return null;
        }
        String value = header.trim();
        if (value.length() <= SCHEME.length()
                || !value.substring(0, SCHEME.length()).toLowerCase(Locale.ROOT).equals(SCHEME)) {
            return null;
        }
        Map<String, String> params = parseParameters(value.substring(SCHEME.length()));
        String nonce = params.get("nonce");
        if (nonce == null) {
            return null;
        }
        return new DigestChallenge(
                params.getOrDefault("realm", ""),
                nonce,
                selectQop(params.get("qop")),
                params.get("opaque"),
                params.getOrDefault("algorithm", "MD5"));
    }

    // qop may list several options, e.g. "auth,auth-int"
    private static String selectQop(String offered) {
        if (offered == null) {
            return null;
        }
        for (String option : offered.split(",")) {
            if (option.trim().equalsIgnoreCase("auth")) {
                return "auth";
            }
        }
        return null;
    }

    static Map<String, String> parseParameters(String input) {
        Map<String, String> params = new LinkedHashMap<>();
        int i = 0;
        int length = input.length();
        while (i < length) {
            while (i < length && (input.charAt(i) == ',' || Character.isWhitespace(input.charAt(i)))) {
                i++;
            }
            int keyStart = i;
            while (i < length && input.charAt(i) != '=' && input.charAt(i) != ',') {
                i++;
            }
            String key = input.substring(keyStart, i).trim().toLowerCase(Locale.ROOT);
            if (i >= length || input.charAt(i) != '=') {
                continue;
            }
            i++;
            StringBuilder val = new StringBuilder();
            if (i < length && input.charAt(i) == '"') {
                i++;
                while (i < length && input.charAt(i) != '"') {
                    if (input.charAt(i) == '\\' && i + 1 < length) {
                        i++;
                    }
                    val.append(input.charAt(i));
                    i++;
                }
                i++;
            } else {
                while (i < length && input.charAt(i) != ',') {
                    val.append(input.charAt(i));
                    i++;
                }
            }
            if (!key.isEmpty()) {
                params.put(key, val.toString().trim());
            }
        }
        return params;
    }
}
