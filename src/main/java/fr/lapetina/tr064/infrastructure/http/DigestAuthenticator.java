package fr.lapetina.tr064.infrastructure.http;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * HTTP digest authentication (RFC 2617, MD5).
 *
 * Remembers the last challenge so that subsequent requests are authorized
 * up front, incrementing the nonce count for each of them.
 */
public final class DigestAuthenticator {

    private static final SecureRandom RANDOM = new SecureRandom();

    private final Supplier<String> cnonceSupplier;
    private final AtomicReference<DigestChallenge> challenge = new AtomicReference<>();
    private final AtomicInteger nonceCount = new AtomicInteger(0);

    public DigestAuthenticator() {
        this(DigestAuthenticator::randomCnonce);
    }

    public DigestAuthenticator(Supplier<String> cnonceSupplier) {
        this.cnonceSupplier = cnonceSupplier;
    }

    /**
     * Stores a fresh challenge, resetting the nonce count.
     */
    public void challenge(DigestChallenge newChallenge) {
        challenge.set(newChallenge);
        nonceCount.set(0);
    }

    /**
     * Returns the Authorization header value for a request, if a challenge is known.
     */
    public Optional<String> authorization(String method, String uri, Credentials credentials) {
        DigestChallenge current = challenge.get();
        if (current == null || !credentials.hasPassword()) {
            return Optional.empty();
        }
        int nc = nonceCount.incrementAndGet();
        return Optional.of(authorization(current, method, uri, credentials, nc, cnonceSupplier.get()));
    }

    String authorization(DigestChallenge ch, String method, String uri,
                         Credentials credentials, int nc, String cnonce) {
        String ncValue = String.format("%08x", nc);
        String digest = response(ch, method, uri, credentials, ncValue, cnonce);

        StringBuilder header = new StringBuilder("Digest ")
                .append("username=\"").append(credentials.user()).append('"')
                .append(", realm=\"").append(ch.realm()).append('"')
                .append(", nonce=\"").append(ch.nonce()).append('"')
                .append(", uri=\"").append(uri).append('"')
                .append(", response=\"").append(digest).append('"')
                .append(", algorithm=MD5");
        if (ch.opaque() != null) {
            header.append(", opaque=\"").append(ch.opaque()).append('"');
        }
        if (ch.qop() != null) {
            header.append(", qop=").append(ch.qop())
                    .append(", nc=").append(ncValue)
                    .append(", cnonce=\"").append(cnonce).append('"');
        }
        return header.toString();
    }

    /**
     * Computes the request digest. Without qop the legacy RFC 2069 form is used.
     */
    static String response(DigestChallenge ch, String method, String uri,
                           Credentials credentials, String nc, String cnonce) {
        String ha1 = md5(credentials.user() + ":" + ch.realm() + ":" + credentials.password());
        String ha2 = md5(method + ":" + uri);
        if (ch.qop() == null) {
            return md5(ha1 + ":" + ch.nonce() + ":" + ha2);
        }
        return md5(ha1 + ":" + ch.nonce() + ":" + nc + ":" + cnonce + ":" + ch.qop() + ":" + ha2);
    }

    static String md5(String input) {
        try {
            MessageDigest md = MessageDigest.getInstance("MD5");
            byte[] digest = md.digest(input.getBytes(StandardCharsets.UTF_8));
            StringBuilder hex = new StringBuilder(digest.length * 2);
            for (byte b : digest) {
                hex.append(String.format("%02x", b));
            }
            return hex.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
    }

    private static String randomCnonce() {
        byte[] bytes = new byte[8];
        RANDOM.nextBytes(bytes);
        StringBuilder hex = new StringBuilder();
        for (byte b : bytes) {
            hex.append(String.format("%02x", b));
        }
        return hex.toString();
    }
}
