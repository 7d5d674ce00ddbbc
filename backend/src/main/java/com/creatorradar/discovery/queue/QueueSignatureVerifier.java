package com.creatorradar.discovery.queue;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

/**
 * Verifies the {@code Upstash-Signature} header of a delivery: an HS256 JWT signed with the current signing key
 * (or the next one during rotation) whose claims bind it to the exact callback URL and body.
 * <ul>
 *   <li>{@code iss} = "Upstash"</li>
 *   <li>{@code sub} = the URL the message was delivered to</li>
 *   <li>{@code body} = base64url(SHA-256(raw body)), padding ignored</li>
 * </ul>
 * Expiry and not-before are enforced by the parser with a small clock skew.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class QueueSignatureVerifier {

    static final String ISSUER = "Upstash";

    private final QueueProperties properties;

    /**
     * @throws QueueSignatureException when the header is missing or no configured key accepts it
     */
    public void verify(String signature, String url, byte[] body) {
        if (!properties.isVerifySignatures()) {
            return;
        }
        if (signature == null || signature.isBlank()) {
            throw new QueueSignatureException("Missing Upstash-Signature header");
        }
        List<String> keys = signingKeys();
        if (keys.isEmpty()) {
            throw new QueueSignatureException("No signing keys configured");
        }
        QueueSignatureException last = null;
        for (String key : keys) {
            try {
                verifyWithKey(signature, key, url, body);
                return;
            } catch (QueueSignatureException e) {
                last = e;
            }
        }
        log.warn("Rejected delivery to {}: {}", url, last.getMessage());
        throw last;
    }

    private void verifyWithKey(String signature, String key, String url, byte[] body) {
        Claims claims;
        try {
            claims = Jwts.parser()
                    .verifyWith(Keys.hmacShaKeyFor(key.getBytes(StandardCharsets.UTF_8)))
                    .clockSkewSeconds(properties.getClockSkewSeconds())
                    .requireIssuer(ISSUER)
                    .build()
                    .parseSignedClaims(signature)
                    .getPayload();
        } catch (JwtException | IllegalArgumentException e) {
            throw new QueueSignatureException("Invalid signature: " + e.getMessage(), e);
        }
        if (!url.equals(claims.getSubject())) {
            throw new QueueSignatureException("Signature subject " + claims.getSubject() + " does not match " + url);
        }
        String expectedBody = stripPadding(claims.get("body", String.class));
        if (!bodyHash(body).equals(expectedBody)) {
            throw new QueueSignatureException("Body hash does not match signature");
        }
    }

    private List<String> signingKeys() {
        List<String> keys = new ArrayList<>(2);
        if (properties.getCurrentSigningKey() != null && !properties.getCurrentSigningKey().isBlank()) {
            keys.add(properties.getCurrentSigningKey());
        }
        if (properties.getNextSigningKey() != null && !properties.getNextSigningKey().isBlank()) {
            keys.add(properties.getNextSigningKey());
        }
        return keys;
    }

    static String bodyHash(byte[] body) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(body != null ? body : new byte[0]);
            return Base64.getUrlEncoder().withoutPadding().encodeToString(digest);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }

    private static String stripPadding(String value) {
        if (value == null) {
            return "";
        }
        int end = value.length();
        while (end > 0 && value.charAt(end - 1) == '=') {
            end--;
        }
        return value.substring(0, end);
    }
}
