package com.creatorradar.discovery.queue;

import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Date;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QueueSignatureVerifierTest {

    private static final String CURRENT_KEY = "sig_current_0123456789abcdef0123";
    private static final String NEXT_KEY = "sig_next_0123456789abcdef0123456";
    private static final String URL = "https://app.example.com/api/v2/worker/search";
    private static final byte[] BODY = "{\"jobId\":\"job-1\",\"batchIndex\":0}".getBytes(StandardCharsets.UTF_8);

    private QueueProperties properties;
    private QueueSignatureVerifier verifier;

    @BeforeEach
    void setUp() {
        properties = new QueueProperties();
        properties.setCurrentSigningKey(CURRENT_KEY);
        properties.setNextSigningKey(NEXT_KEY);
        verifier = new QueueSignatureVerifier(properties);
    }

    @Test
    @DisplayName("a token signed with the current key for this URL and body is accepted")
    void validSignature() {
        String token = sign(CURRENT_KEY, URL, QueueSignatureVerifier.bodyHash(BODY), Instant.now().plusSeconds(300));

        assertThatCode(() -> verifier.verify(token, URL, BODY)).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("padded body hashes are accepted")
    void paddedBodyHash() {
        String token = sign(CURRENT_KEY, URL, QueueSignatureVerifier.bodyHash(BODY) + "=", Instant.now().plusSeconds(300));

        assertThatCode(() -> verifier.verify(token, URL, BODY)).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("during key rotation a token signed with the next key is accepted")
    void rotatedKey() {
        String token = sign(NEXT_KEY, URL, QueueSignatureVerifier.bodyHash(BODY), Instant.now().plusSeconds(300));

        assertThatCode(() -> verifier.verify(token, URL, BODY)).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("a token issued for another URL is rejected")
    void wrongUrl() {
        String token = sign(CURRENT_KEY, "https://evil.example.com/api/v2/worker/search",
                QueueSignatureVerifier.bodyHash(BODY), Instant.now().plusSeconds(300));

        assertThatThrownBy(() -> verifier.verify(token, URL, BODY)).isInstanceOf(QueueSignatureException.class);
    }

    @Test
    @DisplayName("a tampered body is rejected")
    void tamperedBody() {
        String token = sign(CURRENT_KEY, URL, QueueSignatureVerifier.bodyHash(BODY), Instant.now().plusSeconds(300));
        byte[] tampered = "{\"jobId\":\"job-2\",\"batchIndex\":0}".getBytes(StandardCharsets.UTF_8);

        assertThatThrownBy(() -> verifier.verify(token, URL, tampered)).isInstanceOf(QueueSignatureException.class);
    }

    @Test
    @DisplayName("unknown keys, expired tokens and missing headers are rejected")
    void otherFailures() {
        String foreign = sign("some_other_key_0123456789abcdef0", URL, QueueSignatureVerifier.bodyHash(BODY),
                Instant.now().plusSeconds(300));
        String expired = sign(CURRENT_KEY, URL, QueueSignatureVerifier.bodyHash(BODY), Instant.now().minusSeconds(60));

        assertThatThrownBy(() -> verifier.verify(foreign, URL, BODY)).isInstanceOf(QueueSignatureException.class);
        assertThatThrownBy(() -> verifier.verify(expired, URL, BODY)).isInstanceOf(QueueSignatureException.class);
        assertThatThrownBy(() -> verifier.verify(null, URL, BODY)).isInstanceOf(QueueSignatureException.class);
        assertThatThrownBy(() -> verifier.verify("not-a-jwt", URL, BODY)).isInstanceOf(QueueSignatureException.class);
    }

    @Test
    @DisplayName("verification can be switched off for local development")
    void disabled() {
        properties.setVerifySignatures(false);

        assertThatCode(() -> verifier.verify(null, URL, BODY)).doesNotThrowAnyException();
    }

    static String sign(String key, String url, String bodyHash, Instant expiresAt) {
        return Jwts.builder()
                .issuer(QueueSignatureVerifier.ISSUER)
                .subject(url)
                .claim("body", bodyHash)
                .issuedAt(Date.from(expiresAt.minusSeconds(600)))
                .notBefore(Date.from(expiresAt.minusSeconds(600)))
                .expiration(Date.from(expiresAt))
                .signWith(Keys.hmacShaKeyFor(key.getBytes(StandardCharsets.UTF_8)))
                .compact();
    }
}
