package com.apiflow.model;

import org.springframework.http.HttpHeaders;
import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;

/**
 * An opaque credential attached to every outbound call. The engine never inspects or persists it.
 */
public interface Credential {

    /**
     * Adds whatever authorization the credential carries to the outgoing request.
     */
    void applyTo(HttpHeaders headers);

    /**
     * A stable, non-reversible fingerprint used as part of the document cache key.
     */
    String fingerprint();

    static Credential anonymous() {
        return Anonymous.INSTANCE;
    }

    static Credential bearer(String token) {
        return new Bearer(token);
    }

    enum Anonymous implements Credential {
        INSTANCE;

        @Override
        public void applyTo(HttpHeaders headers) {
            // no authorization header
        }

        @Override
        public String fingerprint() {
            return "anonymous";
        }
    }

    record Bearer(String token) implements Credential {

        @Override
        public void applyTo(HttpHeaders headers) {
            headers.setBearerAuth(token);
        }

        @Override
        public String fingerprint() {
            return DigestUtils.md5DigestAsHex(token.getBytes(StandardCharsets.UTF_8));
        }

        @Override
        public String toString() {
            return "Bearer[" + fingerprint() + "]";
        }
    }
}
