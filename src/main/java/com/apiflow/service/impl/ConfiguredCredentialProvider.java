package com.apiflow.service.impl;

import com.apiflow.config.EngineProperties;
import com.apiflow.exception.ApiFlowException;
import com.apiflow.model.Credential;
import com.apiflow.service.api.CredentialProvider;
import lombok.extern.slf4j.Slf4j;
import org.jasypt.encryption.StringEncryptor;
import org.springframework.stereotype.Service;

/**
 * A {@link CredentialProvider} backed by {@code apiflow.auth.tokens.<context>} properties.
 * <p>
 * Tokens may be stored encrypted as {@code ENC(...)}; they are decrypted on every request with the
 * Jasypt {@link StringEncryptor}, so the plain token is never held longer than one call. An auth
 * context without a token gets an anonymous credential, which is enough for public and
 * key-only APIs.
 */
@Service
@Slf4j
public class ConfiguredCredentialProvider implements CredentialProvider {

    private static final String ENCRYPTED_PREFIX = "ENC(";
    private static final String ENCRYPTED_SUFFIX = ")";

    private final EngineProperties properties;
    private final StringEncryptor encryptor;

    /**
     * @param properties The bound engine properties holding the token map.
     * @param encryptor  The {@link StringEncryptor} bean provided by the Jasypt Spring Boot starter.
     */
    public ConfiguredCredentialProvider(EngineProperties properties, StringEncryptor encryptor) {
        this.properties = properties;
        this.encryptor = encryptor;
    }

    @Override
    public Credential getCredential(String authContext) {
        String token = authContext == null ? null : properties.getAuth().getTokens().get(authContext);
        if (token == null || token.isBlank()) {
            log.debug("No token configured for auth context '{}', calling anonymously", authContext);
            return Credential.anonymous();
        }
        if (token.startsWith(ENCRYPTED_PREFIX) && token.endsWith(ENCRYPTED_SUFFIX)) {
            String cipherText = token.substring(ENCRYPTED_PREFIX.length(), token.length() - ENCRYPTED_SUFFIX.length());
            try {
                return Credential.bearer(encryptor.decrypt(cipherText));
            } catch (RuntimeException e) {
                log.error("Could not decrypt token for auth context '{}'. The secret key may have changed or is incorrect.", authContext);
                throw new ApiFlowException("Could not decrypt token for auth context '" + authContext + "'", e);
            }
        }
        return Credential.bearer(token);
    }
}
