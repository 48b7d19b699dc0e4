package com.apiflow.service.api;

import com.apiflow.model.Credential;

/**
 * Supplies the credential attached to outbound calls. Acquisition and refresh are the provider's
 * concern; it is asked once per call so a refreshed credential is picked up.
 */
public interface CredentialProvider {

    /**
     * @param authContext The auth context named by the call, e.g. {@code user}; may be {@code null}.
     * @return The credential to attach, never {@code null}.
     */
    Credential getCredential(String authContext);
}
