package com.apiflow.service.api;

import com.apiflow.model.Credential;
import com.apiflow.model.InterfaceDocument;

public interface InterfaceDocumentService {

    /**
     * Returns the interface document of an API version, fetching and parsing it at most once per
     * cache key (service, version, auth context, calling thread, credential fingerprint).
     *
     * @param serviceId      The API name, e.g. {@code bigquery}.
     * @param version        The API version, e.g. {@code v2}.
     * @param authContext    The auth context of the caller, part of the cache key.
     * @param credential     The caller's credential; its fingerprint is part of the cache key.
     * @param key            Optional developer key appended to the discovery URL.
     * @param labels         Optional discovery labels appended to the discovery URL.
     * @param documentSource Optional inline JSON document or file path used instead of the endpoint.
     * @return The parsed document.
     */
    InterfaceDocument getDocument(String serviceId, String version, String authContext, Credential credential,
                                  String key, String labels, String documentSource);

    /**
     * Parses an interface document from its JSON text.
     */
    InterfaceDocument parse(String json);

    /**
     * Asks the discovery directory for the preferred version of an API.
     */
    String preferredVersion(String serviceId, String key);
}
