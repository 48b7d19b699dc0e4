package com.apiflow.model;

import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * The result of resolving a dot-path: a method leaf together with everything needed to invoke it,
 * but no arguments yet.
 */
@Value
@Builder
public class ResolvedMethod {

    String serviceId;
    String dotPath;
    InterfaceDocument document;
    MethodNode method;
    Credential credential;
    String key;
    Map<String, String> headers;

    /**
     * Whether the call creates a remote object, which turns a 409 into a benign duplicate.
     */
    boolean creation;

    @Override
    public String toString() {
        return serviceId + "." + document.getVersion() + "." + dotPath;
    }
}
