package com.apiflow.model;

import lombok.Builder;
import lombok.Value;

/**
 * Identifies the interface document a schema is derived from, and the type or method inside it.
 */
@Value
@Builder(toBuilder = true)
public class TypeReference {

    String serviceId;
    String version;

    /**
     * A schema name ({@code Advertiser}) or a method dot-path ({@code advertisers.list}).
     */
    String name;

    String auth;
    String key;
    String labels;
    String documentSource;
}
