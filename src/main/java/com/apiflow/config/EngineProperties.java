package com.apiflow.config;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.stereotype.Component;
import org.springframework.util.unit.DataSize;

/**
 * Strongly-typed binding for all {@code apiflow.*} properties.
 *
 * <pre>
 * apiflow:
 *   retry:
 *     max-attempts: 3
 *     base-wait: 31s
 *     retryable-statuses: 429,500,503
 *     fatal-forbidden-reasons: forbidden,accountDisabled
 *   discovery:
 *     url-template: https://{api}.googleapis.com/$discovery/rest?version={version}
 *   schema:
 *     recursion-depth: 2
 *   auth:
 *     tokens:
 *       user: ENC(...)
 * </pre>
 */
@Data
@Component
@ConfigurationProperties(prefix = "apiflow")
public class EngineProperties {

    @NestedConfigurationProperty
    private RetryConfig retry = new RetryConfig();

    @NestedConfigurationProperty
    private DiscoveryConfig discovery = new DiscoveryConfig();

    @NestedConfigurationProperty
    private SchemaConfig schema = new SchemaConfig();

    @NestedConfigurationProperty
    private HttpConfig http = new HttpConfig();

    @NestedConfigurationProperty
    private AuthConfig auth = new AuthConfig();

    @NestedConfigurationProperty
    private RunConfig run = new RunConfig();

    // ------------------------------------------------------------------ //

    @Data
    public static class RetryConfig {
        /** Total attempts of one call, the first one included. */
        private int maxAttempts = 3;
        /** Wait before the first retry; doubled for every further retry. */
        private Duration baseWait = Duration.ofSeconds(31);
        private List<Integer> retryableStatuses = List.of(429, 500, 503);
        /** Error reasons that make a 403 permanent. Any other 403 is a rate limit and retried. */
        private List<String> fatalForbiddenReasons = List.of("forbidden", "accountDisabled");
        /** Method name prefixes of calls that create objects; a 409 on those is benign. */
        private List<String> creationMethods = List.of("insert", "create");
    }

    @Data
    public static class DiscoveryConfig {
        private String urlTemplate = "https://{api}.googleapis.com/$discovery/rest?version={version}";
        private String directoryUrl = "https://discovery.googleapis.com/discovery/v1/apis";
    }

    @Data
    public static class SchemaConfig {
        /** How many times one reference may be expanded along a single branch. */
        private int recursionDepth = 2;
        private int descriptionLength = 1024;
    }

    @Data
    public static class HttpConfig {
        private DataSize maxInMemorySize = DataSize.ofMegabytes(16);
    }

    @Data
    public static class AuthConfig {
        /** Bearer token per auth context, plain or jasypt {@code ENC(...)}. */
        private Map<String, String> tokens = new LinkedHashMap<>();
    }

    @Data
    public static class RunConfig {
        /** Path of a JSON call descriptor executed at startup, if any. */
        private String descriptor;
    }
}
