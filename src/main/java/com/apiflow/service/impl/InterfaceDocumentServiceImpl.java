package com.apiflow.service.impl;

import com.apiflow.config.EngineProperties;
import com.apiflow.engine.DocumentCache;
import com.apiflow.exception.ApiFlowException;
import com.apiflow.model.Credential;
import com.apiflow.model.InterfaceDocument;
import com.apiflow.model.MethodNode;
import com.apiflow.model.ParameterNode;
import com.apiflow.model.ResourceNode;
import com.apiflow.model.TypeNode;
import com.apiflow.service.api.InterfaceDocumentService;
import com.apiflow.service.api.RetryExecutor;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Loads interface (discovery) documents and parses them into the method tree and type arena.
 * <p>
 * A document comes either from the discovery endpoint ({@code apiflow.discovery.url-template}) or
 * from a local source: inline JSON when the source starts with <code>{</code>, a file path
 * otherwise. Parsed documents are memoized in the {@link DocumentCache}.
 */
@Service
@Slf4j
public class InterfaceDocumentServiceImpl implements InterfaceDocumentService {

    private static final Set<String> STRUCTURAL_KEYS = Set.of("$ref", "type", "format", "properties", "items", "additionalProperties");

    private final WebClient webClient;
    private final DocumentCache documentCache;
    private final RetryExecutor retryExecutor;
    private final EngineProperties properties;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public InterfaceDocumentServiceImpl(WebClient webClient, DocumentCache documentCache,
                                        RetryExecutor retryExecutor, EngineProperties properties) {
        this.webClient = webClient;
        this.documentCache = documentCache;
        this.retryExecutor = retryExecutor;
        this.properties = properties;
    }

    @Override
    public InterfaceDocument getDocument(String serviceId, String version, String authContext, Credential credential,
                                         String key, String labels, String documentSource) {
        DocumentCache.Key cacheKey = new DocumentCache.Key(serviceId, version, authContext,
                Thread.currentThread().getId(), credential.fingerprint(), key, labels,
                documentSource == null ? 0 : documentSource.hashCode());
        return documentCache.get(cacheKey, () -> load(serviceId, version, credential, key, labels, documentSource));
    }

    private InterfaceDocument load(String serviceId, String version, Credential credential,
                                   String key, String labels, String documentSource) {
        if (documentSource != null && !documentSource.isBlank()) {
            String source = documentSource.strip();
            if (source.startsWith("{")) {
                log.info("Parsing inline interface document for {} {}", serviceId, version);
                return parse(source);
            }
            log.info("Loading interface document for {} {} from file {}", serviceId, version, source);
            try {
                return parse(Files.readString(Path.of(source)));
            } catch (IOException e) {
                throw new ApiFlowException("Failed to read interface document from " + source, e);
            }
        }

        URI uri = UriComponentsBuilder.fromUriString(properties.getDiscovery().getUrlTemplate())
                .queryParamIfPresent("key", Optional.ofNullable(key))
                .queryParamIfPresent("labels", Optional.ofNullable(labels))
                .buildAndExpand(Map.of("api", serviceId, "version", version))
                .encode()
                .toUri();
        log.info("Fetching interface document for {} {} from {}", serviceId, version, uri);
        JsonNode document = retryExecutor.execute(() -> webClient.get()
                .uri(uri)
                .headers(credential::applyTo)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .block(), false);
        return parse(document);
    }

    @Override
    public InterfaceDocument parse(String json) {
        try {
            return parse(objectMapper.readTree(json));
        } catch (JsonProcessingException e) {
            throw new ApiFlowException("Interface document is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    InterfaceDocument parse(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new ApiFlowException("Interface document must be a JSON object");
        }
        InterfaceDocument.InterfaceDocumentBuilder builder = InterfaceDocument.builder()
                .name(root.path("name").asText(null))
                .version(root.path("version").asText(null))
                .rootUrl(root.path("rootUrl").asText(null))
                .servicePath(root.path("servicePath").asText(null));

        root.path("schemas").fields().forEachRemaining(entry -> builder.schema(entry.getKey(), parseType(entry.getValue())));

        Map<String, ParameterNode> globalParameters = parseParameters(root.path("parameters"));
        ResourceNode tree = parseResource(root.path("name").asText(""), root, globalParameters);
        InterfaceDocument document = builder.root(tree).build();
        log.info("Parsed interface document {} {} with {} schemas and {} top-level resources",
                document.getName(), document.getVersion(), document.getSchemas().size(), tree.getResources().size());
        return document;
    }

    private ResourceNode parseResource(String name, JsonNode node, Map<String, ParameterNode> globalParameters) {
        ResourceNode.ResourceNodeBuilder builder = ResourceNode.builder().name(name);
        node.path("resources").fields().forEachRemaining(entry ->
                builder.resource(entry.getKey(), parseResource(entry.getKey(), entry.getValue(), globalParameters)));
        node.path("methods").fields().forEachRemaining(entry ->
                builder.method(entry.getKey(), parseMethod(entry.getKey(), entry.getValue(), globalParameters)));
        return builder.build();
    }

    private MethodNode parseMethod(String name, JsonNode node, Map<String, ParameterNode> globalParameters) {
        Map<String, ParameterNode> parameters = new LinkedHashMap<>(globalParameters);
        parameters.putAll(parseParameters(node.path("parameters")));

        List<String> order = new ArrayList<>();
        node.path("parameterOrder").forEach(p -> order.add(p.asText()));

        return MethodNode.builder()
                .id(node.path("id").asText(name))
                .name(name)
                .httpMethod(node.path("httpMethod").asText("GET"))
                .path(node.path("path").asText(node.path("flatPath").asText("")))
                .description(node.path("description").asText(null))
                .parameters(parameters)
                .parameterOrder(order)
                .requestRef(node.path("request").path("$ref").asText(null))
                .responseRef(node.path("response").path("$ref").asText(null))
                .build();
    }

    private Map<String, ParameterNode> parseParameters(JsonNode node) {
        Map<String, ParameterNode> parameters = new LinkedHashMap<>();
        node.fields().forEachRemaining(entry -> {
            JsonNode p = entry.getValue();
            parameters.put(entry.getKey(), new ParameterNode(
                    entry.getKey(),
                    p.path("type").asText("string"),
                    p.path("format").asText(null),
                    p.path("location").asText("query"),
                    p.path("required").asBoolean(false),
                    p.path("repeated").asBoolean(false)));
        });
        return parameters;
    }

    TypeNode parseType(JsonNode node) {
        Map<String, JsonNode> attributes = new LinkedHashMap<>();
        node.fields().forEachRemaining(entry -> {
            if (!STRUCTURAL_KEYS.contains(entry.getKey())) {
                attributes.put(entry.getKey(), entry.getValue());
            }
        });

        if (node.hasNonNull("$ref")) {
            return TypeNode.reference(node.get("$ref").asText(), attributes);
        }
        String type = node.path("type").asText(null);
        if ("array".equals(type) || node.has("items")) {
            return TypeNode.array(parseType(node.path("items").isObject() ? node.get("items") : objectMapper.createObjectNode()), attributes);
        }
        if ("object".equals(type) || node.has("properties") || node.has("additionalProperties")) {
            Map<String, TypeNode> properties = new LinkedHashMap<>();
            node.path("properties").fields().forEachRemaining(entry -> properties.put(entry.getKey(), parseType(entry.getValue())));
            JsonNode additional = node.path("additionalProperties");
            return TypeNode.object(properties, additional.isObject() ? parseType(additional) : null, attributes);
        }
        return TypeNode.scalar(type, node.path("format").asText(null), attributes);
    }

    @Override
    public String preferredVersion(String serviceId, String key) {
        URI uri = UriComponentsBuilder.fromUriString(properties.getDiscovery().getDirectoryUrl())
                .queryParam("name", serviceId)
                .queryParam("preferred", true)
                .queryParamIfPresent("key", Optional.ofNullable(key))
                .encode()
                .build()
                .toUri();
        JsonNode directory = retryExecutor.execute(() -> webClient.get()
                .uri(uri)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .block(), false);
        JsonNode items = directory == null ? null : directory.path("items");
        if (items == null || items.isEmpty()) {
            throw new ApiFlowException("No preferred version listed for API '" + serviceId + "'");
        }
        return items.get(0).path("version").asText();
    }
}
