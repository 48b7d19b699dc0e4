package com.apiflow.service.impl;

import com.apiflow.config.EngineProperties;
import com.apiflow.engine.ArgumentSanitizer;
import com.apiflow.engine.PageIterator;
import com.apiflow.exception.BadArgumentException;
import com.apiflow.model.BoundCall;
import com.apiflow.model.CallDescriptor;
import com.apiflow.model.CallResult;
import com.apiflow.model.Credential;
import com.apiflow.model.InterfaceDocument;
import com.apiflow.model.MethodNode;
import com.apiflow.model.ParameterNode;
import com.apiflow.model.ResolvedMethod;
import com.apiflow.service.api.CallBuilder;
import com.apiflow.service.api.CredentialProvider;
import com.apiflow.service.api.InterfaceDocumentService;
import com.apiflow.service.api.RetryExecutor;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

@Service
@Slf4j
public class CallBuilderImpl implements CallBuilder {

    /**
     * Path template variables: {@code {name}} for a single segment, {@code {+name}} for a reserved
     * expansion that may contain slashes.
     */
    private static final Pattern PATH_VARIABLE = Pattern.compile("\\{(\\+?)([^}]+)\\}");
    private static final Pattern INTEGER = Pattern.compile("-?\\d+");
    private static final Pattern NUMBER = Pattern.compile("-?\\d+(\\.\\d+)?([eE][-+]?\\d+)?");

    private final WebClient webClient;
    private final InterfaceDocumentService documentService;
    private final CredentialProvider credentialProvider;
    private final RetryExecutor retryExecutor;
    private final EngineProperties properties;

    public CallBuilderImpl(WebClient webClient, InterfaceDocumentService documentService, CredentialProvider credentialProvider,
                           RetryExecutor retryExecutor, EngineProperties properties) {
        this.webClient = webClient;
        this.documentService = documentService;
        this.credentialProvider = credentialProvider;
        this.retryExecutor = retryExecutor;
        this.properties = properties;
    }

    @Override
    public ResolvedMethod resolve(CallDescriptor descriptor) {
        Credential credential = credentialProvider.getCredential(descriptor.getAuth());
        String version = descriptor.getVersion();
        if (version == null || version.isBlank()) {
            version = documentService.preferredVersion(descriptor.getServiceId(), descriptor.getKey());
            log.info("Using preferred version {} of {}", version, descriptor.getServiceId());
        }
        InterfaceDocument document = documentService.getDocument(descriptor.getServiceId(), version, descriptor.getAuth(),
                credential, descriptor.getKey(), descriptor.getLabels(), descriptor.getDocumentSource());
        MethodNode method = document.method(descriptor.getMethod());
        boolean creation = properties.getRetry().getCreationMethods().stream().anyMatch(method.getName()::startsWith);

        return ResolvedMethod.builder()
                .serviceId(descriptor.getServiceId())
                .dotPath(descriptor.getMethod())
                .document(document)
                .method(method)
                .credential(credential)
                .key(descriptor.getKey())
                .headers(descriptor.getHeaders())
                .creation(creation)
                .build();
    }

    @Override
    public BoundCall bind(ResolvedMethod resolved, Map<String, Object> arguments) {
        MethodNode method = resolved.getMethod();
        Map<String, Object> clean = ArgumentSanitizer.sanitize(arguments);

        for (Map.Entry<String, Object> argument : clean.entrySet()) {
            String name = argument.getKey();
            if (BoundCall.BODY.equals(name)) {
                if (method.getRequestRef() == null) {
                    throw new BadArgumentException(method.getId(), "the method takes no request body");
                }
                continue;
            }
            ParameterNode parameter = method.getParameters().get(name);
            if (parameter == null) {
                throw new BadArgumentException(method.getId(),
                        "unknown parameter '" + name + "', expected one of " + new TreeSet<>(method.getParameters().keySet()));
            }
            checkType(method.getId(), parameter, argument.getValue());
        }
        for (ParameterNode parameter : method.getParameters().values()) {
            if (parameter.required() && clean.get(parameter.name()) == null) {
                throw new BadArgumentException(method.getId(), "missing required parameter '" + parameter.name() + "'");
            }
        }
        return new BoundCall(resolved, clean);
    }

    @Override
    public CallResult run(BoundCall call, boolean iterate, Integer limit) {
        JsonNode first = execute(call);
        if (iterate) {
            return CallResult.ofElements(new PageIterator(token -> execute(call.withPageToken(token)), first, limit));
        }
        return CallResult.ofValue(first);
    }

    private JsonNode execute(BoundCall call) {
        return retryExecutor.execute(() -> send(call), call.getResolved().isCreation());
    }

    private JsonNode send(BoundCall call) {
        ResolvedMethod resolved = call.getResolved();
        MethodNode method = resolved.getMethod();
        URI uri = buildUri(resolved, call.getArguments());
        log.info("API CALL: {} {} {}", resolved, method.getHttpMethod(), uri.getPath());

        WebClient.RequestBodySpec request = webClient.method(HttpMethod.valueOf(method.getHttpMethod().toUpperCase()))
                .uri(uri)
                .headers(headers -> {
                    resolved.getCredential().applyTo(headers);
                    if (resolved.getHeaders() != null) {
                        headers.setAll(resolved.getHeaders());
                    }
                });
        WebClient.RequestHeadersSpec<?> spec = request;
        Object body = call.getArguments().get(BoundCall.BODY);
        if (body != null) {
            spec = request.contentType(MediaType.APPLICATION_JSON).bodyValue(body);
        }
        JsonNode response = spec.retrieve().bodyToMono(JsonNode.class).block();
        // methods without a response body, e.g. deletes
        return response == null ? JsonNodeFactory.instance.objectNode() : response;
    }

    URI buildUri(ResolvedMethod resolved, Map<String, Object> arguments) {
        MethodNode method = resolved.getMethod();
        Matcher matcher = PATH_VARIABLE.matcher(method.getPath());
        StringBuilder path = new StringBuilder();
        while (matcher.find()) {
            Object value = arguments.get(matcher.group(2));
            if (value == null) {
                throw new BadArgumentException(method.getId(), "no value for path variable '" + matcher.group(2) + "'");
            }
            String text = String.valueOf(value);
            String encoded = matcher.group(1).isEmpty()
                    ? UriUtils.encodePathSegment(text, StandardCharsets.UTF_8)
                    : UriUtils.encodePath(text, StandardCharsets.UTF_8);
            matcher.appendReplacement(path, Matcher.quoteReplacement(encoded));
        }
        matcher.appendTail(path);

        String base = resolved.getDocument().baseUrl();
        String relative = path.toString();
        if (base.endsWith("/") && relative.startsWith("/")) {
            relative = relative.substring(1);
        }
        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(base + relative);
        arguments.forEach((name, value) -> {
            if (value == null || BoundCall.BODY.equals(name)) {
                return;
            }
            ParameterNode parameter = method.getParameters().get(name);
            if (parameter != null && parameter.inPath()) {
                return;
            }
            Collection<?> values = value instanceof Collection<?> collection ? collection : List.of(value);
            values.forEach(item -> builder.queryParam(name, encodeQueryValue(String.valueOf(item))));
        });
        if (resolved.getKey() != null) {
            builder.queryParam("key", encodeQueryValue(resolved.getKey()));
        }
        return builder.build(true).toUri();
    }

    /**
     * Encodes a query value. A literal {@code +} reads as a space on the server, so it is escaped
     * too; page tokens and RFC 3339 offsets both carry it.
     */
    static String encodeQueryValue(String value) {
        return UriUtils.encodeQueryParam(value, StandardCharsets.UTF_8).replace("+", "%2B");
    }

    private void checkType(String methodId, ParameterNode parameter, Object value) {
        if (value == null) {
            return;
        }
        if (value instanceof Collection<?> values) {
            if (!parameter.repeated()) {
                throw new BadArgumentException(methodId, "parameter '" + parameter.name() + "' takes a single value, got a list");
            }
            values.forEach(item -> checkScalar(methodId, parameter, item));
            return;
        }
        checkScalar(methodId, parameter, value);
    }

    private void checkScalar(String methodId, ParameterNode parameter, Object value) {
        boolean valid = switch (parameter.type()) {
            case "string" -> value instanceof CharSequence;
            case "integer" -> isIntegral(value) || (value instanceof CharSequence text && INTEGER.matcher(text).matches());
            case "number" -> value instanceof Number || (value instanceof CharSequence text && NUMBER.matcher(text).matches());
            case "boolean" -> value instanceof Boolean || "true".equals(value) || "false".equals(value);
            default -> true;
        };
        if (!valid) {
            throw new BadArgumentException(methodId, "parameter '" + parameter.name() + "' expects a " + parameter.type()
                    + ", got " + value.getClass().getSimpleName() + " " + value);
        }
    }

    private static boolean isIntegral(Object value) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte || value instanceof BigInteger) {
            return true;
        }
        return value instanceof BigDecimal decimal && decimal.stripTrailingZeros().scale() <= 0;
    }
}
