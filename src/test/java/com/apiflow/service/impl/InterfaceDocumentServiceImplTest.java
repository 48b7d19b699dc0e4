package com.apiflow.service.impl;

import com.apiflow.TestResources;
import com.apiflow.config.EngineProperties;
import com.apiflow.engine.DocumentCache;
import com.apiflow.exception.ApiFlowException;
import com.apiflow.exception.MethodNotFoundException;
import com.apiflow.model.Credential;
import com.apiflow.model.InterfaceDocument;
import com.apiflow.model.MethodNode;
import com.apiflow.model.TypeNode;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.web.reactive.function.client.WebClient;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InterfaceDocumentServiceImplTest {

    private MockWebServer mockWebServer;
    private EngineProperties properties;
    private DocumentCache documentCache;
    private InterfaceDocumentServiceImpl documentService;
    private String widgetsJson;

    @BeforeEach
    void setUp() throws IOException {
        mockWebServer = new MockWebServer();
        mockWebServer.start();

        properties = new EngineProperties();
        properties.getRetry().setBaseWait(Duration.ofMillis(10));
        properties.getDiscovery().setUrlTemplate(mockWebServer.url("/").toString() + "{api}/{version}/rest");
        properties.getDiscovery().setDirectoryUrl(mockWebServer.url("/discovery/v1/apis").toString());

        documentCache = new DocumentCache();
        RetryExecutorImpl retryExecutor = new RetryExecutorImpl(new ErrorClassifierImpl(properties), properties);
        documentService = new InterfaceDocumentServiceImpl(WebClient.create(), documentCache, retryExecutor, properties);
        widgetsJson = TestResources.read("widgets-discovery.json");
    }

    @AfterEach
    void tearDown() throws IOException {
        mockWebServer.shutdown();
    }

    private static MockResponse json(String body) {
        return new MockResponse().setBody(body).addHeader("Content-Type", "application/json");
    }

    @Test
    void parse_shouldBuildMethodTreeWithGlobalParameters() {
        InterfaceDocument document = documentService.parse(widgetsJson);

        assertThat(document.getName()).isEqualTo("widgets");
        assertThat(document.getVersion()).isEqualTo("v1");
        assertThat(document.baseUrl()).isEqualTo("http://localhost:0/widgets/v1/");

        MethodNode list = document.method("widgets.list");
        assertThat(list.getId()).isEqualTo("widgets.widgets.list");
        assertThat(list.getHttpMethod()).isEqualTo("GET");
        assertThat(list.getPath()).isEqualTo("projects/{projectId}/widgets");
        assertThat(list.getParameters()).containsKeys("fields", "prettyPrint", "projectId", "pageToken", "maxResults");
        assertThat(list.getParameters().get("projectId").required()).isTrue();
        assertThat(list.getParameters().get("projectId").inPath()).isTrue();
        assertThat(list.getParameters().get("labels").repeated()).isTrue();
        assertThat(list.getParameterOrder()).containsExactly("projectId");
        assertThat(list.getResponseRef()).isEqualTo("ListWidgetsResponse");
        assertThat(list.getRequestRef()).isNull();

        assertThat(document.method("widgets.insert").getRequestRef()).isEqualTo("Widget");
        assertThat(document.method("widgets.parts.list").getPath()).isEqualTo("{+parent}/parts");
    }

    @Test
    void parse_shouldBuildTypeArena() {
        InterfaceDocument document = documentService.parse(widgetsJson);

        TypeNode response = document.schema("ListWidgetsResponse");
        assertThat(response.getKind()).isEqualTo(TypeNode.Kind.OBJECT);
        assertThat(response.getProperties()).containsOnlyKeys("items", "nextPageToken");
        TypeNode items = response.getProperties().get("items");
        assertThat(items.getKind()).isEqualTo(TypeNode.Kind.ARRAY);
        assertThat(items.getItems().getKind()).isEqualTo(TypeNode.Kind.REFERENCE);
        assertThat(items.getItems().getRef()).isEqualTo("Widget");

        TypeNode widget = document.schema("Widget");
        assertThat(widget.getAttributes().get("description").asText()).isEqualTo("A widget.");
        assertThat(widget.getProperties().get("count").getFormat()).isEqualTo("int32");
    }

    @Test
    void method_shouldListValidSegmentsWhenNotFound() {
        InterfaceDocument document = documentService.parse(widgetsJson);

        assertThatThrownBy(() -> document.method("widgets.lsit"))
                .isInstanceOf(MethodNotFoundException.class)
                .hasMessageContaining("lsit")
                .satisfies(e -> assertThat(((MethodNotFoundException) e).getValidSegments())
                        .containsExactly("delete", "get", "insert", "list", "parts", "search"));
        assertThatThrownBy(() -> document.method("gadgets.list"))
                .isInstanceOf(MethodNotFoundException.class)
                .satisfies(e -> assertThat(((MethodNotFoundException) e).getValidSegments()).containsExactly("widgets"));
    }

    @Test
    void parse_shouldRejectInvalidDocuments() {
        assertThatThrownBy(() -> documentService.parse("{not json"))
                .isInstanceOf(ApiFlowException.class)
                .hasMessageContaining("not valid JSON");
        assertThatThrownBy(() -> documentService.parse("[]"))
                .isInstanceOf(ApiFlowException.class);
    }

    @Test
    void getDocument_shouldFetchOnceAndCache() throws Exception {
        mockWebServer.enqueue(json(widgetsJson));
        Credential credential = Credential.bearer("abc");

        InterfaceDocument first = documentService.getDocument("widgets", "v1", "user", credential, "k1", null, null);
        InterfaceDocument second = documentService.getDocument("widgets", "v1", "user", credential, "k1", null, null);

        assertThat(second).isSameAs(first);
        assertThat(mockWebServer.getRequestCount()).isEqualTo(1);
        RecordedRequest request = mockWebServer.takeRequest();
        assertThat(request.getPath()).isEqualTo("/widgets/v1/rest?key=k1");
        assertThat(request.getHeader("Authorization")).isEqualTo("Bearer abc");
    }

    @Test
    void getDocument_shouldRetryTransientDiscoveryFailures() {
        mockWebServer.enqueue(new MockResponse().setResponseCode(503).setBody("busy"));
        mockWebServer.enqueue(json(widgetsJson));

        InterfaceDocument document = documentService.getDocument("widgets", "v1", null, Credential.anonymous(), null, "beta", null);

        assertThat(document.getName()).isEqualTo("widgets");
        assertThat(mockWebServer.getRequestCount()).isEqualTo(2);
    }

    @Test
    void getDocument_shouldKeyCacheByCredential() {
        documentService.getDocument("widgets", "v1", "user", Credential.bearer("a"), null, null, widgetsJson);
        documentService.getDocument("widgets", "v1", "user", Credential.bearer("a"), null, null, widgetsJson);
        documentService.getDocument("widgets", "v1", "user", Credential.bearer("b"), null, null, widgetsJson);

        assertThat(documentCache.size()).isEqualTo(2);
        assertThat(mockWebServer.getRequestCount()).isZero();
    }

    @Test
    void getDocument_shouldReadFileSource(@TempDir Path tempDir) throws IOException {
        Path file = tempDir.resolve("widgets.json");
        Files.writeString(file, widgetsJson);

        InterfaceDocument document = documentService.getDocument("widgets", "v1", null, Credential.anonymous(), null, null, file.toString());

        assertThat(document.method("widgets.get").getId()).isEqualTo("widgets.widgets.get");
        assertThatThrownBy(() -> documentService.getDocument("widgets", "v1", null, Credential.anonymous(), null, null,
                tempDir.resolve("missing.json").toString()))
                .isInstanceOf(ApiFlowException.class);
    }

    @Test
    void preferredVersion_shouldAskTheDirectory() throws Exception {
        mockWebServer.enqueue(json("{\"items\": [{\"name\": \"widgets\", \"version\": \"v2\", \"preferred\": true}]}"));

        assertThat(documentService.preferredVersion("widgets", null)).isEqualTo("v2");

        RecordedRequest request = mockWebServer.takeRequest();
        assertThat(request.getPath()).isEqualTo("/discovery/v1/apis?name=widgets&preferred=true");
    }

    @Test
    void preferredVersion_shouldFailForUnknownApi() {
        mockWebServer.enqueue(json("{\"kind\": \"discovery#directoryList\"}"));

        assertThatThrownBy(() -> documentService.preferredVersion("nothing", null))
                .isInstanceOf(ApiFlowException.class)
                .hasMessageContaining("nothing");
    }
}
