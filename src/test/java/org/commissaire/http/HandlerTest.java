package org.commissaire.http;

import com.amazonaws.services.lambda.runtime.Context;
import com.google.gson.Gson;
import org.apache.logging.log4j.ThreadContext;
import org.commissaire.http.handlers.InMemoryStorageClient;
import org.commissaire.http.pojos.RequestContext;
import org.commissaire.http.pojos.RequestContextHttp;
import org.commissaire.http.pojos.RequestEvent;
import org.commissaire.http.rest.HttpRequest;
import org.commissaire.http.services.DispatcherConfig;
import org.commissaire.http.services.GsonFactory;
import org.commissaire.http.services.RemoteCallClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class HandlerTest {

    @Mock
    private Context context;

    private InMemoryStorageClient storage;
    private Handler handler;
    private final Gson gson = GsonFactory.create();

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        when(context.getAwsRequestId()).thenReturn("aws-request-1");
        storage = new InMemoryStorageClient();
        handler = new Handler(DispatcherConfig.defaults()) {
            @Override
            protected RemoteCallClient createRemoteCallClient(DispatcherConfig config) {
                return storage;
            }
        };
    }

    private static RequestEvent event(String method, String path, String body) {
        RequestContext requestContext = new RequestContext();
        requestContext.setRequestId("req");
        requestContext.setHttp(new RequestContextHttp(method, path));
        RequestEvent event = new RequestEvent();
        event.setRequestContext(requestContext);
        event.setRawPath(path);
        event.setBody(body);
        event.setHeaders(Map.of("content-type", "application/json"));
        return event;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> response(Object result) {
        assertTrue(result instanceof Map, "Expected a structured response but got " + result);
        return (Map<String, Object>) result;
    }

    @Test
    void testWarmupRequest() {
        // Arrange
        RequestEvent event = new RequestEvent();
        event.setSource("aws.events");

        // Act
        Object result = handler.handleRequest(event, context);

        // Assert
        assertEquals("Warmed up!", result);
        assertTrue(storage.calls().isEmpty());
    }

    @Test
    void testReloadHandlersEvent() {
        // Arrange
        RequestEvent event = new RequestEvent();
        event.setSource("aws.events");
        event.setDetailType("reload_handlers");

        // Act
        Object result = handler.handleRequest(event, context);

        // Assert
        assertEquals("Handlers reloaded", result);
        assertTrue(handler.getDispatcher().getHandlerRegistry().resolve("clusters.listClusters").isPresent());
    }

    @Test
    void testListClustersThroughLambda() {
        // Arrange
        storage.with("Cluster", Map.of("name", "dev", "hostset", List.of()));

        // Act
        Map<String, Object> response = response(handler.handleRequest(event("GET", "/api/v0/clusters/", null), context));

        // Assert
        assertEquals(200, response.get("statusCode"));
        assertEquals("[\"dev\"]", response.get("body"));
        assertEquals(Map.of("Content-Type", "application/json"), response.get("headers"));
    }

    @Test
    void testCreateNetworkWithBase64Body() {
        // Arrange
        String json = "{\"type\":\"flannel_etcd\"}";
        RequestEvent event = event("PUT", "/api/v0/network/net1/",
                Base64.getEncoder().encodeToString(json.getBytes(StandardCharsets.UTF_8)));
        event.setIsBase64Encoded(true);

        // Act
        Map<String, Object> response = response(handler.handleRequest(event, context));

        // Assert
        assertEquals(201, response.get("statusCode"));
        Map<?, ?> body = gson.fromJson((String) response.get("body"), Map.class);
        assertEquals("net1", body.get("name"));
        assertNotNull(storage.stored("Network", "net1"));
    }

    @Test
    void testAddClusterMemberIsOkNotCreated() {
        // Arrange
        storage.with("Cluster", Map.of("name", "dev", "hostset", List.of()));

        // Act
        Map<String, Object> response = response(
                handler.handleRequest(event("PUT", "/api/v0/cluster/dev/hosts/10.0.0.1/", null), context));

        // Assert
        assertEquals(200, response.get("statusCode"));
        assertEquals("[\"10.0.0.1\"]", response.get("body"));
    }

    @Test
    void testMissingHostIsJsonNotFound() {
        // Act
        Map<String, Object> response = response(handler.handleRequest(event("GET", "/api/v0/host/10.0.0.1/", null), context));

        // Assert
        assertEquals(404, response.get("statusCode"));
        assertEquals(Map.of("Content-Type", "application/json"), response.get("headers"));
        assertTrue(((String) response.get("body")).contains("\"code\":404"));
    }

    @Test
    void testUnknownPathIsNotFound() {
        // Act
        Map<String, Object> response = response(handler.handleRequest(event("GET", "/api/v1/clusters/", null), context));

        // Assert
        assertEquals(404, response.get("statusCode"));
        assertEquals("Not Found", response.get("body"));
        assertEquals(Map.of("Content-Type", "text/html"), response.get("headers"));
    }

    @Test
    void testStorageFailureInClusterMemberCheckIsInternalError() {
        // Arrange
        storage.failing("storage.get");

        // Act
        Map<String, Object> response = response(
                handler.handleRequest(event("GET", "/api/v0/cluster/dev/hosts/h1/", null), context));

        // Assert
        assertEquals(500, response.get("statusCode"));
        assertEquals("Internal Server Error", response.get("body"));
    }

    @Test
    void testUndecodableBodyIsBadRequest() {
        // Arrange
        RequestEvent event = event("PUT", "/api/v0/network/net1/", "***not base64***");
        event.setIsBase64Encoded(true);

        // Act
        Map<String, Object> response = response(handler.handleRequest(event, context));

        // Assert
        assertEquals(400, response.get("statusCode"));
        assertTrue(storage.calls().isEmpty());
    }

    @Test
    void testLoggingContextClearedAfterRequest() {
        // Act
        handler.handleRequest(event("GET", "/api/v0/clusters/", null), context);

        // Assert
        assertTrue(ThreadContext.isEmpty());
    }

    @Test
    void testToHttpRequest_AddsContentLengthAndFallsBackToContextPath() {
        // Arrange
        RequestEvent event = event("put", null, "{\"a\":1}");
        event.getRequestContext().getHttp().setPath("/api/v0/host/");
        event.setRawQueryString("x=1");

        // Act
        HttpRequest request = Handler.toHttpRequest(event);

        // Assert
        assertEquals("PUT", request.getMethod());
        assertEquals("/api/v0/host/", request.getPath());
        assertEquals("x=1", request.getQueryString());
        assertEquals(7, request.getContentLength());
    }

    @Test
    void testToHttpRequest_KeepsDeclaredContentLength() {
        // Arrange
        RequestEvent event = event("PUT", "/api/v0/host/", "{}");
        event.setHeaders(Map.of("Content-Length", "2"));

        // Act
        HttpRequest request = Handler.toHttpRequest(event);

        // Assert
        assertEquals(2, request.getContentLength());
        assertEquals(1, request.getHeaders().size());
    }

    @Test
    void testDispatcherFromConfigHonoursCollections() {
        // Arrange
        DispatcherConfig config = DispatcherConfig.fromValues(Map.of("handlerCollections", "networks"), key -> null);

        // Act & Assert
        assertEquals(4, Handler.createDispatcher(config).getHandlerRegistry().names().size());
    }
}
