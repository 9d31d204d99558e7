package org.commissaire.http.rest;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.ThreadContext;
import org.commissaire.http.LogCapture;
import org.commissaire.http.pojos.CallEnvelope;
import org.commissaire.http.pojos.CallError;
import org.commissaire.http.pojos.CallResult;
import org.commissaire.http.pojos.RpcErrorCode;
import org.commissaire.http.services.LoggingService;
import org.commissaire.http.services.RemoteCallClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

public class DispatcherTest {

    private static final String NAME = "[a-zA-Z0-9\\-_]+";

    @Mock
    private RemoteCallClient client;

    @Mock
    private InputStream untouchedBody;

    private RouteTable routes;
    private Map<String, RpcHandler> registered;
    private Dispatcher dispatcher;
    private AtomicInteger ids;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        routes = new RouteTable();
        registered = new LinkedHashMap<>();
        HandlerCollection clusters = new HandlerCollection() {
            @Override
            public String name() {
                return "clusters";
            }

            @Override
            public void describe(HandlerTable table) {
                registered.forEach(table::function);
            }
        };
        ids = new AtomicInteger();
        dispatcher = new Dispatcher(routes, new HandlerRegistry(List.of(clusters)), new ParameterExtractor(),
                () -> "req-" + ids.incrementAndGet());
        dispatcher.attachRemoteCallClient(client);
    }

    private static HttpRequest get(String path) {
        return new HttpRequest("GET", path, null, Map.of(), new ByteArrayInputStream(new byte[0]));
    }

    private static HttpRequest put(String path, String body) {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        return new HttpRequest("PUT", path, null, Map.of("Content-Length", String.valueOf(bytes.length)),
                new ByteArrayInputStream(bytes));
    }

    private static HandlerRef returning(Object result) {
        return HandlerRef.direct("test", (envelope, client) -> CallResult.success(envelope.getId(), result));
    }

    @Test
    @DisplayName("GET list route answers 200 with the result as JSON")
    void testDispatch_GetList() {
        // Arrange
        routes.get("/api/v0/clusters/", Map.of(), returning(List.of("a", "b")));

        // Act
        DispatchOutcome outcome = dispatcher.dispatch(get("/api/v0/clusters/"));

        // Assert
        assertEquals(DispatchOutcome.Kind.SUCCESS, outcome.getKind());
        assertEquals(200, outcome.getResponse().getStatusCode());
        assertEquals("application/json", outcome.getResponse().getContentType());
        assertEquals("[\"a\",\"b\"]", outcome.getResponse().getBody());
    }

    @Test
    void testDispatch_PutWithAddActionIsOk() {
        // Arrange
        routes.register("/api/v0/cluster/{name}/hosts/", Set.of("PUT"), Map.of("name", NAME),
                returning(List.of("h1")), ResponseConverter.ACTION_ADD);

        // Act
        DispatchOutcome outcome = dispatcher.dispatch(put("/api/v0/cluster/dev/hosts/", "{\"old\":[],\"new\":[\"h1\"]}"));

        // Assert
        assertEquals(200, outcome.getResponse().getStatusCode());
        assertEquals("[\"h1\"]", outcome.getResponse().getBody());
    }

    @Test
    void testDispatch_PutWithoutActionCreates() {
        // Arrange
        routes.put("/api/v0/cluster/{name}/", Map.of("name", NAME), returning(Map.of("name", "x")));

        // Act
        DispatchOutcome outcome = dispatcher.dispatch(put("/api/v0/cluster/x/", ""));

        // Assert
        assertEquals(DispatchOutcome.Kind.SUCCESS, outcome.getKind());
        assertEquals(201, outcome.getResponse().getStatusCode());
        assertEquals("{\"name\":\"x\"}", outcome.getResponse().getBody());
    }

    @Test
    void testDispatch_DomainErrorIsMapped() {
        // Arrange
        routes.get("/api/v0/cluster/{name}/", Map.of("name", NAME), HandlerRef.direct("missing",
                (envelope, client) -> CallResult.failure(envelope.getId(), RpcErrorCode.NOT_FOUND, "missing")));

        // Act
        DispatchOutcome outcome = dispatcher.dispatch(get("/api/v0/cluster/gone/"));

        // Assert
        assertEquals(DispatchOutcome.Kind.DOMAIN_ERROR, outcome.getKind());
        assertEquals(404, outcome.getResponse().getStatusCode());
        assertEquals("application/json", outcome.getResponse().getContentType());
        assertEquals("{\"code\":404,\"message\":\"missing\"}", outcome.getResponse().getBody());
    }

    @Test
    void testDispatch_ConflictIsMapped() {
        // Arrange
        routes.get("/c", Map.of(), HandlerRef.direct("conflict",
                (envelope, client) -> CallResult.failure(envelope.getId(), RpcErrorCode.CONFLICT, "taken")));

        // Act & Assert
        assertEquals(409, dispatcher.dispatch(get("/c")).getResponse().getStatusCode());
    }

    @Test
    void testDispatch_UnmappedErrorCodeIsInternalError() {
        // Arrange
        routes.get("/api/v0/clusters/", Map.of(), HandlerRef.direct("odd",
                (envelope, client) -> CallResult.failure(envelope.getId(), new CallError(999999, null))));

        try (LogCapture logs = LogCapture.attach()) {
            // Act
            DispatchOutcome outcome = dispatcher.dispatch(get("/api/v0/clusters/"));

            // Assert
            assertEquals(DispatchOutcome.Kind.UNHANDLED_EXCEPTION, outcome.getKind());
            assertEquals(500, outcome.getResponse().getStatusCode());
            assertEquals("text/html", outcome.getResponse().getContentType());
            assertEquals("Internal Server Error", outcome.getResponse().getBody());
            assertEquals(1, logs.count(Level.ERROR));
        }
    }

    @Test
    void testDispatch_UnroutablePathIsExactNotFound() {
        // Arrange
        routes.get("/api/v0/clusters/", Map.of(), returning(List.of()));

        // Act
        DispatchOutcome outcome = dispatcher.dispatch(get("/api/v0/nothing/"));

        // Assert
        assertEquals(DispatchOutcome.Kind.ROUTE_NOT_FOUND, outcome.getKind());
        assertEquals(404, outcome.getResponse().getStatusCode());
        assertEquals("text/html", outcome.getResponse().getContentType());
        assertEquals("Not Found", outcome.getResponse().getBody());
        assertNull(outcome.getEnvelopeId());
        verifyNoInteractions(client);
    }

    @Test
    void testDispatch_HandlerExceptionIsExactInternalErrorWithOneErrorLog() {
        // Arrange
        routes.get("/api/v0/clusters/", Map.of(), HandlerRef.direct("boom", (envelope, client) -> {
            throw new IllegalStateException("storage exploded");
        }));

        try (LogCapture logs = LogCapture.attach()) {
            // Act
            DispatchOutcome outcome = dispatcher.dispatch(get("/api/v0/clusters/"));

            // Assert
            assertEquals(DispatchOutcome.Kind.UNHANDLED_EXCEPTION, outcome.getKind());
            assertEquals(500, outcome.getResponse().getStatusCode());
            assertEquals("text/html", outcome.getResponse().getContentType());
            assertEquals("Internal Server Error", outcome.getResponse().getBody());
            assertEquals(1, logs.count(Level.ERROR));
            assertEquals(1, logs.count(Level.ERROR, "dispatch_handler_exception"));
            assertNotNull(logs.events(Level.ERROR).get(0).getThrown());
        }
    }

    @Test
    void testDispatch_CheckedExceptionIsInternalError() {
        // Arrange
        routes.get("/x", Map.of(), HandlerRef.direct("io", (envelope, client) -> {
            throw new IOException("disk");
        }));

        // Act & Assert
        assertEquals(500, dispatcher.dispatch(get("/x")).getResponse().getStatusCode());
    }

    @Test
    void testDispatch_MissingNamedHandlerIsNotFound() {
        // Arrange
        routes.get("/api/v0/clusters/", Map.of(), HandlerRef.named("clusters.listClusters"));

        // Act
        DispatchOutcome outcome = dispatcher.dispatch(get("/api/v0/clusters/"));

        // Assert
        assertEquals(DispatchOutcome.Kind.HANDLER_NOT_FOUND, outcome.getKind());
        assertEquals(404, outcome.getResponse().getStatusCode());
        assertEquals("Not Found", outcome.getResponse().getBody());
    }

    @Test
    void testDispatch_NamedHandlerResolvedAfterReload() {
        // Arrange
        routes.get("/api/v0/clusters/", Map.of(), HandlerRef.named("clusters.listClusters"));
        registered.put("listClusters", (envelope, client) -> CallResult.success(envelope.getId(), List.of("dev")));

        // Act
        dispatcher.reloadHandlers();
        DispatchOutcome outcome = dispatcher.dispatch(get("/api/v0/clusters/"));

        // Assert
        assertEquals(DispatchOutcome.Kind.SUCCESS, outcome.getKind());
        assertEquals("[\"dev\"]", outcome.getResponse().getBody());
    }

    @Test
    void testDispatch_NullResultIsNotFound() {
        // Arrange
        routes.get("/x", Map.of(), HandlerRef.direct("null", (envelope, client) -> null));

        // Act
        DispatchOutcome outcome = dispatcher.dispatch(get("/x"));

        // Assert
        assertEquals(DispatchOutcome.Kind.MALFORMED_RESULT, outcome.getKind());
        assertEquals(404, outcome.getResponse().getStatusCode());
        assertEquals("Not Found", outcome.getResponse().getBody());
    }

    @Test
    void testDispatch_ResultWithNeitherMemberIsNotFound() {
        // Arrange
        routes.get("/x", Map.of(), HandlerRef.direct("empty", (envelope, client) -> CallResult.empty(envelope.getId())));

        // Act
        DispatchOutcome outcome = dispatcher.dispatch(get("/x"));

        // Assert
        assertEquals(DispatchOutcome.Kind.MALFORMED_RESULT, outcome.getKind());
        assertEquals(404, outcome.getResponse().getStatusCode());
        assertEquals("Not Found", outcome.getResponse().getBody());
    }

    @Test
    void testDispatch_NullResultValueIsOk() {
        // Arrange
        routes.get("/x", Map.of(), HandlerRef.direct("nothing", (envelope, client) -> CallResult.success(envelope.getId(), null)));

        // Act
        DispatchOutcome outcome = dispatcher.dispatch(get("/x"));

        // Assert
        assertEquals(DispatchOutcome.Kind.SUCCESS, outcome.getKind());
        assertEquals(200, outcome.getResponse().getStatusCode());
        assertEquals("application/json", outcome.getResponse().getContentType());
        assertEquals("null", outcome.getResponse().getBody());
    }

    @Test
    void testDispatch_NullResultValueOnPutIsCreated() {
        // Arrange
        routes.put("/x", Map.of(), HandlerRef.direct("nothing", (envelope, client) -> CallResult.success(envelope.getId(), null)));

        // Act
        DispatchOutcome outcome = dispatcher.dispatch(put("/x", ""));

        // Assert
        assertEquals(201, outcome.getResponse().getStatusCode());
        assertEquals("null", outcome.getResponse().getBody());
    }

    @Test
    void testDispatch_EnvelopeCarriesIdVerbAndParams() {
        // Arrange
        AtomicReference<CallEnvelope> seen = new AtomicReference<>();
        AtomicReference<RemoteCallClient> seenClient = new AtomicReference<>();
        routes.put("/api/v0/cluster/{name}/", Map.of("name", NAME), HandlerRef.direct("capture", (envelope, c) -> {
            seen.set(envelope);
            seenClient.set(c);
            return CallResult.success(envelope.getId(), Map.of());
        }));

        // Act
        DispatchOutcome outcome = dispatcher.dispatch(put("/api/v0/cluster/dev/", "{\"network\":\"n1\"}"));

        // Assert
        CallEnvelope envelope = seen.get();
        assertEquals("req-1", envelope.getId());
        assertEquals("req-1", outcome.getEnvelopeId());
        assertEquals("2.0", envelope.getJsonrpc());
        assertEquals("PUT", envelope.getOperation());
        assertEquals(Map.of("name", "dev", "network", "n1"), envelope.getParams());
        assertSame(client, seenClient.get());
    }

    @Test
    void testDispatch_EachRequestGetsFreshDefaultId() {
        // Arrange
        Dispatcher fresh = new Dispatcher(routes, new HandlerRegistry(List.of()), new ParameterExtractor());
        fresh.attachRemoteCallClient(client);
        Set<String> seen = new HashSet<>();
        routes.get("/x", Map.of(), HandlerRef.direct("ids", (envelope, c) -> {
            seen.add(envelope.getId());
            return CallResult.success(envelope.getId(), envelope.getId());
        }));

        // Act
        for (int i = 0; i < 5; i++) {
            DispatchOutcome outcome = fresh.dispatch(get("/x"));
            assertEquals("\"" + outcome.getEnvelopeId() + "\"", outcome.getResponse().getBody());
        }

        // Assert
        assertEquals(5, seen.size());
    }

    @Test
    void testDispatch_GetNeverReadsBody() {
        // Arrange
        routes.get("/api/v0/clusters/", Map.of(), returning(List.of()));
        HttpRequest request = new HttpRequest("GET", "/api/v0/clusters/", "x=1",
                Map.of("Content-Length", "12"), untouchedBody);

        // Act
        DispatchOutcome outcome = dispatcher.dispatch(request);

        // Assert
        assertEquals(200, outcome.getResponse().getStatusCode());
        verifyNoInteractions(untouchedBody);
    }

    @Test
    void testDispatch_UnreadableBodyIsBadRequest() {
        // Arrange
        routes.put("/api/v0/cluster/{name}/", Map.of("name", NAME), returning(Map.of()));
        HttpRequest request = new HttpRequest("PUT", "/api/v0/cluster/dev/", null,
                Map.of("Content-Length", "64"), new ByteArrayInputStream("{}".getBytes(StandardCharsets.UTF_8)));

        // Act
        DispatchOutcome outcome = dispatcher.dispatch(request);

        // Assert
        assertEquals(DispatchOutcome.Kind.BAD_REQUEST, outcome.getKind());
        assertEquals(400, outcome.getResponse().getStatusCode());
        assertEquals("text/html", outcome.getResponse().getContentType());
        assertEquals("Bad Request", outcome.getResponse().getBody());
    }

    @Test
    void testDispatch_MalformedJsonBodyStillDispatches() {
        // Arrange
        AtomicReference<CallEnvelope> seen = new AtomicReference<>();
        routes.put("/api/v0/cluster/{name}/", Map.of("name", NAME), HandlerRef.direct("capture", (envelope, c) -> {
            seen.set(envelope);
            return CallResult.success(envelope.getId(), Map.of());
        }));

        // Act
        DispatchOutcome outcome = dispatcher.dispatch(put("/api/v0/cluster/dev/", "{broken"));

        // Assert
        assertEquals(201, outcome.getResponse().getStatusCode());
        assertEquals(Map.of("name", "dev"), seen.get().getParams());
    }

    @Test
    void testDispatch_LoggingContextClearedAfterDispatch() {
        // Arrange
        LoggingService.initRequest("lambda-request");
        AtomicReference<String> during = new AtomicReference<>();
        routes.get("/x", Map.of(), HandlerRef.direct("mdc", (envelope, c) -> {
            during.set(ThreadContext.get(LoggingService.KEY_CORRELATION_ID));
            return CallResult.success(envelope.getId(), "ok");
        }));

        // Act
        dispatcher.dispatch(get("/x"));

        // Assert
        assertEquals("req-1", during.get());
        assertNull(ThreadContext.get(LoggingService.KEY_CORRELATION_ID));
        assertNull(ThreadContext.get(LoggingService.KEY_FUNCTION));
        assertEquals("lambda-request", ThreadContext.get(LoggingService.KEY_REQUEST_ID));
        LoggingService.clearContext();
    }

    @Test
    void testDispatch_WithoutClientIsProgrammingError() {
        // Arrange
        Dispatcher unattached = new Dispatcher(routes, new HandlerRegistry(List.of()), new ParameterExtractor());

        // Act & Assert
        assertThrows(IllegalStateException.class, () -> unattached.dispatch(get("/x")));
    }

    @Test
    void testAttachRemoteCallClient_OnlyOnce() {
        assertThrows(IllegalStateException.class, () -> dispatcher.attachRemoteCallClient(client));
        assertThrows(IllegalArgumentException.class,
                () -> new Dispatcher(routes, new HandlerRegistry(List.of()), new ParameterExtractor())
                        .attachRemoteCallClient(null));
    }
}
