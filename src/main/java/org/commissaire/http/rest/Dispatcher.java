package org.commissaire.http.rest;

import org.commissaire.http.pojos.CallEnvelope;
import org.commissaire.http.pojos.CallResult;
import org.commissaire.http.services.LoggingService;
import org.commissaire.http.services.RemoteCallClient;

import java.io.IOException;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Runs one HTTP request end-to-end: route, extract params, build the envelope,
 * invoke the handler, translate its result.
 *
 * A dispatcher is built once at startup and shared by every request. It is safe
 * for concurrent use once a {@link RemoteCallClient} has been attached. Nothing
 * here retries; every failure is final for the request that hit it.
 */
public class Dispatcher {

    private final RouteTable routeTable;
    private final HandlerRegistry handlerRegistry;
    private final ParameterExtractor parameterExtractor;
    private final Supplier<String> idGenerator;
    private final AtomicReference<RemoteCallClient> remoteCallClient = new AtomicReference<>();

    public Dispatcher(RouteTable routeTable, HandlerRegistry handlerRegistry, ParameterExtractor parameterExtractor) {
        this(routeTable, handlerRegistry, parameterExtractor, () -> UUID.randomUUID().toString());
    }

    Dispatcher(RouteTable routeTable,
               HandlerRegistry handlerRegistry,
               ParameterExtractor parameterExtractor,
               Supplier<String> idGenerator) {
        this.routeTable = routeTable;
        this.handlerRegistry = handlerRegistry;
        this.parameterExtractor = parameterExtractor;
        this.idGenerator = idGenerator;
    }

    /**
     * Sets the client handed to every handler. May be called once.
     */
    public void attachRemoteCallClient(RemoteCallClient client) {
        if (client == null) {
            throw new IllegalArgumentException("Remote call client must not be null");
        }
        if (!remoteCallClient.compareAndSet(null, client)) {
            throw new IllegalStateException("A remote call client is already attached");
        }
        LoggingService.info("remote_call_client_attached");
    }

    public void reloadHandlers() {
        handlerRegistry.reload();
    }

    public HandlerRegistry getHandlerRegistry() {
        return handlerRegistry;
    }

    public RouteTable getRouteTable() {
        return routeTable;
    }

    /**
     * @throws IllegalStateException if no remote call client has been attached
     */
    public DispatchOutcome dispatch(HttpRequest request) {
        RemoteCallClient client = remoteCallClient.get();
        if (client == null) {
            throw new IllegalStateException(
                    "Remote call client can not be null when dispatching. Call attachRemoteCallClient() first.");
        }

        // Routing
        Optional<RouteMatch> found = routeTable.match(request.getPath(), request.getMethod());
        if (found.isEmpty()) {
            LoggingService.debug("dispatch_route_not_found", LoggingService.data(
                    "method", request.getMethod(), "path", request.getPath()));
            return new DispatchOutcome(DispatchOutcome.Kind.ROUTE_NOT_FOUND, ApiResponse.notFound(), null);
        }
        RouteMatch match = found.get();
        RouteDefinition route = match.getRoute();

        // Extracting
        Map<String, Object> params;
        try {
            params = parameterExtractor.extract(request, match);
        } catch (IOException e) {
            LoggingService.debug("dispatch_body_unreadable", LoggingService.data(
                    "route", route.toString(), "error", String.valueOf(e.getMessage())));
            return new DispatchOutcome(DispatchOutcome.Kind.BAD_REQUEST, ApiResponse.badRequest(), null);
        }

        // The envelope's method is the HTTP verb, not a domain operation name.
        CallEnvelope envelope = new CallEnvelope(idGenerator.get(), request.getMethod(), params);
        LoggingService.setCorrelationId(envelope.getId());
        LoggingService.setFunction(route.getHandlerRef().toString());
        LoggingService.debug("dispatch_envelope_built", LoggingService.data("envelope", envelope.toString()));

        try {
            return invoke(route, envelope, client);
        } finally {
            LoggingService.clearDispatchContext();
        }
    }

    private DispatchOutcome invoke(RouteDefinition route, CallEnvelope envelope, RemoteCallClient client) {
        String id = envelope.getId();
        try {
            Optional<RpcHandler> handler = resolve(route.getHandlerRef());
            if (handler.isEmpty()) {
                LoggingService.warn("dispatch_handler_not_found", LoggingService.data(
                        "route", route.toString(), "handler", route.getHandlerRef().toString()));
                return new DispatchOutcome(DispatchOutcome.Kind.HANDLER_NOT_FOUND, ApiResponse.notFound(), id);
            }

            CallResult result = handler.get().handle(envelope, client);
            LoggingService.debug("dispatch_handler_returned", LoggingService.data(
                    "handler", route.getHandlerRef().toString(), "result", String.valueOf(result)));

            if (result == null || result.isMalformed()) {
                LoggingService.warn("dispatch_malformed_result", LoggingService.data(
                        "route", route.toString(), "envelope", envelope.toString()));
                return new DispatchOutcome(DispatchOutcome.Kind.MALFORMED_RESULT, ApiResponse.notFound(), id);
            }
            if (!id.equals(result.getId())) {
                LoggingService.warn("dispatch_result_id_mismatch", LoggingService.data(
                        "route", route.toString(), "sent", id, "received", String.valueOf(result.getId())));
            }

            if (result.isError()) {
                ApiResponse response = ResponseConverter.fromError(result.getError());
                LoggingService.warn("dispatch_domain_error", LoggingService.data(
                        "route", route.toString(),
                        "envelope", envelope.toString(),
                        "code", result.getError().getCode(),
                        "status", response.getStatusCode()));
                return new DispatchOutcome(DispatchOutcome.Kind.DOMAIN_ERROR, response, id);
            }

            ApiResponse response = ResponseConverter.fromResult(result.getResult(), envelope.getOperation(), route.getAction());
            return new DispatchOutcome(DispatchOutcome.Kind.SUCCESS, response, id);
        } catch (Exception e) {
            LoggingService.error("dispatch_handler_exception", e, LoggingService.data(
                    "route", route.toString(), "envelope", envelope.toString()));
            return new DispatchOutcome(DispatchOutcome.Kind.UNHANDLED_EXCEPTION, ApiResponse.internalServerError(), id);
        }
    }

    private Optional<RpcHandler> resolve(HandlerRef ref) {
        if (ref.isDirect()) {
            return ref.getHandler();
        }
        return handlerRegistry.resolve(ref.getName());
    }
}
