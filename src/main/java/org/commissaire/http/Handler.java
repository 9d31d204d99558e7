package org.commissaire.http;

import com.amazonaws.services.lambda.runtime.Context;
import com.amazonaws.services.lambda.runtime.RequestHandler;
import org.commissaire.http.handlers.HandlerCollections;
import org.commissaire.http.handlers.Routes;
import org.commissaire.http.pojos.RequestContextHttp;
import org.commissaire.http.pojos.RequestEvent;
import org.commissaire.http.rest.ApiResponse;
import org.commissaire.http.rest.DispatchOutcome;
import org.commissaire.http.rest.Dispatcher;
import org.commissaire.http.rest.HandlerRegistry;
import org.commissaire.http.rest.HttpRequest;
import org.commissaire.http.rest.ParameterExtractor;
import org.commissaire.http.rest.RouteTable;
import org.commissaire.http.services.DispatcherConfig;
import org.commissaire.http.services.LambdaRemoteCallClient;
import org.commissaire.http.services.LoggingService;
import org.commissaire.http.services.RemoteCallClient;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.HashMap;
import java.util.Map;

/**
 * Lambda Function URL entry point. Turns the event into an {@link HttpRequest},
 * dispatches it and returns the structured response Lambda expects.
 *
 * Scheduled events ({@code source = "aws.events"}) never reach the dispatcher:
 * they keep the function warm, or reload the handler registry when their
 * detail type is {@value #DETAIL_TYPE_RELOAD_HANDLERS}.
 */
public class Handler implements RequestHandler<RequestEvent, Object> {

    static final String DETAIL_TYPE_RELOAD_HANDLERS = "reload_handlers";

    private final Dispatcher dispatcher;

    public Handler() {
        this(DispatcherConfig.load());
    }

    Handler(DispatcherConfig config) {
        this.dispatcher = createDispatcher(config);
        this.dispatcher.attachRemoteCallClient(createRemoteCallClient(config));
    }

    /**
     * For callers that build and wire the dispatcher themselves.
     */
    public Handler(Dispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    protected RemoteCallClient createRemoteCallClient(DispatcherConfig config) {
        return LambdaRemoteCallClient.create(config);
    }

    static Dispatcher createDispatcher(DispatcherConfig config) {
        RouteTable routes = Routes.register(new RouteTable());
        HandlerRegistry registry = new HandlerRegistry(HandlerCollections.forNames(config.getHandlerCollections()));
        LoggingService.info("dispatcher_created", LoggingService.data(
                "routes", routes.getRoutes().size(),
                "handlers", registry.names().size(),
                "storageFunction", config.getStorageFunction()));
        return new Dispatcher(routes, registry, new ParameterExtractor());
    }

    @Override
    public Object handleRequest(RequestEvent event, Context context) {
        LoggingService.initRequest(context);
        try {
            if ("aws.events".equals(event.getSource())) {
                if (DETAIL_TYPE_RELOAD_HANDLERS.equals(event.getDetailType())) {
                    dispatcher.reloadHandlers();
                    return "Handlers reloaded";
                }
                LoggingService.debug("warmed_up");
                return "Warmed up!";
            }

            HttpRequest request;
            try {
                request = toHttpRequest(event);
            } catch (IllegalArgumentException e) {
                LoggingService.debug("request_body_undecodable", LoggingService.data("error", e.getMessage()));
                return ApiResponse.badRequest().toLambdaResponse();
            }
            DispatchOutcome outcome = dispatcher.dispatch(request);
            ApiResponse response = outcome.getResponse();
            LoggingService.info("request_completed", LoggingService.data(
                    "method", request.getMethod(),
                    "path", request.getPath(),
                    "outcome", outcome.getKind().name(),
                    "status", response.getStatusCode()));
            return response.toLambdaResponse();
        } finally {
            LoggingService.clearContext();
        }
    }

    static HttpRequest toHttpRequest(RequestEvent event) {
        String method = null;
        String path = event.getRawPath();
        if (event.getRequestContext() != null && event.getRequestContext().getHttp() != null) {
            RequestContextHttp http = event.getRequestContext().getHttp();
            method = http.getMethod();
            if (path == null) {
                path = http.getPath();
            }
        }

        byte[] body = new byte[0];
        if (event.getBody() != null) {
            body = event.isBase64Encoded()
                    ? Base64.getDecoder().decode(event.getBody())
                    : event.getBody().getBytes(StandardCharsets.UTF_8);
        }

        Map<String, String> headers = new HashMap<>();
        if (event.getHeaders() != null) {
            headers.putAll(event.getHeaders());
        }
        boolean hasLength = headers.keySet().stream().anyMatch("content-length"::equalsIgnoreCase);
        if (!hasLength) {
            headers.put("content-length", String.valueOf(body.length));
        }

        return new HttpRequest(method, path == null ? "" : path, event.getRawQueryString(), headers,
                new ByteArrayInputStream(body));
    }

    Dispatcher getDispatcher() {
        return dispatcher;
    }
}
