package org.commissaire.http.rest;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Ordered set of routes. The first registered route that matches a request
 * wins; duplicates are allowed and simply never reached.
 *
 * Routes are registered at startup and only read afterwards.
 */
public class RouteTable {

    private final List<RouteDefinition> routes = new CopyOnWriteArrayList<>();

    public RouteDefinition register(String pattern,
                                    Set<String> methods,
                                    Map<String, String> segmentConstraints,
                                    HandlerRef handlerRef,
                                    String action) {
        RouteDefinition route = new RouteDefinition(pattern, methods, segmentConstraints, handlerRef, action);
        routes.add(route);
        return route;
    }

    public RouteDefinition register(String pattern,
                                    Set<String> methods,
                                    Map<String, String> segmentConstraints,
                                    HandlerRef handlerRef) {
        return register(pattern, methods, segmentConstraints, handlerRef, null);
    }

    /**
     * Finds the first route whose pattern and method constraint accept the request.
     * Paths are compared as given: no trailing-slash or case normalization.
     */
    public Optional<RouteMatch> match(String path, String method) {
        for (RouteDefinition route : routes) {
            if (!route.acceptsMethod(method)) continue;

            Optional<Map<String, String>> segments = route.bind(path);
            if (segments.isPresent()) {
                return Optional.of(new RouteMatch(route, segments.get()));
            }
        }
        return Optional.empty();
    }

    public List<RouteDefinition> getRoutes() {
        return Collections.unmodifiableList(routes);
    }

    // ============= Route Helpers =============

    public RouteDefinition get(String pattern, Map<String, String> segmentConstraints, HandlerRef handlerRef) {
        return register(pattern, Set.of("GET"), segmentConstraints, handlerRef);
    }

    public RouteDefinition put(String pattern, Map<String, String> segmentConstraints, HandlerRef handlerRef) {
        return register(pattern, Set.of("PUT"), segmentConstraints, handlerRef);
    }

    public RouteDefinition post(String pattern, Map<String, String> segmentConstraints, HandlerRef handlerRef) {
        return register(pattern, Set.of("POST"), segmentConstraints, handlerRef);
    }

    public RouteDefinition delete(String pattern, Map<String, String> segmentConstraints, HandlerRef handlerRef) {
        return register(pattern, Set.of("DELETE"), segmentConstraints, handlerRef);
    }
}
