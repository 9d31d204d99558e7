package org.commissaire.http.rest;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A route bound to the segment values of one request path.
 */
public final class RouteMatch {

    private final RouteDefinition route;
    private final Map<String, String> segments;

    RouteMatch(RouteDefinition route, Map<String, String> segments) {
        this.route = route;
        this.segments = Collections.unmodifiableMap(new LinkedHashMap<>(segments));
    }

    public RouteDefinition getRoute() {
        return route;
    }

    public Map<String, String> getSegments() {
        return segments;
    }
}
