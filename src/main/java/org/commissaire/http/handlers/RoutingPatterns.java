package org.commissaire.http.handlers;

/**
 * Segment constraints used by the API routes.
 */
public final class RoutingPatterns {

    /** Cluster and network names. */
    public static final String NAME = "[a-zA-Z0-9\\-_]+";

    /** Host addresses: host names, IPv4 and IPv6. */
    public static final String ADDRESS = "[a-zA-Z0-9\\-_.:]+";

    private RoutingPatterns() {}
}
