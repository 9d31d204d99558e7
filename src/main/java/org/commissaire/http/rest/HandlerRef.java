package org.commissaire.http.rest;

import java.util.Objects;
import java.util.Optional;

/**
 * What a route points at: either a handler instance or the fully-qualified name
 * of an entry in the {@link HandlerRegistry}.
 */
public final class HandlerRef {

    private final RpcHandler handler;
    private final String name;

    private HandlerRef(RpcHandler handler, String name) {
        this.handler = handler;
        this.name = name;
    }

    public static HandlerRef direct(String name, RpcHandler handler) {
        Objects.requireNonNull(handler, "handler");
        return new HandlerRef(handler, name);
    }

    public static HandlerRef named(String name) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Handler name is required");
        }
        return new HandlerRef(null, name);
    }

    public boolean isDirect() {
        return handler != null;
    }

    public Optional<RpcHandler> getHandler() {
        return Optional.ofNullable(handler);
    }

    public String getName() {
        return name;
    }

    @Override
    public String toString() {
        if (name != null) {
            return name;
        }
        return "direct:" + handler.getClass().getName();
    }
}
