package org.commissaire.http.rest;

import org.commissaire.http.services.LoggingService;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Members declared by one {@link HandlerCollection} during a registry load.
 * Members without a handler are skipped.
 */
public final class HandlerTable {

    private final String collection;
    private final Map<String, RpcHandler> members = new LinkedHashMap<>();

    HandlerTable(String collection) {
        this.collection = collection;
    }

    public HandlerTable function(String name, RpcHandler handler) {
        add(collection + "." + name, handler);
        return this;
    }

    /**
     * Registers the methods of one handler type instance.
     */
    public HandlerTable type(String typeName, Map<String, RpcHandler> methods) {
        if (methods == null) {
            LoggingService.debug("handler_member_skipped", LoggingService.data("member", collection + "." + typeName));
            return this;
        }
        for (Map.Entry<String, RpcHandler> method : methods.entrySet()) {
            add(collection + "." + typeName + "." + method.getKey(), method.getValue());
        }
        return this;
    }

    private void add(String key, RpcHandler handler) {
        if (handler == null) {
            LoggingService.debug("handler_member_skipped", LoggingService.data("member", key));
            return;
        }
        members.put(key, handler);
    }

    Map<String, RpcHandler> members() {
        return Collections.unmodifiableMap(members);
    }
}
