package org.commissaire.http.rest;

import org.commissaire.http.services.LoggingService;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Fully-qualified handler name to handler, built from a fixed list of collections.
 *
 * {@link #reload()} builds a complete new map and publishes it with a single
 * reference swap, so {@link #resolve} always sees either the old or the new map.
 */
public class HandlerRegistry {

    private final List<HandlerCollection> collections;
    private final AtomicReference<Map<String, RpcHandler>> handlers =
            new AtomicReference<>(Collections.emptyMap());

    public HandlerRegistry(List<HandlerCollection> collections) {
        this.collections = List.copyOf(collections);
        reload();
    }

    /**
     * Builds the handler map for {@code collections}. A collection that fails to
     * describe itself, including one whose classes cannot be linked, is logged
     * and left out; loading never fails as a whole.
     */
    public static Map<String, RpcHandler> load(List<HandlerCollection> collections) {
        Map<String, RpcHandler> loaded = new LinkedHashMap<>();
        for (HandlerCollection collection : collections) {
            HandlerTable table = new HandlerTable(collection.name());
            try {
                collection.describe(table);
            } catch (RuntimeException | LinkageError e) {
                LoggingService.error("handler_collection_load_failed", e,
                        LoggingService.data("collection", collection.name()));
                continue;
            }
            for (Map.Entry<String, RpcHandler> member : table.members().entrySet()) {
                loaded.put(member.getKey(), member.getValue());
                LoggingService.info("handler_loaded", LoggingService.data("handler", member.getKey()));
            }
        }
        return Collections.unmodifiableMap(loaded);
    }

    public void reload() {
        Map<String, RpcHandler> loaded = load(collections);
        handlers.set(loaded);
        LoggingService.info("handler_registry_reloaded", LoggingService.data("handlers", loaded.size()));
    }

    public Optional<RpcHandler> resolve(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(handlers.get().get(name));
    }

    public Set<String> names() {
        return handlers.get().keySet();
    }
}
