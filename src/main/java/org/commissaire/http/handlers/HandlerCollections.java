package org.commissaire.http.handlers;

import org.commissaire.http.rest.HandlerCollection;
import org.commissaire.http.services.LoggingService;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Known handler collections by name.
 */
public final class HandlerCollections {

    private static final Map<String, Supplier<HandlerCollection>> KNOWN = new LinkedHashMap<>();

    static {
        KNOWN.put(ClusterHandlers.NAME, ClusterHandlers::new);
        KNOWN.put(ClusterDeployHandlers.NAME, ClusterDeployHandlers::new);
        KNOWN.put(HostHandlers.NAME, HostHandlers::new);
        KNOWN.put(NetworkHandlers.NAME, NetworkHandlers::new);
    }

    private HandlerCollections() {}

    public static List<String> knownNames() {
        return List.copyOf(KNOWN.keySet());
    }

    /**
     * Collections for the configured names, in order. Unknown names, and
     * collections that fail to construct, are logged and skipped.
     */
    public static List<HandlerCollection> forNames(List<String> names) {
        return forNames(names, KNOWN);
    }

    static List<HandlerCollection> forNames(List<String> names, Map<String, Supplier<HandlerCollection>> known) {
        List<HandlerCollection> collections = new ArrayList<>();
        for (String name : names) {
            Supplier<HandlerCollection> factory = known.get(name);
            if (factory == null) {
                LoggingService.error("handler_collection_unknown", LoggingService.data(
                        "collection", name, "known", known.keySet()));
                continue;
            }
            try {
                collections.add(factory.get());
            } catch (RuntimeException | LinkageError e) {
                LoggingService.error("handler_collection_load_failed", e, LoggingService.data("collection", name));
            }
        }
        return collections;
    }
}
