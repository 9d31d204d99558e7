package org.commissaire.http.handlers;

import org.commissaire.http.services.RemoteCallClient;
import org.commissaire.http.services.RemoteCallException;

import java.util.List;
import java.util.Map;

/**
 * The storage methods handlers use, over a {@link RemoteCallClient}.
 * Params are positional: model name, key fields, then an optional secure flag
 * asking storage to include credentials.
 */
class StorageCalls {

    static final String LIST = "storage.list";
    static final String GET = "storage.get";
    static final String SAVE = "storage.save";
    static final String DELETE = "storage.delete";

    private final RemoteCallClient client;

    StorageCalls(RemoteCallClient client) {
        this.client = client;
    }

    List<Object> list(String model) throws RemoteCallException {
        return client.requestList(LIST, List.of(model));
    }

    List<Object> list(String model, boolean secure) throws RemoteCallException {
        return client.requestList(LIST, List.of(model, secure));
    }

    Map<String, Object> get(String model, Map<String, Object> keys) throws RemoteCallException {
        return client.requestObject(GET, List.of(model, keys));
    }

    Map<String, Object> get(String model, Map<String, Object> keys, boolean secure) throws RemoteCallException {
        return client.requestObject(GET, List.of(model, keys, secure));
    }

    Map<String, Object> save(String model, Map<String, Object> data) throws RemoteCallException {
        return client.requestObject(SAVE, List.of(model, data));
    }

    void delete(String model, Map<String, Object> keys) throws RemoteCallException {
        client.request(DELETE, List.of(model, keys));
    }
}
