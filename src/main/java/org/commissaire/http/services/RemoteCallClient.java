package org.commissaire.http.services;

import java.util.List;
import java.util.Map;

/**
 * Synchronous JSON-RPC access to the storage backend.
 *
 * Handlers call this with a backend method name ({@code storage.get}) and
 * positional params, and get back the decoded {@code result} member. Errors
 * reported by the backend and transport failures both surface as
 * {@link RemoteCallException}. Implementations must be safe for concurrent use.
 */
public interface RemoteCallClient {

    Object request(String method, List<Object> params) throws RemoteCallException;

    /**
     * Same as {@link #request} for calls whose result is a JSON object.
     */
    @SuppressWarnings("unchecked")
    default Map<String, Object> requestObject(String method, List<Object> params) throws RemoteCallException {
        Object result = request(method, params);
        if (!(result instanceof Map)) {
            throw new RemoteCallException("Expected an object result from " + method + " but got " + describe(result));
        }
        return (Map<String, Object>) result;
    }

    /**
     * Same as {@link #request} for calls whose result is a JSON array.
     */
    @SuppressWarnings("unchecked")
    default List<Object> requestList(String method, List<Object> params) throws RemoteCallException {
        Object result = request(method, params);
        if (!(result instanceof List)) {
            throw new RemoteCallException("Expected a list result from " + method + " but got " + describe(result));
        }
        return (List<Object>) result;
    }

    private static String describe(Object result) {
        return result == null ? "null" : result.getClass().getSimpleName();
    }
}
