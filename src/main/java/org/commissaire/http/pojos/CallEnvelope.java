package org.commissaire.http.pojos;

import com.google.gson.annotations.SerializedName;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON-RPC style request handed to every handler.
 *
 * The operation carried here is the HTTP verb of the inbound request, not a
 * domain action name. It is serialized under the JSON-RPC {@code method} key.
 */
public final class CallEnvelope {

    public static final String JSONRPC_VERSION = "2.0";

    private final String jsonrpc = JSONRPC_VERSION;
    private final String id;
    @SerializedName("method")
    private final String operation;
    private final Map<String, Object> params;

    public CallEnvelope(String id, String operation, Map<String, Object> params) {
        if (id == null || id.isEmpty()) {
            throw new IllegalArgumentException("Envelope id is required");
        }
        this.id = id;
        this.operation = operation;
        this.params = params == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }

    public String getJsonrpc() {
        return jsonrpc;
    }

    public String getId() {
        return id;
    }

    public String getOperation() {
        return operation;
    }

    public Map<String, Object> getParams() {
        return params;
    }

    /**
     * Returns the named parameter as a string, or null when it is absent.
     */
    public String getStringParam(String key) {
        Object value = params.get(key);
        return value == null ? null : String.valueOf(value);
    }

    @Override
    public String toString() {
        return "CallEnvelope{id=" + id + ", method=" + operation + ", params=" + params + "}";
    }
}
