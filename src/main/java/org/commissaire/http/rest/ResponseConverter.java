package org.commissaire.http.rest;

import com.google.gson.Gson;
import org.commissaire.http.pojos.CallError;
import org.commissaire.http.pojos.RpcErrorCode;
import org.commissaire.http.services.GsonFactory;

/**
 * Turns a handler's result or error into an {@link ApiResponse}.
 *
 * Errors are translated through {@link RpcErrorCode}; a code with no HTTP status
 * raises {@link UnmappedErrorCodeException} rather than leaking through as some
 * arbitrary status.
 */
public class ResponseConverter {

    /** Route action for endpoints that add a member to an existing collection. */
    public static final String ACTION_ADD = "add";

    private static final Gson gson = GsonFactory.create();

    /**
     * 200 with the serialized value, or 201 for a PUT whose route does not carry
     * the "add" action: a PUT to such a route creates the resource it names.
     */
    public static ApiResponse fromResult(Object result, String httpMethod, String action) {
        String body = gson.toJson(result);
        if ("PUT".equals(httpMethod) && !ACTION_ADD.equals(action)) {
            return ApiResponse.created(body);
        }
        return ApiResponse.ok(body);
    }

    public static ApiResponse fromError(CallError error) {
        int status = RpcErrorCode.fromCode(error.getCode())
                .flatMap(RpcErrorCode::getHttpStatus)
                .orElseThrow(() -> new UnmappedErrorCodeException(error));
        return ApiResponse.json(status, gson.toJson(error));
    }
}
