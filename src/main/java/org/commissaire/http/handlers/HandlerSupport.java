package org.commissaire.http.handlers;

import org.commissaire.http.pojos.CallEnvelope;
import org.commissaire.http.pojos.CallError;
import org.commissaire.http.pojos.CallResult;
import org.commissaire.http.pojos.RpcErrorCode;

import java.util.Map;

/**
 * Result builders shared by the handler collections.
 */
final class HandlerSupport {

    private HandlerSupport() {}

    static CallResult createResponse(String id, Object result) {
        return CallResult.success(id, result);
    }

    /**
     * Error result whose data names the kind of failure. {@code error} is either
     * the exception that stopped the handler or a plain message.
     */
    static CallResult returnError(CallEnvelope envelope, Object error, RpcErrorCode code) {
        String message;
        String kind;
        if (error instanceof Throwable) {
            Throwable t = (Throwable) error;
            message = t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
            kind = t.getClass().getSimpleName();
        } else {
            message = String.valueOf(error);
            kind = "String";
        }
        return CallResult.failure(envelope.getId(),
                new CallError(code.getCode(), message, Map.of("exception", kind)));
    }
}
