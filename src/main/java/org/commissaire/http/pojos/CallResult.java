package org.commissaire.http.pojos;

/**
 * JSON-RPC style response produced by a handler: either a result or an error,
 * always carrying the id of the envelope it answers.
 *
 * A result that carries neither member is malformed; the dispatcher answers it
 * with a generic 404. A success whose value is null still carries a result and
 * is answered with a JSON {@code null} body.
 */
public final class CallResult {

    private final String jsonrpc = CallEnvelope.JSONRPC_VERSION;
    private final String id;
    private final Object result;
    private final CallError error;
    private final transient boolean hasResult;

    private CallResult(String id, Object result, CallError error, boolean hasResult) {
        this.id = id;
        this.result = result;
        this.error = error;
        this.hasResult = hasResult;
    }

    public static CallResult success(String id, Object result) {
        return new CallResult(id, result, null, true);
    }

    /**
     * A response with neither a result nor an error member.
     */
    public static CallResult empty(String id) {
        return new CallResult(id, null, null, false);
    }

    public static CallResult failure(String id, CallError error) {
        if (error == null) {
            throw new IllegalArgumentException("A failed result needs an error");
        }
        return new CallResult(id, null, error, false);
    }

    public static CallResult failure(String id, RpcErrorCode code, String message) {
        return failure(id, new CallError(code.getCode(), message));
    }

    public String getJsonrpc() {
        return jsonrpc;
    }

    public String getId() {
        return id;
    }

    public Object getResult() {
        return result;
    }

    public CallError getError() {
        return error;
    }

    public boolean isError() {
        return error != null;
    }

    public boolean isSuccess() {
        return error == null && hasResult;
    }

    public boolean isMalformed() {
        return error == null && !hasResult;
    }

    @Override
    public String toString() {
        if (isError()) {
            return "CallResult{id=" + id + ", error=" + error + "}";
        }
        return hasResult
                ? "CallResult{id=" + id + ", result=" + result + "}"
                : "CallResult{id=" + id + "}";
    }
}
