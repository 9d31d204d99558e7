package org.commissaire.http.pojos;

import java.util.Optional;

/**
 * Error codes handlers put in a {@link CallError}, with the HTTP status each one
 * maps to. Codes without a status are not translated; the dispatcher treats them
 * as internal failures.
 */
public enum RpcErrorCode {

    PARSE_ERROR(-32700, null),
    INVALID_REQUEST(-32600, 400),
    METHOD_NOT_FOUND(-32601, null),
    INVALID_PARAMETERS(-32602, 400),
    INTERNAL_ERROR(-32603, null),
    NOT_FOUND(404, 404),
    CONFLICT(409, 409);

    /** Generic "bad request" code used by handlers rejecting their input. */
    public static final RpcErrorCode BAD_REQUEST = INVALID_REQUEST;

    private final int code;
    private final Integer httpStatus;

    RpcErrorCode(int code, Integer httpStatus) {
        this.code = code;
        this.httpStatus = httpStatus;
    }

    public int getCode() {
        return code;
    }

    public Optional<Integer> getHttpStatus() {
        return Optional.ofNullable(httpStatus);
    }

    public static Optional<RpcErrorCode> fromCode(int code) {
        for (RpcErrorCode value : values()) {
            if (value.code == code) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }
}
