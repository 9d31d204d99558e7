package org.commissaire.http.services;

/**
 * A remote call failed, either because the backend answered with an error
 * member or because the call never completed.
 */
public class RemoteCallException extends Exception {

    private final Integer code;

    public RemoteCallException(String message) {
        this(null, message, null);
    }

    public RemoteCallException(String message, Throwable cause) {
        this(null, message, cause);
    }

    public RemoteCallException(Integer code, String message) {
        this(code, message, null);
    }

    private RemoteCallException(Integer code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    /**
     * Error code reported by the backend, or null for transport failures.
     */
    public Integer getCode() {
        return code;
    }
}
