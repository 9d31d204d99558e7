package org.commissaire.http.pojos;

import java.util.Objects;

/**
 * Error member of a {@link CallResult}.
 */
public final class CallError {

    private final int code;
    private final String message;
    private final Object data;

    public CallError(int code, String message) {
        this(code, message, null);
    }

    public CallError(int code, String message, Object data) {
        this.code = code;
        this.message = message;
        this.data = data;
    }

    public int getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    public Object getData() {
        return data;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CallError)) return false;
        CallError that = (CallError) o;
        return code == that.code && Objects.equals(message, that.message) && Objects.equals(data, that.data);
    }

    @Override
    public int hashCode() {
        return Objects.hash(code, message, data);
    }

    @Override
    public String toString() {
        return "CallError{code=" + code + ", message=" + message + ", data=" + data + "}";
    }
}
