package org.commissaire.http.rest;

import org.commissaire.http.pojos.CallError;

/**
 * A handler reported an error code that has no HTTP translation.
 */
public class UnmappedErrorCodeException extends RuntimeException {

    private final CallError error;

    public UnmappedErrorCodeException(CallError error) {
        super("No HTTP status for error code " + error.getCode() + ": " + error.getMessage());
        this.error = error;
    }

    public CallError getError() {
        return error;
    }
}
