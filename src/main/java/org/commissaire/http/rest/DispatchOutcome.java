package org.commissaire.http.rest;

/**
 * What happened to one dispatched request, and the response it produced.
 */
public final class DispatchOutcome {

    public enum Kind {
        SUCCESS,
        ROUTE_NOT_FOUND,
        BAD_REQUEST,
        HANDLER_NOT_FOUND,
        DOMAIN_ERROR,
        UNHANDLED_EXCEPTION,
        MALFORMED_RESULT
    }

    private final Kind kind;
    private final ApiResponse response;
    private final String envelopeId;

    DispatchOutcome(Kind kind, ApiResponse response, String envelopeId) {
        this.kind = kind;
        this.response = response;
        this.envelopeId = envelopeId;
    }

    public Kind getKind() {
        return kind;
    }

    public ApiResponse getResponse() {
        return response;
    }

    /**
     * Id of the envelope sent to the handler; null when dispatch stopped before
     * an envelope was built.
     */
    public String getEnvelopeId() {
        return envelopeId;
    }

    @Override
    public String toString() {
        return "DispatchOutcome{" + kind + ", " + response + "}";
    }
}
