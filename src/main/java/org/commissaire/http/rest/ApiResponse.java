package org.commissaire.http.rest;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * HTTP response produced by the dispatcher.
 * Converts to the Lambda Function URL structured response format.
 */
public class ApiResponse {

    public static final String CONTENT_TYPE_JSON = "application/json";
    public static final String CONTENT_TYPE_HTML = "text/html";

    private final int statusCode;
    private final Map<String, String> headers;
    private final String body;

    ApiResponse(int statusCode, String contentType, String body) {
        this.statusCode = statusCode;
        this.body = body;
        Map<String, String> h = new HashMap<>();
        h.put("Content-Type", contentType);
        this.headers = Collections.unmodifiableMap(h);
    }

    /**
     * Convert to Lambda Function URL structured response format.
     * When a Lambda Function URL handler returns a Map with statusCode/headers/body,
     * Lambda uses those values instead of wrapping in 200.
     */
    public Map<String, Object> toLambdaResponse() {
        Map<String, Object> response = new HashMap<>();
        response.put("statusCode", statusCode);
        response.put("headers", headers);
        response.put("body", body);
        return response;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    public String getContentType() {
        return headers.get("Content-Type");
    }

    public String getBody() {
        return body;
    }

    @Override
    public String toString() {
        return "ApiResponse{" + statusCode + ", " + getContentType() + ", " + body + "}";
    }

    // --- Factory Methods ---

    public static ApiResponse ok(String jsonBody) {
        return json(200, jsonBody);
    }

    public static ApiResponse created(String jsonBody) {
        return json(201, jsonBody);
    }

    public static ApiResponse json(int statusCode, String jsonBody) {
        return new ApiResponse(statusCode, CONTENT_TYPE_JSON, jsonBody);
    }

    public static ApiResponse notFound() {
        return new ApiResponse(404, CONTENT_TYPE_HTML, "Not Found");
    }

    public static ApiResponse badRequest() {
        return new ApiResponse(400, CONTENT_TYPE_HTML, "Bad Request");
    }

    public static ApiResponse internalServerError() {
        return new ApiResponse(500, CONTENT_TYPE_HTML, "Internal Server Error");
    }
}
