package org.commissaire.http.rest;

import java.io.InputStream;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * The parts of an inbound HTTP request the dispatcher works with.
 * Header names are matched case-insensitively.
 */
public final class HttpRequest {

    private final String method;
    private final String path;
    private final String queryString;
    private final Map<String, String> headers;
    private final InputStream body;

    public HttpRequest(String method, String path, String queryString, Map<String, String> headers, InputStream body) {
        this.method = method == null ? "" : method.toUpperCase(Locale.ROOT);
        this.path = path;
        this.queryString = queryString;
        Map<String, String> normalized = new LinkedHashMap<>();
        if (headers != null) {
            headers.forEach((name, value) -> {
                if (name != null) {
                    normalized.put(name.toLowerCase(Locale.ROOT), value);
                }
            });
        }
        this.headers = Collections.unmodifiableMap(normalized);
        this.body = body;
    }

    public String getMethod() {
        return method;
    }

    public String getPath() {
        return path;
    }

    public String getQueryString() {
        return queryString;
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    public String getHeader(String name) {
        return name == null ? null : headers.get(name.toLowerCase(Locale.ROOT));
    }

    public InputStream getBody() {
        return body;
    }

    /**
     * Declared body length; 0 when the header is missing, negative or unparsable.
     */
    public int getContentLength() {
        String value = getHeader("Content-Length");
        if (value == null || value.isBlank()) {
            return 0;
        }
        try {
            return Math.max(0, Integer.parseInt(value.trim()));
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}
