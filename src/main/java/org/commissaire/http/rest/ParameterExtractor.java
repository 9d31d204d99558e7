package org.commissaire.http.rest;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.reflect.TypeToken;
import org.commissaire.http.services.GsonFactory;
import org.commissaire.http.services.LoggingService;

import java.io.IOException;
import java.io.InputStream;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Builds the params of a call envelope from the matched path segments plus
 * either the JSON body (PUT, POST) or the query string (everything else).
 * Later sources override earlier ones on key collisions.
 */
public class ParameterExtractor {

    private static final Set<String> BODY_METHODS = Set.of("PUT", "POST");
    private static final Type MAP_TYPE = new TypeToken<Map<String, Object>>() {}.getType();

    private final Gson gson = GsonFactory.create();

    /**
     * @throws IOException when the body stream cannot be read in full. A body that
     *                     is read but is not a JSON object is ignored instead.
     */
    public Map<String, Object> extract(HttpRequest request, RouteMatch match) throws IOException {
        Map<String, Object> params = new LinkedHashMap<>(match.getSegments());

        if (BODY_METHODS.contains(request.getMethod())) {
            int contentLength = request.getContentLength();
            if (contentLength > 0) {
                String body = readBody(request.getBody(), contentLength);
                params.putAll(parseBody(body));
            }
        } else {
            params.putAll(parseQueryString(request.getQueryString()));
        }
        return params;
    }

    private static String readBody(InputStream in, int contentLength) throws IOException {
        if (in == null) {
            throw new IOException("Request declares " + contentLength + " body bytes but has no body");
        }
        byte[] bytes = in.readNBytes(contentLength);
        if (bytes.length < contentLength) {
            throw new IOException("Request body ended after " + bytes.length + " of " + contentLength + " bytes");
        }
        return new String(bytes, StandardCharsets.UTF_8);
    }

    private Map<String, Object> parseBody(String body) {
        try {
            JsonElement json = JsonParser.parseString(body);
            if (json.isJsonObject()) {
                return gson.fromJson(json, MAP_TYPE);
            }
            LoggingService.debug("request_body_not_an_object", LoggingService.data("body", body));
        } catch (JsonParseException e) {
            LoggingService.debug("request_body_unparsable", LoggingService.data("error", String.valueOf(e.getMessage())));
        }
        return Map.of();
    }

    static Map<String, String> parseQueryString(String queryString) {
        Map<String, String> params = new LinkedHashMap<>();
        if (queryString == null || queryString.isEmpty()) return params;
        for (String pair : queryString.split("&")) {
            if (pair.isEmpty()) continue;
            String[] kv = pair.split("=", 2);
            String key = UrlCodec.decode(kv[0]);
            if (key.isEmpty()) continue;
            params.put(key, kv.length == 2 ? UrlCodec.decode(kv[1]) : "");
        }
        return params;
    }
}
