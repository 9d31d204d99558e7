package org.commissaire.http.services;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Runtime settings for the dispatcher and its remote-call client.
 *
 * Values come from {@code commissaire.json} in the working directory, then the
 * classpath copy, then built-in defaults. Environment variables
 * ({@code COMMISSAIRE_*}) override anything read from a file.
 */
public final class DispatcherConfig {

    public static final String CONFIG_FILE = "commissaire.json";

    public static final String KEY_STORAGE_FUNCTION = "storageFunction";
    public static final String KEY_AWS_REGION = "awsRegion";
    public static final String KEY_CALL_TIMEOUT_SECONDS = "callTimeoutSeconds";
    public static final String KEY_HANDLER_COLLECTIONS = "handlerCollections";

    public static final String DEFAULT_STORAGE_FUNCTION = "commissaire-storage";
    public static final String DEFAULT_AWS_REGION = "us-east-1";
    public static final int DEFAULT_CALL_TIMEOUT_SECONDS = 30;
    public static final List<String> DEFAULT_HANDLER_COLLECTIONS =
            List.of("clusters", "clusters.operations", "hosts", "networks");

    private static final Map<String, String> ENV_KEYS = Map.of(
            KEY_STORAGE_FUNCTION, "COMMISSAIRE_STORAGE_FUNCTION",
            KEY_AWS_REGION, "COMMISSAIRE_AWS_REGION",
            KEY_CALL_TIMEOUT_SECONDS, "COMMISSAIRE_CALL_TIMEOUT_SECONDS",
            KEY_HANDLER_COLLECTIONS, "COMMISSAIRE_HANDLER_COLLECTIONS");

    private final String storageFunction;
    private final String awsRegion;
    private final int callTimeoutSeconds;
    private final List<String> handlerCollections;

    private DispatcherConfig(Map<String, String> values) {
        this.storageFunction = values.getOrDefault(KEY_STORAGE_FUNCTION, DEFAULT_STORAGE_FUNCTION);
        this.awsRegion = values.getOrDefault(KEY_AWS_REGION, DEFAULT_AWS_REGION);
        this.callTimeoutSeconds = parseTimeout(values.get(KEY_CALL_TIMEOUT_SECONDS));
        this.handlerCollections = parseList(values.get(KEY_HANDLER_COLLECTIONS));
    }

    /**
     * Load from the default locations and the process environment.
     */
    public static DispatcherConfig load() {
        Map<String, String> values = readFile(new File(CONFIG_FILE));
        if (values.isEmpty()) {
            values = readClasspath("/" + CONFIG_FILE);
        }
        return fromValues(values, System::getenv);
    }

    /**
     * Build from already-read file values, applying overrides from {@code env}.
     */
    public static DispatcherConfig fromValues(Map<String, String> fileValues, Function<String, String> env) {
        Map<String, String> values = new HashMap<>(fileValues);
        for (Map.Entry<String, String> entry : ENV_KEYS.entrySet()) {
            String override = env.apply(entry.getValue());
            if (override != null && !override.isBlank()) {
                values.put(entry.getKey(), override.trim());
            }
        }
        return new DispatcherConfig(values);
    }

    public static DispatcherConfig defaults() {
        return new DispatcherConfig(Collections.emptyMap());
    }

    static Map<String, String> readFile(File file) {
        if (!file.isFile()) {
            return Collections.emptyMap();
        }
        try {
            return flatten(new ObjectMapper().readTree(file));
        } catch (IOException e) {
            LoggingService.error("dispatcher_config_load_failed", e, LoggingService.data("file", file.getPath()));
            return Collections.emptyMap();
        }
    }

    static Map<String, String> readClasspath(String resource) {
        try (InputStream in = DispatcherConfig.class.getResourceAsStream(resource)) {
            if (in == null) {
                return Collections.emptyMap();
            }
            return flatten(new ObjectMapper().readTree(in));
        } catch (IOException e) {
            LoggingService.error("dispatcher_config_load_failed", e, LoggingService.data("resource", resource));
            return Collections.emptyMap();
        }
    }

    private static Map<String, String> flatten(JsonNode rootNode) {
        Map<String, String> map = new HashMap<>();
        if (rootNode == null || !rootNode.isObject()) {
            return map;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = rootNode.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            JsonNode value = entry.getValue();
            if (value.isArray()) {
                List<String> items = new ArrayList<>();
                value.forEach(item -> items.add(item.asText("")));
                map.put(entry.getKey(), String.join(",", items));
            } else {
                map.put(entry.getKey(), value.asText(""));
            }
        }
        return map;
    }

    private static int parseTimeout(String value) {
        if (value == null || value.isBlank()) {
            return DEFAULT_CALL_TIMEOUT_SECONDS;
        }
        try {
            int seconds = Integer.parseInt(value.trim());
            if (seconds <= 0) {
                throw new IllegalArgumentException(KEY_CALL_TIMEOUT_SECONDS + " must be positive, got " + seconds);
            }
            return seconds;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(KEY_CALL_TIMEOUT_SECONDS + " must be an integer, got \"" + value + "\"", e);
        }
    }

    private static List<String> parseList(String value) {
        if (value == null || value.isBlank()) {
            return DEFAULT_HANDLER_COLLECTIONS;
        }
        List<String> items = new ArrayList<>();
        for (String item : Arrays.asList(value.split(","))) {
            if (!item.isBlank()) {
                items.add(item.trim());
            }
        }
        return Collections.unmodifiableList(items);
    }

    public String getStorageFunction() {
        return storageFunction;
    }

    public String getAwsRegion() {
        return awsRegion;
    }

    public int getCallTimeoutSeconds() {
        return callTimeoutSeconds;
    }

    public List<String> getHandlerCollections() {
        return handlerCollections;
    }
}
