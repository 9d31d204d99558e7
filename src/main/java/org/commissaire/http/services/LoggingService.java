package org.commissaire.http.services;

import com.amazonaws.services.lambda.runtime.Context;
import com.google.gson.Gson;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.util.HashMap;
import java.util.Map;

/**
 * Structured logging for CloudWatch Logs Insights.
 *
 * Messages are short event names ({@code dispatch_handler_exception}); details go
 * into the {@code data} ThreadContext key as JSON. Every line also carries the
 * Lambda request id and, while a request is being dispatched, the envelope id
 * ({@code correlationId}) and the handler reference ({@code function}).
 *
 * <pre>
 * -- Everything that happened to one envelope
 * fields @timestamp, message, function, data
 * | filter correlationId = "0b6f..."
 * | sort @timestamp asc
 *
 * -- Handlers that blew up
 * fields @timestamp, function, data
 * | filter level = "ERROR" and message = "dispatch_handler_exception"
 * </pre>
 */
public class LoggingService {

    private static final Logger logger = LogManager.getLogger(LoggingService.class);
    private static final Gson gson = GsonFactory.create();

    // ThreadContext (MDC) keys
    public static final String KEY_REQUEST_ID = "requestId";
    public static final String KEY_CORRELATION_ID = "correlationId";
    public static final String KEY_FUNCTION = "function";
    public static final String KEY_DATA = "data";

    /**
     * Initialize logging context with Lambda request information.
     * Call this at the start of every Lambda invocation.
     */
    public static void initRequest(Context context) {
        clearContext();
        if (context != null) {
            ThreadContext.put(KEY_REQUEST_ID, context.getAwsRequestId());
        }
    }

    public static void initRequest(String requestId) {
        clearContext();
        if (requestId != null) {
            ThreadContext.put(KEY_REQUEST_ID, requestId);
        }
    }

    /**
     * Set the id of the envelope currently being dispatched.
     */
    public static void setCorrelationId(String correlationId) {
        if (correlationId != null) {
            ThreadContext.put(KEY_CORRELATION_ID, correlationId);
        }
    }

    /**
     * Set the handler reference currently being executed (e.g. "clusters.listClusters").
     */
    public static void setFunction(String function) {
        if (function != null) {
            ThreadContext.put(KEY_FUNCTION, function);
        }
    }

    /**
     * Drop the per-dispatch keys but keep the request id.
     */
    public static void clearDispatchContext() {
        ThreadContext.remove(KEY_CORRELATION_ID);
        ThreadContext.remove(KEY_FUNCTION);
    }

    public static void clearContext() {
        ThreadContext.clearAll();
    }

    // =========================================================================
    // Logging Methods
    // =========================================================================

    public static void debug(String message) {
        logger.debug(message);
    }

    public static void debug(String message, Map<String, Object> data) {
        if (!logger.isDebugEnabled()) {
            return;
        }
        setDataContext(data);
        logger.debug(message);
        clearDataContext();
    }

    public static void info(String message) {
        logger.info(message);
    }

    public static void info(String message, Map<String, Object> data) {
        setDataContext(data);
        logger.info(message);
        clearDataContext();
    }

    public static void warn(String message) {
        logger.warn(message);
    }

    public static void warn(String message, Map<String, Object> data) {
        setDataContext(data);
        logger.warn(message);
        clearDataContext();
    }

    public static void error(String message) {
        logger.error(message);
    }

    public static void error(String message, Throwable t) {
        logger.error(message, t);
    }

    public static void error(String message, Map<String, Object> data) {
        setDataContext(data);
        logger.error(message);
        clearDataContext();
    }

    public static void error(String message, Throwable t, Map<String, Object> data) {
        setDataContext(data);
        logger.error(message, t);
        clearDataContext();
    }

    // =========================================================================
    // Helper Methods
    // =========================================================================

    private static void setDataContext(Map<String, Object> data) {
        if (data != null && !data.isEmpty()) {
            ThreadContext.put(KEY_DATA, toJson(data));
        }
    }

    private static String toJson(Map<String, Object> data) {
        try {
            return gson.toJson(data);
        } catch (RuntimeException e) {
            // Handler params can hold anything; fall back to toString rather than lose the line.
            return String.valueOf(data);
        }
    }

    private static void clearDataContext() {
        ThreadContext.remove(KEY_DATA);
    }

    /**
     * Create a mutable map with the given key-value pairs.
     * Convenience method for creating log data.
     */
    public static Map<String, Object> data(Object... keyValuePairs) {
        Map<String, Object> map = new HashMap<>();
        for (int i = 0; i < keyValuePairs.length - 1; i += 2) {
            map.put(String.valueOf(keyValuePairs[i]), keyValuePairs[i + 1]);
        }
        return map;
    }
}
