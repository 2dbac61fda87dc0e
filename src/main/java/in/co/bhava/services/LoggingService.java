package in.co.bhava.services;

import com.google.gson.Gson;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.util.HashMap;
import java.util.Map;

/**
 * Structured logging for the engine.
 *
 * <p>Every event is a snake_case message ("houses_analyzed", "chart_parse_failed"). The chart being
 * analysed and the calling operation travel in ThreadContext so the console pattern in
 * {@code log4j2.xml} prints them next to each event; event fields go to the {@code data} key as JSON.</p>
 *
 * <pre>
 * LoggingService.initRequest(requestId);
 * LoggingService.setChartId(chart.getId());
 * long start = LoggingService.logOperationStart("analyze_houses", LoggingService.data("ascendant", "Aries"));
 * ...
 * LoggingService.logOperationEnd("analyze_houses", start);
 * </pre>
 */
public class LoggingService {

    private static final Logger logger = LogManager.getLogger(LoggingService.class);
    private static final Gson gson = new Gson();

    // ThreadContext (MDC) keys
    public static final String KEY_REQUEST_ID = "requestId";
    public static final String KEY_CHART_ID = "chartId";
    public static final String KEY_FUNCTION = "function";
    public static final String KEY_DATA = "data";

    private LoggingService() {}

    /**
     * Start a fresh context for one caller request. Anything a previous request left on this
     * thread (pool threads are reused) is dropped.
     *
     * @param requestId caller's request id, may be null
     */
    public static void initRequest(String requestId) {
        clearContext();
        putOrRemove(KEY_REQUEST_ID, requestId);
    }

    /**
     * Tag subsequent events with the chart id. A chart without an id removes the tag so events are
     * never attributed to the chart analysed before it.
     */
    public static void setChartId(String chartId) {
        putOrRemove(KEY_CHART_ID, chartId);
    }

    public static void setFunction(String function) {
        putOrRemove(KEY_FUNCTION, function);
    }

    public static void clearContext() {
        ThreadContext.clearAll();
    }

    // =========================================================================
    // Events
    // =========================================================================

    public static void debug(String message, Map<String, Object> data) {
        log(Level.DEBUG, message, null, data);
    }

    public static void info(String message, Map<String, Object> data) {
        log(Level.INFO, message, null, data);
    }

    public static void warn(String message, Map<String, Object> data) {
        log(Level.WARN, message, null, data);
    }

    public static void error(String message, Throwable t) {
        log(Level.ERROR, message, t, null);
    }

    // =========================================================================
    // Operation timing
    // =========================================================================

    /**
     * @return start time to hand back to {@link #logOperationEnd} or {@link #logOperationFailed}
     */
    public static long logOperationStart(String operation, Map<String, Object> data) {
        info(operation + "_started", data);
        return System.currentTimeMillis();
    }

    public static void logOperationEnd(String operation, long startTime) {
        logOperationEnd(operation, startTime, Map.of());
    }

    public static void logOperationEnd(String operation, long startTime, Map<String, Object> additionalData) {
        Map<String, Object> data = new HashMap<>(additionalData);
        data.put("durationMs", System.currentTimeMillis() - startTime);
        info(operation + "_completed", data);
    }

    public static void logOperationFailed(String operation, long startTime, Throwable t) {
        log(Level.ERROR, operation + "_failed", t, data("durationMs", System.currentTimeMillis() - startTime));
    }

    /**
     * Failure that is reported back to the caller as a result rather than thrown.
     */
    public static void logOperationFailed(String operation, long startTime, String errorMessage) {
        log(Level.ERROR, operation + "_failed", null,
                data("durationMs", System.currentTimeMillis() - startTime, "errorMessage", errorMessage));
    }

    /**
     * Build an event data map from alternating keys and values; a trailing unpaired key is ignored.
     */
    public static Map<String, Object> data(Object... keyValuePairs) {
        Map<String, Object> map = new HashMap<>();
        for (int i = 0; i < keyValuePairs.length - 1; i += 2) {
            map.put(String.valueOf(keyValuePairs[i]), keyValuePairs[i + 1]);
        }
        return map;
    }

    private static void log(Level level, String message, Throwable t, Map<String, Object> data) {
        if (!logger.isEnabled(level)) {
            return;
        }
        boolean hasData = data != null && !data.isEmpty();
        if (hasData) {
            ThreadContext.put(KEY_DATA, gson.toJson(data));
        }
        try {
            logger.log(level, message, t);
        } finally {
            if (hasData) {
                ThreadContext.remove(KEY_DATA);
            }
        }
    }

    private static void putOrRemove(String key, String value) {
        if (value == null) {
            ThreadContext.remove(key);
        } else {
            ThreadContext.put(key, value);
        }
    }
}
