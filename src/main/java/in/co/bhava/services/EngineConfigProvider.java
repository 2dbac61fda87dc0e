package in.co.bhava.services;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.InputStream;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;

/**
 * Cached provider for {@value EngineConfig#CONFIG_RESOURCE} overrides.
 * Reads the resource once on first access (thread-safe via double-checked locking)
 * and flattens nested objects into dotted keys ({"orb": {"sextile": 5}} becomes "orb.sextile").
 *
 * Package-private, used only by the services package.
 */
class EngineConfigProvider {

    private static volatile Map<String, String> cache;

    private EngineConfigProvider() {}

    static int getInt(String key, int defaultValue) {
        String value = values().get(key);
        if (value == null || value.isEmpty()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            LoggingService.warn("engine_config_invalid_int", LoggingService.data("key", key, "value", value));
            return defaultValue;
        }
    }

    static double getDouble(String key, double defaultValue) {
        String value = values().get(key);
        if (value == null || value.isEmpty()) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            LoggingService.warn("engine_config_invalid_double", LoggingService.data("key", key, "value", value));
            return defaultValue;
        }
    }

    private static Map<String, String> values() {
        if (cache == null) {
            synchronized (EngineConfigProvider.class) {
                if (cache == null) {
                    cache = load(EngineConfig.CONFIG_RESOURCE);
                }
            }
        }
        return cache;
    }

    static Map<String, String> load(String resource) {
        Map<String, String> map = new HashMap<>();
        try (InputStream in = EngineConfigProvider.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                LoggingService.debug("engine_config_not_found", LoggingService.data("resource", resource));
                return Collections.emptyMap();
            }
            flatten("", new ObjectMapper().readTree(in), map);
            LoggingService.info("engine_config_loaded", LoggingService.data("resource", resource, "keys", map.size()));
        } catch (Exception e) {
            LoggingService.error("engine_config_load_failed", e);
        }
        return Collections.unmodifiableMap(map);
    }

    private static void flatten(String prefix, JsonNode node, Map<String, String> out) {
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            String key = prefix + entry.getKey();
            if (entry.getValue().isObject()) {
                flatten(key + ".", entry.getValue(), out);
            } else {
                out.put(key, entry.getValue().asText(""));
            }
        }
    }
}
