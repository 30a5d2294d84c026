package edu.utexas.tacc.tapis.hostlink.lib.config;

import java.util.HashMap;
import java.util.Map;
import java.util.stream.Collectors;


/**
 * Get all the environment variables and system properties add them together in a HashMap. System
 * properties override environment variables. Explicit overrides, if given, win over both.
 */
public class Settings {

    private final Map<String, String> runtimeSettings = new HashMap<>();

    public Settings() {
        this(Map.of());
    }

    /**
     * @param overrides values that take precedence over the environment and system properties
     */
    public Settings(Map<String, String> overrides) {
        Map<String, String> props = System.getProperties().entrySet().stream()
            .collect(Collectors.toMap(e -> String.valueOf(e.getKey()), e -> String.valueOf(e.getValue())));
        runtimeSettings.putAll(System.getenv());
        runtimeSettings.putAll(props);
        runtimeSettings.putAll(overrides);
    }

    /**
     * @param key
     * @param def String default
     * @return value
     */
    public String get(String key, String def) {
        return runtimeSettings.getOrDefault(key, def);
    }

    public String get(String key) {
        return runtimeSettings.get(key);
    }
}
