package me.christianrobert.polyconv.config.service;

import jakarta.enterprise.context.ApplicationScoped;
import me.christianrobert.polyconv.context.EmitterConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

@ApplicationScoped
public class ConverterConfigService {

    private static final Logger log = LoggerFactory.getLogger(ConverterConfigService.class);

    public static final String QUERY_ROOT_NAMES = "query.root-names";
    public static final String JAVA_SMART_BRACKET = "java.smart-bracket";
    public static final String JAVA_CAST_NULLS = "java.cast-nulls";

    private final Map<String, Object> configuration = new ConcurrentHashMap<>();

    public ConverterConfigService() {
        initializeDefaultConfiguration();
    }

    private void initializeDefaultConfiguration() {
        configuration.put(QUERY_ROOT_NAMES, EmitterConfig.DEFAULT_ROOT_NAME);
        configuration.put(JAVA_SMART_BRACKET, true);
        configuration.put(JAVA_CAST_NULLS, true);

        log.info("Converter configuration initialized with default values");
    }

    public Map<String, Object> getAllConfiguration() {
        return new HashMap<>(configuration);
    }

    public String getConfigValueAsString(String key) {
        Object value = configuration.get(key);
        return value != null ? value.toString() : null;
    }

    public Boolean getConfigValueAsBoolean(String key) {
        Object value = configuration.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return Boolean.parseBoolean((String) value);
        }
        return null;
    }

    /**
     * Gets a configuration value as a list of strings.
     * Supports comma-separated values: "r,rr"; whitespace is trimmed and empty entries dropped.
     *
     * @param key Configuration key
     * @return List of strings, or empty list if value is null/empty
     */
    public List<String> getConfigValueAsStringList(String key) {
        String value = getConfigValueAsString(key);
        if (value == null || value.trim().isEmpty()) {
            return List.of();
        }

        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }

    public void updateConfiguration(Map<String, Object> newConfig) {
        log.info("Updating converter configuration with {} entries", newConfig.size());

        newConfig.forEach((key, value) -> {
            Object oldValue = configuration.put(key, value);
            if (log.isDebugEnabled()) {
                log.debug("Config updated: {} = {} (was: {})", key, value, oldValue);
            }
        });
    }

    public void setConfigValue(String key, Object value) {
        Object oldValue = configuration.put(key, value);
        log.debug("Config value set: {} = {} (was: {})", key, value, oldValue);
    }

    public boolean hasConfigKey(String key) {
        return configuration.containsKey(key);
    }

    public void resetToDefaults() {
        log.info("Resetting converter configuration to defaults");
        configuration.clear();
        initializeDefaultConfiguration();
    }

    /**
     * Builds the emitter settings from the current configuration. Missing or empty entries fall
     * back to the defaults; no declared type is set.
     */
    public EmitterConfig toEmitterConfig() {
        EmitterConfig config = EmitterConfig.defaults();

        List<String> rootNames = getConfigValueAsStringList(QUERY_ROOT_NAMES);
        if (!rootNames.isEmpty()) {
            Set<String> ordered = new LinkedHashSet<>(rootNames);
            config = config.withQueryRootNames(ordered);
        }
        Boolean smartBracket = getConfigValueAsBoolean(JAVA_SMART_BRACKET);
        if (smartBracket != null) {
            config = config.withSmartBracket(smartBracket);
        }
        Boolean castNulls = getConfigValueAsBoolean(JAVA_CAST_NULLS);
        if (castNulls != null) {
            config = config.withCastNulls(castNulls);
        }
        return config;
    }
}
