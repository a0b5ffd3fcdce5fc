package me.christianrobert.convertifier.config.service;

import jakarta.enterprise.context.ApplicationScoped;
import me.christianrobert.convertifier.translator.context.TranslatorOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runtime-adjustable translator settings.
 *
 * <p>Values are read once at the start of every translation, so an update only
 * affects translations started afterwards.
 */
@ApplicationScoped
public class ConfigService {

    private static final Logger log = LoggerFactory.getLogger(ConfigService.class);

    public static final String DEFAULT_PARAMETER_TYPE = "translator.cpp.default-parameter-type";
    public static final String INPUT_PLACEHOLDER = "translator.cpp.input-placeholder";
    public static final String ENTRY_POINT_STUB = "translator.cpp.entry-point-stub";
    public static final String INDENT_WIDTH = "translator.format.indent-width";

    public static final Set<String> KNOWN_KEYS = Set.of(
            DEFAULT_PARAMETER_TYPE, INPUT_PLACEHOLDER, ENTRY_POINT_STUB, INDENT_WIDTH);

    private final Map<String, Object> configuration = new ConcurrentHashMap<>();

    public ConfigService() {
        initializeDefaultConfiguration();
    }

    private void initializeDefaultConfiguration() {
        configuration.put(DEFAULT_PARAMETER_TYPE, "auto");
        configuration.put(INPUT_PLACEHOLDER, "input_var");
        configuration.put(ENTRY_POINT_STUB, true);
        configuration.put(INDENT_WIDTH, 4);

        log.info("Configuration service initialized with default values");
    }

    public Map<String, Object> getAllConfiguration() {
        return new HashMap<>(configuration);
    }

    public Object getConfigValue(String key) {
        return configuration.get(key);
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
     * Gets a configuration value as an integer.
     * Accepts any {@link Number} (JSON bodies deliver integers as Integer or Long)
     * and numeric strings.
     *
     * @param key Configuration key
     * @return the integer value, or null if missing or not numeric
     */
    public Integer getConfigValueAsInteger(String key) {
        Object value = configuration.get(key);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        if (value instanceof String) {
            try {
                return Integer.parseInt(((String) value).trim());
            } catch (NumberFormatException e) {
                log.warn("Config value for {} is not an integer: {}", key, value);
                return null;
            }
        }
        return null;
    }

    public void updateConfiguration(Map<String, Object> newConfig) {
        log.info("Updating configuration with {} entries", newConfig.size());

        // Nothing is applied unless every entry is acceptable
        newConfig.forEach(this::validate);
        newConfig.forEach((key, value) -> {
            Object oldValue = configuration.put(key, value);
            if (log.isDebugEnabled()) {
                log.debug("Config updated: {} = {} (was: {})", key, value, oldValue);
            }
        });

        log.info("Configuration updated successfully");
    }

    public void setConfigValue(String key, Object value) {
        validate(key, value);
        Object oldValue = configuration.put(key, value);
        log.debug("Config value set: {} = {} (was: {})", key, value, oldValue);
    }

    public boolean hasConfigKey(String key) {
        return configuration.containsKey(key);
    }

    public void resetToDefaults() {
        log.info("Resetting configuration to defaults");
        configuration.clear();
        initializeDefaultConfiguration();
    }

    /**
     * Rejects unknown keys and values the translators cannot use.
     *
     * @throws IllegalArgumentException if the key or value is not acceptable
     */
    private void validate(String key, Object value) {
        if (!KNOWN_KEYS.contains(key)) {
            throw new IllegalArgumentException("Unknown configuration key: " + key);
        }
        if (value == null || value.toString().trim().isEmpty()) {
            throw new IllegalArgumentException("Configuration value for " + key + " cannot be empty");
        }
        if (INDENT_WIDTH.equals(key)) {
            int width;
            try {
                width = Integer.parseInt(value.toString().trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Configuration value for " + key + " must be an integer: " + value, e);
            }
            if (width < 0 || width > TranslatorOptions.MAX_INDENT_WIDTH) {
                throw new IllegalArgumentException("Configuration value for " + key + " must be between 0 and "
                        + TranslatorOptions.MAX_INDENT_WIDTH + ": " + value);
            }
        }
        if (ENTRY_POINT_STUB.equals(key) && !(value instanceof Boolean)
                && !"true".equalsIgnoreCase(value.toString()) && !"false".equalsIgnoreCase(value.toString())) {
            throw new IllegalArgumentException("Configuration value for " + key + " must be true or false: " + value);
        }
    }
}
