package com.mimecast.pdbconf.config.section;

import com.mimecast.pdbconf.config.ConfigException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Raw section settings helpers.
 */
public final class Settings {

    private Settings() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Reads a raw section value as a settings map.
     * <p>A missing section reads as empty and null values are treated as unset.
     *
     * @param section Section name for error messages.
     * @param value   Raw section value.
     * @return Mutable settings map in document order.
     * @throws ConfigException STRUCTURE when the value is not a map.
     */
    public static Map<String, Object> of(String section, Object value) {
        Map<String, Object> settings = new LinkedHashMap<>();
        if (value == null) {
            return settings;
        }
        if (!(value instanceof Map)) {
            throw new ConfigException(ConfigException.Kind.STRUCTURE,
                    "error: config section [" + section + "] must contain key/value settings");
        }
        ((Map<?, ?>) value).forEach((k, v) -> {
            if (v != null) {
                settings.put(String.valueOf(k), v);
            }
        });
        return settings;
    }

    /**
     * Merges settings, later maps win on conflict.
     *
     * @param base     Base settings.
     * @param override Overriding settings.
     * @return New map.
     */
    public static Map<String, Object> merge(Map<String, Object> base, Map<String, Object> override) {
        Map<String, Object> merged = new LinkedHashMap<>(base);
        merged.putAll(override);
        return merged;
    }
}
