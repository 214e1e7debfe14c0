package com.mimecast.pdbconf.config.schema;

import com.google.common.collect.ImmutableMap;
import com.mimecast.pdbconf.config.ConfigException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Declarative schema of one section.
 *
 * <p>An incoming schema describes what users may write, with defaults for optional keys.
 * <br>An outgoing schema describes the resolved, typed form.
 *
 * <p>Unknown keys are found by set difference against the declared keys.
 */
public final class SectionSchema {

    private final String name;
    private final Map<String, Setting> settings;

    private SectionSchema(String name, Map<String, Setting> settings) {
        this.name = name;
        this.settings = ImmutableMap.copyOf(settings);
    }

    /**
     * Starts a schema.
     *
     * @param name Schema name for messages.
     * @return Builder instance.
     */
    public static Builder builder(String name) {
        return new Builder(name);
    }

    /**
     * Starts a schema holding a copy of this one's settings.
     *
     * @param name New schema name.
     * @return Builder instance.
     */
    public Builder extend(String name) {
        Builder builder = new Builder(name);
        settings.values().forEach(builder::add);
        return builder;
    }

    /**
     * Gets schema name.
     *
     * @return Name.
     */
    public String getName() {
        return name;
    }

    /**
     * Gets settings.
     *
     * @return Immutable map of key to setting in declaration order.
     */
    public Map<String, Setting> getSettings() {
        return settings;
    }

    /**
     * Gets one setting.
     *
     * @param key Key.
     * @return Setting or null.
     */
    public Setting get(String key) {
        return settings.get(key);
    }

    /**
     * Is key declared.
     *
     * @param key Key.
     * @return Boolean.
     */
    public boolean declares(String key) {
        return settings.containsKey(key);
    }

    /**
     * Keys present in data but not declared.
     *
     * @param data Settings map.
     * @return Unknown keys in data order.
     */
    public Set<String> unknownKeys(Map<String, ?> data) {
        Set<String> unknown = new LinkedHashSet<>(data.keySet());
        unknown.removeAll(settings.keySet());
        return unknown;
    }

    /**
     * Removes undeclared keys.
     *
     * @param data Settings map.
     * @return New map with declared keys only.
     */
    public Map<String, Object> stripUnknownKeys(Map<String, Object> data) {
        Map<String, Object> stripped = new LinkedHashMap<>(data);
        stripped.keySet().retainAll(settings.keySet());
        return stripped;
    }

    /**
     * Validates raw data against this schema as an incoming schema.
     * <p>Required keys must be present and every value must have an acceptable raw shape.
     *
     * @param section Section label for messages.
     * @param data    Raw settings without unknown keys.
     * @throws ConfigException SCHEMA naming every offending key.
     */
    public void validateIncoming(String section, Map<String, Object> data) {
        List<String> errors = new ArrayList<>();
        for (Setting setting : settings.values()) {
            Object value = data.get(setting.getKey());
            if (value == null) {
                if (setting.isRequired()) {
                    errors.add("missing required key `" + setting.getKey() + "`");
                }
            } else if (!setting.getType().accepts(value)) {
                errors.add("`" + setting.getKey() + "` must be of type " + setting.getType().getName() + ", got " + describe(value));
            }
        }
        fail(section, errors);
    }

    /**
     * Validates converted data against this schema as an outgoing schema.
     * <p>No undeclared keys, all required keys present, every value of its semantic type and within its constraint.
     *
     * @param section Section label for messages.
     * @param data    Converted settings.
     * @throws ConfigException SCHEMA naming every offending key.
     */
    public void validateOutgoing(String section, Map<String, Object> data) {
        List<String> errors = new ArrayList<>();
        for (String key : unknownKeys(data)) {
            errors.add("unexpected key `" + key + "`");
        }
        for (Setting setting : settings.values()) {
            Object value = data.get(setting.getKey());
            if (value == null) {
                if (setting.isRequired()) {
                    errors.add("missing required key `" + setting.getKey() + "`");
                }
            } else if (!setting.getType().isInstance(value)) {
                errors.add("`" + setting.getKey() + "` must be of type " + setting.getType().getName() + ", got " + describe(value));
            } else if (!setting.satisfies(value)) {
                errors.add("`" + setting.getKey() + "` " + setting.getConstraintDescription());
            }
        }
        fail(section, errors);
    }

    private static void fail(String section, List<String> errors) {
        if (!errors.isEmpty()) {
            throw new ConfigException(ConfigException.Kind.SCHEMA,
                    "Invalid [" + section + "] config: " + String.join("; ", errors));
        }
    }

    private static String describe(Object value) {
        return value.getClass().getSimpleName() + " " + value;
    }

    @Override
    public String toString() {
        return "SectionSchema{" + name + ": " + settings.values() + "}";
    }

    /**
     * SectionSchema builder.
     */
    public static final class Builder {
        private final String name;
        private final Map<String, Setting> settings = new LinkedHashMap<>();

        private Builder(String name) {
            this.name = name;
        }

        /**
         * Adds or replaces a setting.
         *
         * @param setting Setting.
         * @return Self.
         */
        public Builder add(Setting setting) {
            settings.put(setting.getKey(), setting);
            return this;
        }

        /**
         * Removes a setting.
         *
         * @param key Key.
         * @return Self.
         */
        public Builder remove(String key) {
            settings.remove(key);
            return this;
        }

        /**
         * Builds the schema.
         *
         * @return SectionSchema instance.
         */
        public SectionSchema build() {
            return new SectionSchema(name, settings);
        }
    }
}
