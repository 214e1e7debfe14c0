package com.mimecast.pdbconf.config;

import com.google.common.collect.ImmutableMap;
import org.joda.time.Days;
import org.joda.time.Minutes;
import org.joda.time.Period;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Configuration foundation.
 *
 * <p>Typed read access over a resolved section map.
 * <p>Subclasses expose named accessors for the keys of one section.
 * <p>The backing map is copied on construction and never changes afterwards.
 */
public class ConfigFoundation {

    /**
     * Resolved section map.
     */
    protected final Map<String, Object> map;

    /**
     * Constructs a new ConfigFoundation instance.
     */
    public ConfigFoundation() {
        this.map = ImmutableMap.of();
    }

    /**
     * Constructs a new ConfigFoundation instance.
     *
     * @param map Configuration map.
     */
    public ConfigFoundation(Map<String, Object> map) {
        this.map = map == null ? ImmutableMap.of() : ImmutableMap.copyOf(map);
    }

    /**
     * Gets the backing map.
     *
     * @return Immutable map.
     */
    public Map<String, Object> getMap() {
        return map;
    }

    /**
     * Has property.
     *
     * @param name Property name.
     * @return Boolean.
     */
    public boolean hasProperty(String name) {
        return map.containsKey(name);
    }

    /**
     * Gets string property.
     *
     * @param name Property name.
     * @return String or null.
     */
    public String getStringProperty(String name) {
        return getStringProperty(name, null);
    }

    /**
     * Gets string property with default.
     *
     * @param name Property name.
     * @param def  Default value.
     * @return String.
     */
    public String getStringProperty(String name, String def) {
        Object value = map.get(name);
        return value != null ? value.toString() : def;
    }

    /**
     * Gets long property with default.
     *
     * @param name Property name.
     * @param def  Default value.
     * @return Long.
     */
    public Long getLongProperty(String name, Long def) {
        Object value = map.get(name);
        return value instanceof Number number ? Long.valueOf(number.longValue()) : def;
    }

    /**
     * Gets boolean property with default.
     *
     * @param name Property name.
     * @param def  Default value.
     * @return Boolean.
     */
    public boolean getBooleanProperty(String name, boolean def) {
        Object value = map.get(name);
        return value instanceof Boolean bool ? bool : def;
    }

    /**
     * Gets minutes property.
     *
     * @param name Property name.
     * @return Optional of Minutes.
     */
    public Optional<Minutes> getMinutesProperty(String name) {
        return getTypedProperty(name, Minutes.class);
    }

    /**
     * Gets days property.
     *
     * @param name Property name.
     * @return Optional of Days.
     */
    public Optional<Days> getDaysProperty(String name) {
        return getTypedProperty(name, Days.class);
    }

    /**
     * Gets period property.
     *
     * @param name Property name.
     * @return Optional of Period.
     */
    public Optional<Period> getPeriodProperty(String name) {
        return getTypedProperty(name, Period.class);
    }

    /**
     * Gets list property.
     *
     * @param name Property name.
     * @return List of strings, empty if unset.
     */
    @SuppressWarnings("unchecked")
    public List<String> getListProperty(String name) {
        Object value = map.get(name);
        return value instanceof List ? (List<String>) value : Collections.emptyList();
    }

    /**
     * Gets typed property.
     *
     * @param name Property name.
     * @param type Expected class.
     * @param <T>  Value type.
     * @return Optional of value, empty if unset or of another type.
     */
    protected <T> Optional<T> getTypedProperty(String name, Class<T> type) {
        Object value = map.get(name);
        return type.isInstance(value) ? Optional.of(type.cast(value)) : Optional.empty();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + map;
    }
}
