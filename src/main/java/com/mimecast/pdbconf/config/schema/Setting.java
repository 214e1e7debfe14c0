package com.mimecast.pdbconf.config.schema;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Declaration of one section key.
 *
 * <p>Carries the key type, whether the key is required, an optional default provider and an optional constraint.
 * <br>Defaults are raw values and go through conversion like user supplied ones.
 */
public final class Setting {

    private final String key;
    private final SettingType type;
    private final boolean required;
    private final Supplier<Object> defaultValue;
    private final Predicate<Object> constraint;
    private final String constraintDescription;

    private Setting(String key, SettingType type, boolean required, Supplier<Object> defaultValue,
                    Predicate<Object> constraint, String constraintDescription) {
        this.key = Objects.requireNonNull(key, "key");
        this.type = Objects.requireNonNull(type, "type");
        this.required = required;
        this.defaultValue = defaultValue;
        this.constraint = constraint;
        this.constraintDescription = constraintDescription;
    }

    /**
     * Required setting.
     *
     * @param key  Key.
     * @param type Type.
     * @return Setting instance.
     */
    public static Setting required(String key, SettingType type) {
        return new Setting(key, type, true, null, null, null);
    }

    /**
     * Optional setting without default.
     *
     * @param key  Key.
     * @param type Type.
     * @return Setting instance.
     */
    public static Setting optional(String key, SettingType type) {
        return new Setting(key, type, false, null, null, null);
    }

    /**
     * Optional setting with a literal default.
     *
     * @param key          Key.
     * @param type         Type.
     * @param defaultValue Raw default value.
     * @return Setting instance.
     */
    public static Setting defaulted(String key, SettingType type, Object defaultValue) {
        Objects.requireNonNull(defaultValue, "defaultValue");
        return new Setting(key, type, false, () -> defaultValue, null, null);
    }

    /**
     * Optional setting with a computed default.
     *
     * @param key      Key.
     * @param type     Type.
     * @param provider Raw default provider.
     * @return Setting instance.
     */
    public static Setting defaulted(String key, SettingType type, Supplier<Object> provider) {
        return new Setting(key, type, false, Objects.requireNonNull(provider, "provider"), null, null);
    }

    /**
     * Copy of this setting with a constraint on the converted value.
     *
     * @param predicate   Constraint.
     * @param description Constraint description for messages, e.g. "must not be negative".
     * @return Setting instance.
     */
    public Setting constrained(Predicate<Object> predicate, String description) {
        return new Setting(key, type, required, defaultValue, predicate, description);
    }

    /**
     * Gets key.
     *
     * @return Key.
     */
    public String getKey() {
        return key;
    }

    /**
     * Gets type.
     *
     * @return SettingType.
     */
    public SettingType getType() {
        return type;
    }

    /**
     * Is required.
     *
     * @return Boolean.
     */
    public boolean isRequired() {
        return required;
    }

    /**
     * Computes the default value.
     *
     * @return Optional of raw default.
     */
    public Optional<Object> getDefault() {
        return defaultValue == null ? Optional.empty() : Optional.ofNullable(defaultValue.get());
    }

    /**
     * Does the converted value satisfy the constraint.
     *
     * @param value Converted value.
     * @return Boolean.
     */
    public boolean satisfies(Object value) {
        return constraint == null || constraint.test(value);
    }

    /**
     * Gets constraint description.
     *
     * @return Description or null.
     */
    public String getConstraintDescription() {
        return constraintDescription;
    }

    @Override
    public String toString() {
        return key + (required ? "" : "?") + ": " + type.getName();
    }
}
