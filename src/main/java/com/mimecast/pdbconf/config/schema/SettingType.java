package com.mimecast.pdbconf.config.schema;

/**
 * Value type of a setting.
 *
 * <p>Incoming schemas use {@link #accepts(Object)} to check the coarse raw shape.
 * <br>Outgoing schemas use {@link #convert(Object)} to produce the semantic value and
 * {@link #isInstance(Object)} to validate the result.
 *
 * @see SettingTypes
 */
public interface SettingType {

    /**
     * Gets type name for messages.
     *
     * @return Type name.
     */
    String getName();

    /**
     * Does the raw value have an acceptable shape.
     *
     * @param raw Raw value.
     * @return Boolean.
     */
    boolean accepts(Object raw);

    /**
     * Converts a raw or already converted value.
     *
     * @param raw Raw value.
     * @return Converted value.
     * @throws IllegalArgumentException If the value cannot be converted.
     */
    Object convert(Object raw);

    /**
     * Is the value a converted value of this type.
     *
     * @param value Value.
     * @return Boolean.
     */
    boolean isInstance(Object value);

    /**
     * Renders a converted value back to a raw value.
     *
     * @param value Converted value.
     * @return Raw value.
     */
    Object render(Object value);
}
