package com.mimecast.pdbconf.config.schema;

import com.google.common.collect.ImmutableMap;
import com.mimecast.pdbconf.config.ConfigException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Schema driven defaulting and conversion of one section.
 *
 * <p>Steps, in order:
 * <ol>
 *     <li>Warn about keys the incoming schema does not declare.</li>
 *     <li>Strip them and validate the rest against the incoming schema.</li>
 *     <li>Fill absent optional keys from their defaults.</li>
 *     <li>Convert every value to the outgoing schema type and check constraints.</li>
 *     <li>Validate the result against the outgoing schema.</li>
 * </ol>
 *
 * <p>Running it again on {@link #render(SectionSchema, Map)} output gives the same values.
 */
public final class SectionConverter {
    private static final Logger log = LogManager.getLogger(SectionConverter.class);

    private SectionConverter() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Resolves raw section settings.
     *
     * @param section  Section label for messages, e.g. <code>database "primary"</code>.
     * @param incoming Incoming schema.
     * @param outgoing Outgoing schema.
     * @param raw      Raw settings.
     * @return Immutable resolved settings.
     * @throws ConfigException SCHEMA or CONVERSION.
     */
    public static Map<String, Object> convert(String section, SectionSchema incoming, SectionSchema outgoing,
                                              Map<String, Object> raw) {
        warnUnknownKeys(incoming, raw);

        Map<String, Object> known = incoming.stripUnknownKeys(raw);
        known.values().removeIf(Objects::isNull);
        incoming.validateIncoming(section, known);

        Map<String, Object> defaulted = applyDefaults(incoming, known);

        ImmutableMap.Builder<String, Object> converted = ImmutableMap.builder();
        for (Map.Entry<String, Object> entry : defaulted.entrySet()) {
            Setting setting = outgoing.get(entry.getKey());
            if (setting == null) {
                throw new ConfigException(ConfigException.Kind.SCHEMA,
                        "Invalid [" + section + "] config: key `" + entry.getKey() + "` has no resolved form");
            }
            converted.put(entry.getKey(), convertValue(section, setting, entry.getValue()));
        }

        Map<String, Object> result = converted.build();
        outgoing.validateOutgoing(section, result);
        return result;
    }

    /**
     * Logs a warning for every undeclared key.
     *
     * @param schema Incoming schema.
     * @param data   Raw settings.
     */
    public static void warnUnknownKeys(SectionSchema schema, Map<String, ?> data) {
        for (String key : schema.unknownKeys(data)) {
            log.warn("The configuration item `{}` does not exist and should be removed from the config.", key);
        }
    }

    /**
     * Fills absent optional keys from their defaults.
     *
     * @param schema Incoming schema.
     * @param data   Raw settings.
     * @return New map.
     */
    public static Map<String, Object> applyDefaults(SectionSchema schema, Map<String, Object> data) {
        Map<String, Object> defaulted = new LinkedHashMap<>(data);
        for (Setting setting : schema.getSettings().values()) {
            if (!defaulted.containsKey(setting.getKey())) {
                setting.getDefault().ifPresent(value -> defaulted.put(setting.getKey(), value));
            }
        }
        return defaulted;
    }

    /**
     * Renders resolved settings back to raw values.
     *
     * @param outgoing Outgoing schema.
     * @param resolved Resolved settings.
     * @return New map of raw values.
     */
    public static Map<String, Object> render(SectionSchema outgoing, Map<String, Object> resolved) {
        Map<String, Object> raw = new LinkedHashMap<>();
        resolved.forEach((key, value) -> {
            Setting setting = outgoing.get(key);
            raw.put(key, setting == null ? value : setting.getType().render(value));
        });
        return raw;
    }

    private static Object convertValue(String section, Setting setting, Object raw) {
        Object value;
        try {
            value = setting.getType().convert(raw);
        } catch (IllegalArgumentException e) {
            throw new ConfigException(ConfigException.Kind.CONVERSION,
                    "Invalid value for `" + setting.getKey() + "` in [" + section + "]: " + quote(raw)
                            + " is " + e.getMessage(), e);
        }
        if (!setting.satisfies(value)) {
            throw new ConfigException(ConfigException.Kind.CONVERSION,
                    "Invalid value for `" + setting.getKey() + "` in [" + section + "]: " + quote(raw)
                            + " " + setting.getConstraintDescription());
        }
        return value;
    }

    private static String quote(Object raw) {
        return "'" + raw + "'";
    }
}
