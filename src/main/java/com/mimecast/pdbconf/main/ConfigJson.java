package com.mimecast.pdbconf.main;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonPrimitive;
import com.google.gson.JsonSerializer;
import com.mimecast.pdbconf.config.ResolvedConfig;
import com.mimecast.pdbconf.config.schema.Periods;
import org.joda.time.Days;
import org.joda.time.Minutes;
import org.joda.time.Period;

/**
 * Resolved configuration JSON writer.
 *
 * <p>Minutes and days are written as numbers, periods as <code>14d</code> style strings.
 */
public final class ConfigJson {

    private ConfigJson() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Serializes a resolved configuration.
     *
     * @param config Resolved configuration.
     * @param pretty Pretty print.
     * @return JSON string.
     */
    public static String toJson(ResolvedConfig config, boolean pretty) {
        return gson(pretty).toJson(config.toMap());
    }

    /**
     * Builds the Gson instance.
     *
     * @param pretty Pretty print.
     * @return Gson instance.
     */
    static Gson gson(boolean pretty) {
        GsonBuilder builder = new GsonBuilder()
                .disableHtmlEscaping()
                .registerTypeAdapter(Minutes.class,
                        (JsonSerializer<Minutes>) (src, type, context) -> new JsonPrimitive(src.getMinutes()))
                .registerTypeAdapter(Days.class,
                        (JsonSerializer<Days>) (src, type, context) -> new JsonPrimitive(src.getDays()))
                .registerTypeAdapter(Period.class,
                        (JsonSerializer<Period>) (src, type, context) -> new JsonPrimitive(Periods.format(src)));
        if (pretty) {
            builder.setPrettyPrinting();
        }
        return builder.create();
    }
}
