package com.mimecast.pdbconf.main;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.Strictness;
import com.google.gson.ToNumberPolicy;
import com.google.gson.reflect.TypeToken;
import com.mimecast.pdbconf.config.ConfigException;

import java.io.IOException;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Raw configuration document reader.
 *
 * <p>Reads JSON5 style documents: comments, unquoted keys and single quoted strings are allowed.
 * <br>Whole numbers are read as Long, others as Double.
 * <br>Section keys keep their document order.
 */
public final class RawConfigReader {

    private static final Type DOCUMENT_TYPE = new TypeToken<LinkedHashMap<String, Object>>() {}.getType();

    private static final Gson GSON = new GsonBuilder()
            .setStrictness(Strictness.LENIENT)
            .setObjectToNumberStrategy(ToNumberPolicy.LONG_OR_DOUBLE)
            .create();

    private RawConfigReader() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Reads a document from a file.
     *
     * @param path File path.
     * @return Raw document.
     * @throws IOException     Unable to read file.
     * @throws ConfigException STRUCTURE if the content is not a document of sections.
     */
    public static Map<String, Object> read(Path path) throws IOException {
        return parse(Files.readString(path, StandardCharsets.UTF_8));
    }

    /**
     * Parses a document.
     *
     * @param content Document content.
     * @return Raw document.
     * @throws ConfigException STRUCTURE if the content is not a document of sections.
     */
    public static Map<String, Object> parse(String content) {
        Map<String, Object> document;
        try {
            document = GSON.fromJson(content, DOCUMENT_TYPE);
        } catch (JsonParseException e) {
            throw new ConfigException(ConfigException.Kind.STRUCTURE, "Unable to parse config: " + e.getMessage(), e);
        }
        return document != null ? document : new LinkedHashMap<>();
    }
}
