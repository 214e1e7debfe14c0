package com.mimecast.pdbconf.config.section;

import com.mimecast.pdbconf.config.ConfigException;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Groups flat document keys into section nodes.
 *
 * <p>Keys fully matching the given pattern are parsed as section headers (without brackets).
 * <br>A plain header supplies the sectionwide settings of its section.
 * <br>A header with a subsection supplies that subsection's settings.
 * <br>Every other entry is copied to the output unchanged.
 *
 * <p>Supplying the sectionwide settings or the same subsection twice is a STRUCTURE error.
 */
public final class SectionCoalescer {

    private SectionCoalescer() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Coalesces a document map.
     *
     * @param pattern  Pattern selecting keys to parse as headers.
     * @param document Raw document.
     * @return Document with matching sections replaced by {@link SectionNode} values.
     */
    public static Map<String, Object> coalesce(Pattern pattern, Map<String, Object> document) {
        return coalesce(pattern, new ArrayList<>(document.entrySet()));
    }

    /**
     * Coalesces an ordered list of document entries.
     * <p>Unlike a map this may carry the same key more than once.
     *
     * @param pattern Pattern selecting keys to parse as headers.
     * @param entries Raw document entries in document order.
     * @return Document with matching sections replaced by {@link SectionNode} values.
     */
    public static Map<String, Object> coalesce(Pattern pattern, List<Map.Entry<String, Object>> entries) {
        Map<String, Object> result = new LinkedHashMap<>();
        Map<String, Map<String, Object>> sectionwide = new LinkedHashMap<>();
        Map<String, Map<String, Map<String, Object>>> subsections = new LinkedHashMap<>();
        Set<String> seen = new HashSet<>();

        for (Map.Entry<String, Object> entry : entries) {
            String key = entry.getKey();
            if (!pattern.matcher(key).matches()) {
                result.put(key, entry.getValue());
                continue;
            }

            SectionName name = SectionName.fromKey(key);
            String section = name.getSection();
            Map<String, Object> settings = Settings.of(key, entry.getValue());
            sectionwide.computeIfAbsent(section, k -> new LinkedHashMap<>());
            subsections.computeIfAbsent(section, k -> new LinkedHashMap<>());
            result.putIfAbsent(section, SectionNode.empty());

            if (name.getSubsection().isPresent()) {
                String subsection = name.getSubsection().get();
                if (subsections.get(section).containsKey(subsection)) {
                    throw new ConfigException(ConfigException.Kind.STRUCTURE,
                            "error: multiple [" + quote(key) + "] subsections in config file");
                }
                subsections.get(section).put(subsection, settings);
            } else {
                if (!section.equals(key)) {
                    throw new ConfigException(ConfigException.Kind.INVARIANT,
                            "error: parsed config section [" + quote(key) + "] incorrectly ("
                                    + quote(section) + " != " + quote(key) + "); please report");
                }
                if (!seen.add(section)) {
                    throw new ConfigException(ConfigException.Kind.STRUCTURE,
                            "error: multiple [" + quote(key) + "] sections in config file");
                }
                sectionwide.get(section).putAll(settings);
            }
        }

        sectionwide.forEach((section, settings) ->
                result.put(section, new SectionNode(settings, subsections.get(section))));
        return result;
    }

    private static String quote(String s) {
        return "\"" + s + "\"";
    }
}
