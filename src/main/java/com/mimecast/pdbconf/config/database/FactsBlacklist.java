package com.mimecast.pdbconf.config.database;

import com.google.common.collect.ImmutableList;
import com.mimecast.pdbconf.config.ConfigException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Facts blacklist compilation.
 *
 * <p>With <code>facts-blacklist-type = regex</code> every entry must be a valid regular expression.
 * <br>With <code>literal</code> entries match fact names exactly.
 */
public final class FactsBlacklist {

    private FactsBlacklist() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Compiles the blacklist of a resolved profile.
     *
     * @param section Section label for messages.
     * @param profile Resolved database profile.
     * @return Immutable list of patterns, empty when no blacklist is set.
     * @throws ConfigException CONVERSION listing every pattern that failed to compile.
     */
    @SuppressWarnings("unchecked")
    public static List<Pattern> compile(String section, Map<String, Object> profile) {
        List<String> entries = (List<String>) profile.getOrDefault("facts-blacklist", ImmutableList.of());
        boolean regex = "regex".equals(profile.get("facts-blacklist-type"));

        ImmutableList.Builder<Pattern> patterns = ImmutableList.builder();
        List<String> errors = new ArrayList<>();
        for (String entry : entries) {
            if (!regex) {
                patterns.add(Pattern.compile(entry, Pattern.LITERAL));
                continue;
            }
            try {
                patterns.add(Pattern.compile(entry));
            } catch (PatternSyntaxException e) {
                errors.add(e.getMessage());
            }
        }

        if (!errors.isEmpty()) {
            throw new ConfigException(ConfigException.Kind.CONVERSION,
                    "Unable to parse facts-blacklist patterns in [" + section + "]:\n" + String.join("\n", errors));
        }
        return patterns.build();
    }
}
