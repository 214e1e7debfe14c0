package com.mimecast.pdbconf.main;

import com.google.common.collect.ImmutableList;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Retired configuration settings.
 *
 * <p>Retired settings are reported as warnings and otherwise ignored.
 * <br>A <code>[global] url-prefix</code> cannot be ignored safely and is reported as a fatal issue.
 * <br>Fatal issues are returned, never thrown; the caller decides how to stop.
 */
public final class Retirements {
    private static final Logger log = LogManager.getLogger(Retirements.class);

    private static final List<String[]> RETIRED = ImmutableList.of(
            new String[]{"command-processing", "max-frame-size"},
            new String[]{"command-processing", "memory-usage"},
            new String[]{"command-processing", "store-usage"},
            new String[]{"command-processing", "temp-usage"},
            new String[]{"database", "classname"},
            new String[]{"database", "conn-keep-alive"},
            new String[]{"database", "log-slow-statements"},
            new String[]{"database", "statements-cache-size"},
            new String[]{"database", "subprotocol"},
            new String[]{"read-database", "classname"},
            new String[]{"read-database", "conn-keep-alive"},
            new String[]{"read-database", "log-slow-statements"},
            new String[]{"read-database", "statements-cache-size"},
            new String[]{"read-database", "subprotocol"},
            new String[]{"global", "catalog-hash-conflict-debugging"}
    );

    private static final Pattern SUBSECTION_SEPARATOR = Pattern.compile("[ \\t]");

    private final List<String> warnings;
    private final List<String> fatalIssues;

    private Retirements(List<String> warnings, List<String> fatalIssues) {
        this.warnings = ImmutableList.copyOf(warnings);
        this.fatalIssues = ImmutableList.copyOf(fatalIssues);
    }

    /**
     * Checks a raw document for retired settings and logs the warnings.
     *
     * @param document Raw document.
     * @return Retirements instance.
     */
    public static Retirements check(Map<String, Object> document) {
        List<String> warnings = new ArrayList<>();
        List<String> fatal = new ArrayList<>();

        for (Map.Entry<String, Object> entry : document.entrySet()) {
            if (!(entry.getValue() instanceof Map)) {
                continue;
            }
            String section = sectionOf(entry.getKey());
            Map<?, ?> settings = (Map<?, ?>) entry.getValue();
            for (String[] retired : RETIRED) {
                if (retired[0].equals(section) && settings.containsKey(retired[1])) {
                    warnings.add("The [" + entry.getKey() + "] " + retired[1]
                            + " config option has been retired and will be ignored.");
                }
            }
        }

        if (document.containsKey("repl")) {
            warnings.add("The configuration block [repl] is now retired and will be ignored. "
                    + "Use [nrepl] instead. Consult the documentation for more details.");
        }

        if (document.get("global") instanceof Map && ((Map<?, ?>) document.get("global")).get("url-prefix") != null) {
            fatal.add("The configuration item `url-prefix` in the [global] section is retired, "
                    + "please remove this item from your config. "
                    + "PuppetDB has a non-configurable context route of `/pdb`. "
                    + "Consult the documentation for more details.");
        }

        for (String warning : warnings) {
            log.warn(warning);
        }
        return new Retirements(warnings, fatal);
    }

    /**
     * Gets warnings.
     *
     * @return Immutable list.
     */
    public List<String> getWarnings() {
        return warnings;
    }

    /**
     * Gets fatal issues.
     *
     * @return Immutable list.
     */
    public List<String> getFatalIssues() {
        return fatalIssues;
    }

    /**
     * Must startup stop.
     *
     * @return Boolean.
     */
    public boolean isFatal() {
        return !fatalIssues.isEmpty();
    }

    // Subsection headers count as their section.
    private static String sectionOf(String key) {
        return SUBSECTION_SEPARATOR.split(key, 2)[0];
    }
}
