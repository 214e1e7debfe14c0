package com.mimecast.pdbconf.config.database;

import com.google.common.collect.ImmutableMap;
import com.mimecast.pdbconf.config.ConfigException;
import com.mimecast.pdbconf.config.schema.Periods;
import com.mimecast.pdbconf.config.schema.SectionConverter;
import com.mimecast.pdbconf.config.section.SectionCoalescer;
import com.mimecast.pdbconf.config.section.SectionNode;
import com.mimecast.pdbconf.config.section.Settings;
import com.mimecast.pdbconf.config.section.SubsectionSettings;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.joda.time.Period;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Resolves the <code>[database]</code> and <code>[read-database]</code> sections.
 *
 * <p>Each database profile moves through these states, in order:
 * <ol>
 *     <li><b>Raw</b> - as coalesced from <code>database</code> and <code>database "name"</code> keys.</li>
 *     <li><b>Cascaded</b> - subsections carry the raw sectionwide settings underneath their own.</li>
 *     <li><b>Converted</b> - defaulted and typed by the write database schemas.</li>
 *     <li><b>Fixed up</b> - events TTL defaulted, user and username reconciled, migrator credentials defaulted.</li>
 * </ol>
 *
 * <p>The read profile is resolved from <code>[read-database]</code> when present,
 * otherwise derived from the sectionwide write settings with write-only keys dropped.
 *
 * @see DatabaseSchemas
 */
public final class DatabaseResolver {
    private static final Logger log = LogManager.getLogger(DatabaseResolver.class);

    /**
     * Document keys holding database sections.
     */
    public static final Pattern DATABASE_SECTION = Pattern.compile("^database.*");

    /**
     * Section name.
     */
    public static final String DATABASE = "database";

    /**
     * Read replica section name.
     */
    public static final String READ_DATABASE = "read-database";

    private static final String SECTIONWIDE_HINT = "The sectionwide [database] settings need their own "
            + "subname and user, even when every [database \"name\"] section sets them.";

    private DatabaseResolver() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Resolves the database sections of a raw document.
     *
     * @param document Raw document.
     * @return DatabaseSection instance.
     * @throws ConfigException On any invalid database setting.
     */
    public static DatabaseSection resolve(Map<String, Object> document) {
        Map<String, Object> coalesced = SectionCoalescer.coalesce(DATABASE_SECTION, document);
        SectionNode raw = (SectionNode) coalesced.getOrDefault(DATABASE, SectionNode.empty());

        SectionNode cascaded = SubsectionSettings.update(raw, DatabaseResolver::populate);
        validateSectionwide(cascaded);
        validateSubnames(cascaded);

        SectionNode resolved = SubsectionSettings.update(cascaded, DatabaseResolver::fixUp);
        log.debug("Resolved [database] with {} subsection(s)", resolved.getSubsections().size());

        Map<String, Object> read = configureReadDatabase(coalesced, resolved);
        return new DatabaseSection(resolved, read);
    }

    /**
     * Cascades raw sectionwide settings into a subsection, subsection values win.
     *
     * @param subsection  Subsection name or null.
     * @param sectionwide Sectionwide settings.
     * @param settings    Settings.
     * @return Cascaded settings.
     */
    static Map<String, Object> populate(String subsection, Map<String, Object> sectionwide, Map<String, Object> settings) {
        return subsection == null ? settings : Settings.merge(sectionwide, settings);
    }

    /**
     * Converts one cascaded profile and applies the fix-ups.
     *
     * @param subsection  Subsection name or null.
     * @param sectionwide Resolved sectionwide settings, unused since settings are already cascaded.
     * @param settings    Cascaded settings.
     * @return Resolved profile.
     */
    static Map<String, Object> fixUp(String subsection, Map<String, Object> sectionwide, Map<String, Object> settings) {
        String label = label(subsection);
        Map<String, Object> profile = SectionConverter.convert(label, DatabaseSchemas.WRITE_DATABASE_IN,
                DatabaseSchemas.WRITE_DATABASE_OUT, settings);

        profile = defaultEventsTtl(profile);
        profile = preferUserOnUsernameMismatch(profile, subsection);
        profile = ensureMigratorInfo(profile, label);

        checkEventsTtl(label, profile);
        return profile;
    }

    /**
     * Defaults <code>resource-events-ttl</code> to <code>report-ttl</code>.
     *
     * @param profile Converted profile.
     * @return Profile.
     */
    static Map<String, Object> defaultEventsTtl(Map<String, Object> profile) {
        if (profile.get("resource-events-ttl") != null || profile.get("report-ttl") == null) {
            return profile;
        }
        return with(profile, "resource-events-ttl", profile.get("report-ttl"));
    }

    /**
     * Reconciles <code>user</code> and <code>username</code>, preferring <code>user</code>.
     *
     * @param profile    Converted profile.
     * @param subsection Subsection name or null.
     * @return Profile with both keys holding the same value, or neither set.
     */
    static Map<String, Object> preferUserOnUsernameMismatch(Map<String, Object> profile, String subsection) {
        Object user = profile.get("user");
        Object username = profile.get("username");

        if (user != null && username != null && !user.equals(username)) {
            if (subsection != null) {
                log.warn("Configured \"{}\" database user \"{}\" and username \"{}\" don't match", subsection, user, username);
            } else {
                log.warn("Configured database user \"{}\" and username \"{}\" don't match", user, username);
            }
            log.warn("Preferring configured user \"{}\"", user);
        }

        Object chosen = user != null ? user : username;
        if (chosen == null) {
            return profile;
        }
        return with(with(profile, "user", chosen), "username", chosen);
    }

    /**
     * Defaults migrator credentials to the connection credentials.
     * <p>Must run after {@link #preferUserOnUsernameMismatch(Map, String)}.
     *
     * @param profile Converted profile.
     * @param label   Section label for messages.
     * @return Profile.
     * @throws ConfigException INVARIANT when no user is set.
     */
    static Map<String, Object> ensureMigratorInfo(Map<String, Object> profile, String label) {
        Object user = profile.get("user");
        if (user == null) {
            throw new ConfigException(ConfigException.Kind.INVARIANT,
                    "No user or username set in the [" + label + "] config.");
        }
        if (profile.get("migrator-username") == null) {
            profile = with(profile, "migrator-username", user);
        }
        if (profile.get("migrator-password") == null && profile.get("password") != null) {
            profile = with(profile, "migrator-password", profile.get("password"));
        }
        return profile;
    }

    private static void validateSubnames(SectionNode cascaded) {
        requireSubname(DATABASE, cascaded.getSectionwide());
        cascaded.getSubsections().forEach((name, settings) -> requireSubname(label(name), settings));
    }

    // Named sections do not replace the sectionwide profile: it is resolved as a write profile
    // of its own and feeds the derived read profile.
    private static void validateSectionwide(SectionNode cascaded) {
        if (!cascaded.hasSubsections()) {
            return;
        }
        Map<String, Object> sectionwide = cascaded.getSectionwide();
        if (sectionwide.get("user") == null && sectionwide.get("username") == null) {
            throw new ConfigException(ConfigException.Kind.INVARIANT, "No user or username set in the [database] config. "
                    + SECTIONWIDE_HINT);
        }
        Object subname = sectionwide.get("subname");
        if (!(subname instanceof String) || StringUtils.isBlank((String) subname)) {
            throw new ConfigException(ConfigException.Kind.INVARIANT, "No subname set in the [database] config. "
                    + SECTIONWIDE_HINT);
        }
    }

    private static void requireSubname(String label, Map<String, Object> settings) {
        Object subname = settings.get("subname");
        if (!(subname instanceof String) || StringUtils.isBlank((String) subname)) {
            throw new ConfigException(ConfigException.Kind.INVARIANT, "No subname set in the [" + label + "] config.");
        }
    }

    private static void checkEventsTtl(String label, Map<String, Object> profile) {
        Period events = (Period) profile.get("resource-events-ttl");
        Period reports = (Period) profile.get("report-ttl");
        if (events != null && reports != null && Periods.isLonger(events, reports)) {
            throw new ConfigException(ConfigException.Kind.INVARIANT,
                    "The setting for resource-events-ttl must not be longer than report-ttl in [" + label + "]");
        }
    }

    private static Map<String, Object> configureReadDatabase(Map<String, Object> coalesced, SectionNode resolved) {
        if (coalesced.containsKey(READ_DATABASE)) {
            Map<String, Object> raw = Settings.of(READ_DATABASE, coalesced.get(READ_DATABASE));
            requireSubname(READ_DATABASE, raw);
            return SectionConverter.convert(READ_DATABASE, DatabaseSchemas.DATABASE_IN,
                    DatabaseSchemas.DATABASE_OUT, raw);
        }

        Map<String, Object> derived = new LinkedHashMap<>(resolved.getSectionwide());
        derived.put("read-only?", true);
        derived = DatabaseSchemas.DATABASE_OUT.stripUnknownKeys(derived);
        DatabaseSchemas.DATABASE_OUT.validateOutgoing(READ_DATABASE, derived);
        log.debug("Derived [read-database] from [database]");
        return ImmutableMap.copyOf(derived);
    }

    private static Map<String, Object> with(Map<String, Object> profile, String key, Object value) {
        Map<String, Object> updated = new LinkedHashMap<>(profile);
        updated.put(key, Objects.requireNonNull(value, key));
        return ImmutableMap.copyOf(updated);
    }

    /**
     * Section label of a write profile, for messages.
     *
     * @param subsection Subsection name or null.
     * @return <code>database</code> or <code>database "name"</code>.
     */
    static String label(String subsection) {
        return subsection == null ? DATABASE : DATABASE + " \"" + subsection + "\"";
    }
}
