package com.mimecast.pdbconf.config.database;

import com.google.common.collect.ImmutableMap;
import com.mimecast.pdbconf.config.section.SectionNode;

import java.util.Map;

/**
 * Resolved database profiles.
 *
 * <p>Holds the sectionwide write profile, any named write profiles and the read profile.
 */
public class DatabaseSection {

    /**
     * Name used for the single write profile when no subsections are configured.
     */
    public static final String DEFAULT_NAME = "default";

    private final DatabaseConfig database;
    private final Map<String, DatabaseConfig> writeDatabases;
    private final DatabaseConfig readDatabase;

    /**
     * Constructs a new DatabaseSection instance.
     *
     * @param write Resolved write section node.
     * @param read  Resolved read profile.
     * @throws com.mimecast.pdbconf.config.ConfigException CONVERSION on an invalid regex facts blacklist.
     */
    public DatabaseSection(SectionNode write, Map<String, Object> read) {
        this.database = new DatabaseConfig(DatabaseResolver.DATABASE, write.getSectionwide());
        if (write.hasSubsections()) {
            ImmutableMap.Builder<String, DatabaseConfig> builder = ImmutableMap.builder();
            write.getSubsections().forEach((name, settings) ->
                    builder.put(name, new DatabaseConfig(DatabaseResolver.label(name), settings)));
            this.writeDatabases = builder.build();
        } else {
            this.writeDatabases = ImmutableMap.of(DEFAULT_NAME, database);
        }
        this.readDatabase = new DatabaseConfig(DatabaseResolver.READ_DATABASE, read);
    }

    /**
     * Gets the sectionwide write profile.
     *
     * @return DatabaseConfig instance.
     */
    public DatabaseConfig getDatabase() {
        return database;
    }

    /**
     * Gets write profiles by name.
     * <p>Without subsections this holds the sectionwide profile under {@link #DEFAULT_NAME}.
     *
     * @return Immutable map.
     */
    public Map<String, DatabaseConfig> getWriteDatabases() {
        return writeDatabases;
    }

    /**
     * Gets the read profile.
     *
     * @return DatabaseConfig instance.
     */
    public DatabaseConfig getReadDatabase() {
        return readDatabase;
    }
}
