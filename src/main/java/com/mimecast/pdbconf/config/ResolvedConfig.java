package com.mimecast.pdbconf.config;

import com.google.common.collect.ImmutableMap;
import com.mimecast.pdbconf.config.database.DatabaseConfig;
import com.mimecast.pdbconf.config.database.DatabaseSection;
import com.mimecast.pdbconf.config.server.CommandProcessingConfig;
import com.mimecast.pdbconf.config.server.DeveloperConfig;
import com.mimecast.pdbconf.config.server.GlobalConfig;
import com.mimecast.pdbconf.config.server.PuppetdbConfig;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fully resolved service configuration.
 *
 * <p>Immutable once built; every section is typed, defaulted and validated.
 *
 * @see com.mimecast.pdbconf.main.ConfigResolver
 */
public class ResolvedConfig {

    private final GlobalConfig global;
    private final DeveloperConfig developer;
    private final DatabaseSection databases;
    private final CommandProcessingConfig commandProcessing;
    private final PuppetdbConfig puppetdb;

    /**
     * Constructs a new ResolvedConfig instance.
     *
     * @param global            Global section.
     * @param developer         Developer section.
     * @param databases         Database profiles.
     * @param commandProcessing Command processing section.
     * @param puppetdb          Service section.
     */
    public ResolvedConfig(GlobalConfig global, DeveloperConfig developer, DatabaseSection databases,
                          CommandProcessingConfig commandProcessing, PuppetdbConfig puppetdb) {
        this.global = global;
        this.developer = developer;
        this.databases = databases;
        this.commandProcessing = commandProcessing;
        this.puppetdb = puppetdb;
    }

    /**
     * Gets global section.
     *
     * @return GlobalConfig instance.
     */
    public GlobalConfig getGlobal() {
        return global;
    }

    /**
     * Gets developer section.
     *
     * @return DeveloperConfig instance.
     */
    public DeveloperConfig getDeveloper() {
        return developer;
    }

    /**
     * Gets sectionwide write database profile.
     *
     * @return DatabaseConfig instance.
     */
    public DatabaseConfig getDatabase() {
        return databases.getDatabase();
    }

    /**
     * Gets write database profiles by name.
     *
     * @return Immutable map.
     */
    public Map<String, DatabaseConfig> getWriteDatabases() {
        return databases.getWriteDatabases();
    }

    /**
     * Gets read database profile.
     *
     * @return DatabaseConfig instance.
     */
    public DatabaseConfig getReadDatabase() {
        return databases.getReadDatabase();
    }

    /**
     * Gets command processing section.
     *
     * @return CommandProcessingConfig instance.
     */
    public CommandProcessingConfig getCommandProcessing() {
        return commandProcessing;
    }

    /**
     * Gets service section.
     *
     * @return PuppetdbConfig instance.
     */
    public PuppetdbConfig getPuppetdb() {
        return puppetdb;
    }

    /**
     * Is open source product.
     *
     * @return Boolean.
     */
    public boolean isFoss() {
        return global.isFoss();
    }

    /**
     * Is enterprise product.
     *
     * @return Boolean.
     */
    public boolean isPe() {
        return global.isPe();
    }

    /**
     * Gets update check URL.
     *
     * @return URL string.
     */
    public String getUpdateServer() {
        return global.getUpdateServer();
    }

    /**
     * Gets command listener thread count.
     *
     * @return Thread count.
     */
    public int getMqThreadCount() {
        return commandProcessing.getThreads();
    }

    /**
     * Are oversized commands rejected.
     *
     * @return Boolean.
     */
    public boolean isRejectLargeCommands() {
        return commandProcessing.isRejectLargeCommands();
    }

    /**
     * Gets max command size.
     *
     * @return Size in bytes.
     */
    public long getMaxCommandSize() {
        return commandProcessing.getMaxCommandSize();
    }

    /**
     * Gets command spool directory.
     *
     * @return Path or null.
     */
    public String getStockpileDir() {
        return global.getStockpileDir();
    }

    /**
     * Gets all sections keyed by section name.
     * <p>Named write profiles appear as <code>database "name"</code>.
     *
     * @return Immutable map of section name to resolved settings.
     */
    public Map<String, Map<String, Object>> toMap() {
        Map<String, Map<String, Object>> sections = new LinkedHashMap<>();
        sections.put("global", global.getMap());
        sections.put("developer", developer.getMap());
        sections.put("database", getDatabase().getMap());
        getWriteDatabases().forEach((name, profile) -> {
            if (profile != getDatabase()) {
                sections.put("database \"" + name + "\"", profile.getMap());
            }
        });
        sections.put("read-database", getReadDatabase().getMap());
        sections.put("command-processing", commandProcessing.getMap());
        sections.put("puppetdb", puppetdb.getMap());
        return ImmutableMap.copyOf(sections);
    }
}
