package com.mimecast.pdbconf.config.database;

import com.mimecast.pdbconf.config.ConfigFoundation;
import org.joda.time.Days;
import org.joda.time.Minutes;
import org.joda.time.Period;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Database profile configuration.
 *
 * <p>This class provides type safe access to one resolved database profile.
 * <p>Write-only settings are absent from read profiles, so their accessors return optionals.
 */
public class DatabaseConfig extends ConfigFoundation {

    private final List<Pattern> factsBlacklistPatterns;

    /**
     * Constructs a new DatabaseConfig instance.
     * <p>The facts blacklist is compiled here, once per profile.
     *
     * @param section Section label for messages, e.g. <code>database "primary"</code>.
     * @param map     Resolved profile map.
     * @throws com.mimecast.pdbconf.config.ConfigException CONVERSION when a regex blacklist entry does not compile.
     */
    public DatabaseConfig(String section, Map<String, Object> map) {
        super(map);
        this.factsBlacklistPatterns = FactsBlacklist.compile(section, this.map);
    }

    /**
     * Gets JDBC subname.
     *
     * @return Subname, e.g. <code>//localhost:5432/puppetdb</code>.
     */
    public String getSubname() {
        return getStringProperty("subname");
    }

    /**
     * Gets user.
     *
     * @return User or null.
     */
    public String getUser() {
        return getStringProperty("user");
    }

    /**
     * Gets username.
     * <p>Always equal to {@link #getUser()} on write profiles.
     *
     * @return Username or null.
     */
    public String getUsername() {
        return getStringProperty("username");
    }

    /**
     * Gets password.
     *
     * @return Password or null.
     */
    public String getPassword() {
        return getStringProperty("password");
    }

    /**
     * Gets migrator username.
     *
     * @return Optional of migrator username.
     */
    public Optional<String> getMigratorUsername() {
        return getTypedProperty("migrator-username", String.class);
    }

    /**
     * Gets migrator password.
     *
     * @return Optional of migrator password.
     */
    public Optional<String> getMigratorPassword() {
        return getTypedProperty("migrator-password", String.class);
    }

    /**
     * Is read only.
     *
     * @return Boolean.
     */
    public boolean isReadOnly() {
        return getBooleanProperty("read-only?", false);
    }

    /**
     * Gets maximum connection age.
     *
     * @return Minutes.
     */
    public Minutes getConnMaxAge() {
        return getMinutesProperty("conn-max-age").orElse(Minutes.minutes(60));
    }

    /**
     * Gets connection lifetime.
     *
     * @return Optional of Minutes.
     */
    public Optional<Minutes> getConnLifetime() {
        return getMinutesProperty("conn-lifetime");
    }

    /**
     * Gets maximum pool size.
     *
     * @return Pool size.
     */
    public int getMaximumPoolSize() {
        return Math.toIntExact(getLongProperty("maximum-pool-size", 25L));
    }

    /**
     * Gets partition minimum connections.
     *
     * @return Connection count.
     */
    public int getPartitionConnMin() {
        return Math.toIntExact(getLongProperty("partition-conn-min", 1L));
    }

    /**
     * Gets partition maximum connections.
     *
     * @return Connection count.
     */
    public int getPartitionConnMax() {
        return Math.toIntExact(getLongProperty("partition-conn-max", 25L));
    }

    /**
     * Gets partition count.
     *
     * @return Partition count.
     */
    public int getPartitionCount() {
        return Math.toIntExact(getLongProperty("partition-count", 1L));
    }

    /**
     * Are pool statistics enabled.
     *
     * @return Boolean.
     */
    public boolean isStats() {
        return getBooleanProperty("stats", true);
    }

    /**
     * Is statement logging enabled.
     *
     * @return Boolean.
     */
    public boolean isLogStatements() {
        return getBooleanProperty("log-statements", true);
    }

    /**
     * Gets connection timeout.
     *
     * @return Timeout in milliseconds.
     */
    public long getConnectionTimeout() {
        return getLongProperty("connection-timeout", 3000L);
    }

    /**
     * Gets schema check interval.
     *
     * @return Interval in milliseconds.
     */
    public long getSchemaCheckInterval() {
        return getLongProperty("schema-check-interval", 30000L);
    }

    /**
     * Gets facts blacklist entries.
     *
     * @return List of entries.
     */
    public List<String> getFactsBlacklist() {
        return getListProperty("facts-blacklist");
    }

    /**
     * Gets facts blacklist type.
     *
     * @return <code>literal</code> or <code>regex</code>.
     */
    public String getFactsBlacklistType() {
        return getStringProperty("facts-blacklist-type", "literal");
    }

    /**
     * Gets facts blacklist as patterns.
     *
     * @return Immutable list of patterns.
     */
    public List<Pattern> getFactsBlacklistPatterns() {
        return factsBlacklistPatterns;
    }

    /**
     * Gets garbage collection interval.
     *
     * @return Optional of Minutes, empty on read profiles.
     */
    public Optional<Minutes> getGcInterval() {
        return getMinutesProperty("gc-interval");
    }

    /**
     * Gets report retention.
     *
     * @return Optional of Period, empty on read profiles.
     */
    public Optional<Period> getReportTtl() {
        return getPeriodProperty("report-ttl");
    }

    /**
     * Gets resource events retention.
     *
     * @return Optional of Period, empty on read profiles.
     */
    public Optional<Period> getResourceEventsTtl() {
        return getPeriodProperty("resource-events-ttl");
    }

    /**
     * Gets node deactivation period.
     *
     * @return Optional of Period, empty on read profiles.
     */
    public Optional<Period> getNodeTtl() {
        return getPeriodProperty("node-ttl");
    }

    /**
     * Gets node purge period.
     *
     * @return Optional of Period, empty on read profiles.
     */
    public Optional<Period> getNodePurgeTtl() {
        return getPeriodProperty("node-purge-ttl");
    }

    /**
     * Gets node purge batch limit.
     *
     * @return Optional of limit, empty on read profiles.
     */
    public Optional<Long> getNodePurgeGcBatchLimit() {
        return getTypedProperty("node-purge-gc-batch-limit", Long.class);
    }

    /**
     * Should schema migrations run.
     *
     * @return Boolean.
     */
    public boolean isMigrate() {
        return getBooleanProperty("migrate", false);
    }

    /**
     * Gets slow statement logging threshold, retired.
     *
     * @return Optional of Days.
     */
    public Optional<Days> getLogSlowStatements() {
        return getDaysProperty("log-slow-statements");
    }
}
