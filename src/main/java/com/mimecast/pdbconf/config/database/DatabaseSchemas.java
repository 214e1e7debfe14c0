package com.mimecast.pdbconf.config.database;

import com.mimecast.pdbconf.config.schema.SectionSchema;

import static com.mimecast.pdbconf.config.schema.Setting.defaulted;
import static com.mimecast.pdbconf.config.schema.Setting.optional;
import static com.mimecast.pdbconf.config.schema.Setting.required;
import static com.mimecast.pdbconf.config.schema.SettingTypes.*;

/**
 * Database profile schemas.
 *
 * <p>The plain schemas describe any connection profile, including a user supplied <code>[read-database]</code>.
 * <br>The write schemas add retention, garbage collection, migration and migrator credential keys.
 *
 * <p>All incoming keys are optional. Every resolved profile needs a <code>subname</code>;
 * {@link DatabaseResolver} checks it before conversion so the error names the section.
 */
public final class DatabaseSchemas {

    /**
     * Default report retention.
     */
    public static final String REPORT_TTL_DEFAULT = "14d";

    /**
     * Incoming plain profile.
     */
    public static final SectionSchema DATABASE_IN = SectionSchema.builder("database-in")
            .add(defaulted("conn-max-age", INTEGER, 60L))
            .add(optional("conn-lifetime", INTEGER))
            .add(defaulted("maximum-pool-size", INTEGER, 25L))
            .add(optional("subname", STRING))
            .add(optional("user", STRING))
            .add(optional("username", STRING))
            .add(optional("password", STRING))
            .add(optional("syntax_pgs", STRING))
            .add(defaulted("read-only?", BOOLEAN, "false"))
            .add(defaulted("partition-conn-min", INTEGER, 1L))
            .add(defaulted("partition-conn-max", INTEGER, 25L))
            .add(defaulted("partition-count", INTEGER, 1L))
            .add(defaulted("stats", BOOLEAN, "true"))
            .add(defaulted("log-statements", BOOLEAN, "true"))
            .add(defaulted("connection-timeout", INTEGER, 3000L))
            .add(optional("facts-blacklist", STRING_LIST))
            .add(defaulted("facts-blacklist-type", oneOf("literal", "regex"), "literal"))
            .add(defaulted("schema-check-interval", INTEGER, 30L * 1000))
            // Retired, accepted and ignored.
            .add(defaulted("classname", STRING, "org.postgresql.Driver"))
            .add(optional("conn-keep-alive", INTEGER))
            .add(optional("log-slow-statements", INTEGER))
            .add(optional("statements-cache-size", INTEGER))
            .add(defaulted("subprotocol", STRING, "postgresql"))
            .build();

    /**
     * Resolved plain profile.
     */
    public static final SectionSchema DATABASE_OUT = SectionSchema.builder("database-out")
            .add(required("subname", STRING))
            .add(required("conn-max-age", MINUTES))
            .add(required("read-only?", BOOLEAN))
            .add(required("partition-conn-min", INTEGER))
            .add(required("partition-conn-max", INTEGER))
            .add(required("partition-count", INTEGER))
            .add(required("stats", BOOLEAN))
            .add(required("log-statements", BOOLEAN))
            .add(required("connection-timeout", INTEGER))
            .add(required("maximum-pool-size", INTEGER))
            .add(optional("conn-lifetime", MINUTES))
            .add(optional("user", STRING))
            .add(optional("username", STRING))
            .add(optional("password", STRING))
            .add(optional("syntax_pgs", STRING))
            .add(optional("facts-blacklist", STRING_LIST))
            .add(required("facts-blacklist-type", oneOf("literal", "regex")))
            .add(required("schema-check-interval", INTEGER))
            .add(required("classname", STRING))
            .add(optional("conn-keep-alive", MINUTES))
            .add(optional("log-slow-statements", DAYS))
            .add(optional("statements-cache-size", INTEGER))
            .add(required("subprotocol", STRING))
            .build();

    /**
     * Incoming write profile.
     */
    public static final SectionSchema WRITE_DATABASE_IN = DATABASE_IN.extend("write-database-in")
            .add(defaulted("gc-interval", INTEGER, 60L))
            .add(defaulted("report-ttl", STRING, REPORT_TTL_DEFAULT))
            .add(defaulted("node-purge-ttl", STRING, "14d"))
            .add(defaulted("node-purge-gc-batch-limit", INTEGER, 25L))
            .add(defaulted("node-ttl", STRING, "7d"))
            .add(optional("resource-events-ttl", STRING))
            .add(defaulted("migrate", BOOLEAN, "true"))
            .add(optional("migrator-username", STRING))
            .add(optional("migrator-password", STRING))
            .build();

    /**
     * Resolved write profile.
     */
    public static final SectionSchema WRITE_DATABASE_OUT = DATABASE_OUT.extend("write-database-out")
            .add(required("gc-interval", MINUTES))
            .add(required("report-ttl", PERIOD))
            .add(required("node-purge-ttl", PERIOD))
            .add(required("node-purge-gc-batch-limit", INTEGER)
                    .constrained(value -> (Long) value >= 0, "must not be negative"))
            .add(required("node-ttl", PERIOD))
            .add(optional("resource-events-ttl", PERIOD))
            .add(required("migrate", BOOLEAN))
            .add(optional("migrator-username", STRING))
            .add(optional("migrator-password", STRING))
            .build();

    private DatabaseSchemas() {
        throw new IllegalStateException("Static class");
    }
}
