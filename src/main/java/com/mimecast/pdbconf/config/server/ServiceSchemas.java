package com.mimecast.pdbconf.config.server;

import com.mimecast.pdbconf.config.schema.SectionSchema;

import static com.mimecast.pdbconf.config.schema.Setting.defaulted;
import static com.mimecast.pdbconf.config.schema.Setting.optional;
import static com.mimecast.pdbconf.config.schema.Setting.required;
import static com.mimecast.pdbconf.config.schema.SettingTypes.BOOLEAN;
import static com.mimecast.pdbconf.config.schema.SettingTypes.INTEGER;
import static com.mimecast.pdbconf.config.schema.SettingTypes.STRING;

/**
 * Schemas of the service sections.
 */
public final class ServiceSchemas {

    /**
     * Incoming [puppetdb].
     */
    public static final SectionSchema PUPPETDB_IN = SectionSchema.builder("puppetdb-in")
            .add(optional("certificate-whitelist", STRING))
            .add(defaulted("historical-catalogs-limit", INTEGER, 0L))
            .add(defaulted("disable-update-checking", BOOLEAN, "false"))
            .add(defaulted("add-agent-report-filter", BOOLEAN, "true"))
            .build();

    /**
     * Resolved [puppetdb].
     */
    public static final SectionSchema PUPPETDB_OUT = SectionSchema.builder("puppetdb-out")
            .add(optional("certificate-whitelist", STRING))
            .add(required("historical-catalogs-limit", INTEGER))
            .add(required("disable-update-checking", BOOLEAN))
            .add(required("add-agent-report-filter", BOOLEAN))
            .build();

    /**
     * Incoming [developer].
     */
    public static final SectionSchema DEVELOPER_IN = SectionSchema.builder("developer-in")
            .add(defaulted("pretty-print", BOOLEAN, "false"))
            .add(defaulted("max-enqueued", INTEGER, 1000000L))
            .build();

    /**
     * Resolved [developer].
     */
    public static final SectionSchema DEVELOPER_OUT = SectionSchema.builder("developer-out")
            .add(required("pretty-print", BOOLEAN))
            .add(required("max-enqueued", INTEGER))
            .build();

    /**
     * Resolved [command-processing].
     */
    public static final SectionSchema COMMAND_PROCESSING_OUT = SectionSchema.builder("command-processing-out")
            .add(required("threads", INTEGER))
            .add(required("max-command-size", INTEGER))
            .add(required("reject-large-commands", BOOLEAN))
            .add(required("concurrent-writes", INTEGER))
            // Deprecated.
            .add(required("max-frame-size", INTEGER))
            .add(optional("memory-usage", INTEGER))
            .add(optional("store-usage", INTEGER))
            .add(optional("temp-usage", INTEGER))
            .build();

    private ServiceSchemas() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Incoming [command-processing] with host derived defaults.
     *
     * @param host Host defaults.
     * @return SectionSchema instance.
     */
    public static SectionSchema commandProcessingIn(HostDefaults host) {
        return SectionSchema.builder("command-processing-in")
                .add(defaulted("threads", INTEGER, () -> host.halfTheCores()))
                .add(defaulted("max-command-size", INTEGER, () -> host.maxCommandSize()))
                .add(defaulted("reject-large-commands", BOOLEAN, "false"))
                .add(defaulted("concurrent-writes", INTEGER, () -> host.concurrentWrites()))
                // Deprecated.
                .add(defaulted("max-frame-size", INTEGER, 209715200L))
                .add(optional("store-usage", INTEGER))
                .add(optional("temp-usage", INTEGER))
                .add(optional("memory-usage", INTEGER))
                .build();
    }
}
