package com.mimecast.pdbconf.main;

import com.google.common.collect.ImmutableList;
import com.mimecast.pdbconf.config.ConfigException;
import com.mimecast.pdbconf.config.ResolvedConfig;
import com.mimecast.pdbconf.config.database.DatabaseResolver;
import com.mimecast.pdbconf.config.database.DatabaseSection;
import com.mimecast.pdbconf.config.schema.SectionConverter;
import com.mimecast.pdbconf.config.section.Settings;
import com.mimecast.pdbconf.config.server.CommandProcessingConfig;
import com.mimecast.pdbconf.config.server.DeveloperConfig;
import com.mimecast.pdbconf.config.server.GlobalConfig;
import com.mimecast.pdbconf.config.server.HostDefaults;
import com.mimecast.pdbconf.config.server.PuppetdbConfig;
import com.mimecast.pdbconf.config.server.ServiceSchemas;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Resolves a raw configuration document.
 *
 * <p>Order: retirement check, [global], [developer], database sections, [command-processing], [puppetdb].
 * <br>The first invalid setting stops resolution with a {@link ConfigException}.
 *
 * @see DatabaseResolver
 * @see Retirements
 */
public class ConfigResolver {
    private static final Logger log = LogManager.getLogger(ConfigResolver.class);

    private static final List<String> DEPRECATED_COMMAND_SETTINGS =
            ImmutableList.of("store-usage", "max-frame-size", "temp-usage", "memory-usage");

    private final HostDefaults host;

    /**
     * Constructs a new ConfigResolver with runtime host defaults.
     */
    public ConfigResolver() {
        this(HostDefaults.fromRuntime());
    }

    /**
     * Constructs a new ConfigResolver.
     *
     * @param host Host defaults.
     */
    public ConfigResolver(HostDefaults host) {
        this.host = host;
    }

    /**
     * Resolves a document.
     *
     * @param document Raw document.
     * @return Resolution instance.
     * @throws ConfigException On any invalid setting.
     */
    public Resolution resolve(Map<String, Object> document) {
        Retirements retirements = Retirements.check(document);
        if (retirements.isFatal()) {
            return Resolution.fatal(retirements);
        }

        GlobalConfig global = new GlobalConfig(configureGlobals(Settings.of("global", document.get("global"))));

        DeveloperConfig developer = new DeveloperConfig(SectionConverter.convert("developer",
                ServiceSchemas.DEVELOPER_IN, ServiceSchemas.DEVELOPER_OUT,
                Settings.of("developer", document.get("developer"))));

        DatabaseSection databases = DatabaseResolver.resolve(document);

        Map<String, Object> commandSettings = Settings.of("command-processing", document.get("command-processing"));
        warnDeprecatedCommandSettings(commandSettings);
        CommandProcessingConfig commandProcessing = new CommandProcessingConfig(SectionConverter.convert(
                "command-processing", ServiceSchemas.commandProcessingIn(host), ServiceSchemas.COMMAND_PROCESSING_OUT,
                commandSettings));

        PuppetdbConfig puppetdb = new PuppetdbConfig(SectionConverter.convert("puppetdb",
                ServiceSchemas.PUPPETDB_IN, ServiceSchemas.PUPPETDB_OUT,
                Settings.of("puppetdb", document.get("puppetdb"))));

        log.debug("Resolved configuration for {}", global.getProductName());
        return Resolution.of(new ResolvedConfig(global, developer, databases, commandProcessing, puppetdb), retirements);
    }

    /**
     * Defaults and normalises the global settings.
     *
     * @param global Raw global settings.
     * @return Global settings.
     * @throws ConfigException SCHEMA on an unknown product name.
     */
    static Map<String, Object> configureGlobals(Map<String, Object> global) {
        global.putIfAbsent("product-name", GlobalConfig.FOSS);
        global.put("product-name", normalizeProductName(global.get("product-name")));
        global.putIfAbsent("update-server", GlobalConfig.DEFAULT_UPDATE_SERVER);
        return global;
    }

    /**
     * Warns about deprecated command processing settings still in use.
     * <p>They are resolved but have no effect.
     *
     * @param settings Raw command processing settings.
     */
    static void warnDeprecatedCommandSettings(Map<String, Object> settings) {
        for (String key : DEPRECATED_COMMAND_SETTINGS) {
            if (settings.get(key) != null) {
                log.warn("The configuration item `{}` in the [command-processing] section is retired, "
                        + "please remove this item from your config. Consult the documentation for more details.", key);
            }
        }
    }

    private static String normalizeProductName(Object productName) {
        if (!(productName instanceof String)) {
            throw new ConfigException(ConfigException.Kind.SCHEMA, "product-name " + productName + " must be a string");
        }
        String lower = ((String) productName).toLowerCase(Locale.ROOT);
        if (!GlobalConfig.FOSS.equals(lower) && !GlobalConfig.PE.equals(lower)) {
            throw new ConfigException(ConfigException.Kind.SCHEMA, "product-name " + productName
                    + " is illegal; either " + GlobalConfig.FOSS + " or " + GlobalConfig.PE + " are allowed");
        }
        return lower;
    }
}
