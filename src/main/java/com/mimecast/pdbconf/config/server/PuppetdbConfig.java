package com.mimecast.pdbconf.config.server;

import com.mimecast.pdbconf.config.ConfigFoundation;

import java.util.Map;
import java.util.Optional;

/**
 * Service configuration.
 *
 * <p>This class provides type safe access to the resolved <code>[puppetdb]</code> section.
 */
public class PuppetdbConfig extends ConfigFoundation {

    /**
     * Constructs a new PuppetdbConfig instance.
     *
     * @param map Resolved section map.
     */
    public PuppetdbConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Gets certificate whitelist file path.
     *
     * @return Optional of path.
     */
    public Optional<String> getCertificateWhitelist() {
        return getTypedProperty("certificate-whitelist", String.class);
    }

    /**
     * Gets number of historical catalogs kept per node.
     *
     * @return Limit, 0 keeps none.
     */
    public long getHistoricalCatalogsLimit() {
        return getLongProperty("historical-catalogs-limit", 0L);
    }

    /**
     * Is update checking disabled.
     *
     * @return Boolean.
     */
    public boolean isDisableUpdateChecking() {
        return getBooleanProperty("disable-update-checking", false);
    }

    /**
     * Is the agent report filter added.
     *
     * @return Boolean.
     */
    public boolean isAddAgentReportFilter() {
        return getBooleanProperty("add-agent-report-filter", true);
    }
}
