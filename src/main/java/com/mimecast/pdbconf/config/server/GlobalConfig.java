package com.mimecast.pdbconf.config.server;

import com.mimecast.pdbconf.config.ConfigFoundation;

import java.io.File;
import java.util.Map;

/**
 * Global configuration.
 *
 * <p>This class provides type safe access to the resolved <code>[global]</code> section.
 * <p>Keys other than the product identity and update server pass through unchanged.
 */
public class GlobalConfig extends ConfigFoundation {

    /**
     * Open source product name.
     */
    public static final String FOSS = "puppetdb";

    /**
     * Enterprise product name.
     */
    public static final String PE = "pe-puppetdb";

    /**
     * Default update check URL.
     */
    public static final String DEFAULT_UPDATE_SERVER = "https://updates.puppetlabs.com/check-for-updates";

    /**
     * Constructs a new GlobalConfig instance.
     *
     * @param map Resolved section map.
     */
    public GlobalConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Gets working directory.
     *
     * @return Path or null.
     */
    public String getVardir() {
        return getStringProperty("vardir");
    }

    /**
     * Gets command spool directory under the working directory.
     *
     * @return Path or null when no vardir is set.
     */
    public String getStockpileDir() {
        String vardir = getVardir();
        return vardir == null ? null : new File(vardir, "stockpile").getPath();
    }

    /**
     * Gets product name.
     *
     * @return Lower case product name.
     */
    public String getProductName() {
        return getStringProperty("product-name", FOSS);
    }

    /**
     * Gets update check URL.
     *
     * @return URL string.
     */
    public String getUpdateServer() {
        return getStringProperty("update-server", DEFAULT_UPDATE_SERVER);
    }

    /**
     * Is open source product.
     *
     * @return Boolean.
     */
    public boolean isFoss() {
        return FOSS.equals(getProductName());
    }

    /**
     * Is enterprise product.
     *
     * @return Boolean.
     */
    public boolean isPe() {
        return PE.equals(getProductName());
    }
}
