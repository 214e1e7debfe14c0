package com.mimecast.pdbconf.main;

import com.mimecast.pdbconf.config.ResolvedConfig;

/**
 * Resolved configuration container.
 *
 * <p>Set once at startup and read by the services afterwards.
 *
 * @see ConfigResolver
 */
public class Config {

    /**
     * Protected constructor.
     */
    private Config() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Resolved configuration.
     */
    private static ResolvedConfig resolved;

    /**
     * Init resolved configuration.
     *
     * @param config Resolved configuration.
     * @throws IllegalStateException Already initialised.
     */
    public static synchronized void init(ResolvedConfig config) {
        if (resolved != null) {
            throw new IllegalStateException("Configuration already initialised");
        }
        resolved = config;
    }

    /**
     * Is initialised.
     *
     * @return Boolean.
     */
    public static synchronized boolean isInitialised() {
        return resolved != null;
    }

    /**
     * Gets resolved configuration.
     *
     * @return ResolvedConfig instance.
     * @throws IllegalStateException Not initialised.
     */
    public static synchronized ResolvedConfig get() {
        if (resolved == null) {
            throw new IllegalStateException("Configuration not initialised");
        }
        return resolved;
    }

    /**
     * Clears the resolved configuration.
     */
    static synchronized void clear() {
        resolved = null;
    }
}
