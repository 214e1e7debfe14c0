package com.mimecast.pdbconf.config.server;

import com.mimecast.pdbconf.config.ConfigFoundation;

import java.util.Map;

/**
 * Developer configuration.
 */
public class DeveloperConfig extends ConfigFoundation {

    /**
     * Constructs a new DeveloperConfig instance.
     *
     * @param map Resolved section map.
     */
    public DeveloperConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Is JSON output pretty printed.
     *
     * @return Boolean.
     */
    public boolean isPrettyPrint() {
        return getBooleanProperty("pretty-print", false);
    }

    /**
     * Gets max enqueued commands.
     *
     * @return Limit.
     */
    public long getMaxEnqueued() {
        return getLongProperty("max-enqueued", 1000000L);
    }
}
