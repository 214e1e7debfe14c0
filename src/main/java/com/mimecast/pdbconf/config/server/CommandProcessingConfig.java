package com.mimecast.pdbconf.config.server;

import com.mimecast.pdbconf.config.ConfigFoundation;

import java.util.Map;

/**
 * Command processing configuration.
 *
 * <p>This class provides type safe access to the resolved <code>[command-processing]</code> section.
 */
public class CommandProcessingConfig extends ConfigFoundation {

    /**
     * Constructs a new CommandProcessingConfig instance.
     *
     * @param map Resolved section map.
     */
    public CommandProcessingConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Gets command processing thread count.
     *
     * @return Thread count.
     */
    public int getThreads() {
        return Math.toIntExact(getLongProperty("threads", 1L));
    }

    /**
     * Gets max command size.
     *
     * @return Size in bytes.
     */
    public long getMaxCommandSize() {
        return getLongProperty("max-command-size", 0L);
    }

    /**
     * Are commands over the max size rejected.
     *
     * @return Boolean.
     */
    public boolean isRejectLargeCommands() {
        return getBooleanProperty("reject-large-commands", false);
    }

    /**
     * Gets concurrent writer count.
     *
     * @return Writer count.
     */
    public int getConcurrentWrites() {
        return Math.toIntExact(getLongProperty("concurrent-writes", 1L));
    }
}
