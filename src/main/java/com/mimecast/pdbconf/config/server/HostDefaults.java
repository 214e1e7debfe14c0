package com.mimecast.pdbconf.config.server;

/**
 * Host derived defaults.
 *
 * <p>Captured once at startup and handed to the schemas that need them.
 */
public class HostDefaults {

    /**
     * Heap divisor for the default max command size.
     * <p>The largest catalog processed without GC or out of memory errors in testing was 1/205 of the heap.
     */
    static final long MAX_COMMAND_SIZE_HEAP_DIVISOR = 205L;

    private final int cores;
    private final long maxMemory;

    /**
     * Constructs a new HostDefaults instance.
     *
     * @param cores     Available processors.
     * @param maxMemory Max heap in bytes.
     */
    public HostDefaults(int cores, long maxMemory) {
        this.cores = cores;
        this.maxMemory = maxMemory;
    }

    /**
     * Reads the current runtime.
     *
     * @return HostDefaults instance.
     */
    public static HostDefaults fromRuntime() {
        Runtime runtime = Runtime.getRuntime();
        return new HostDefaults(runtime.availableProcessors(), runtime.maxMemory());
    }

    /**
     * Half the cores, at least one.
     *
     * @return Thread count.
     */
    public long halfTheCores() {
        return Math.max(1, cores / 2);
    }

    /**
     * Concurrent writes default, half the cores capped at four.
     *
     * @return Writer count.
     */
    public long concurrentWrites() {
        return Math.min(halfTheCores(), 4);
    }

    /**
     * Max command size relative to the max heap.
     *
     * @return Size in bytes.
     */
    public long maxCommandSize() {
        return maxMemory / MAX_COMMAND_SIZE_HEAP_DIVISOR;
    }
}
