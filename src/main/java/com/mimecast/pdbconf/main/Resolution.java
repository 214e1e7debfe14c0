package com.mimecast.pdbconf.main;

import com.mimecast.pdbconf.config.ResolvedConfig;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of resolving a configuration document.
 *
 * <p>Holds the resolved configuration, or the fatal retirement issues that stopped resolution.
 * <br>Callers must check {@link #isFatal()} and halt startup when set.
 */
public class Resolution {

    private final ResolvedConfig config;
    private final Retirements retirements;

    private Resolution(ResolvedConfig config, Retirements retirements) {
        this.config = config;
        this.retirements = retirements;
    }

    /**
     * Successful resolution.
     *
     * @param config      Resolved configuration.
     * @param retirements Retirement report.
     * @return Resolution instance.
     */
    static Resolution of(ResolvedConfig config, Retirements retirements) {
        return new Resolution(config, retirements);
    }

    /**
     * Resolution stopped by fatal retirements.
     *
     * @param retirements Retirement report.
     * @return Resolution instance.
     */
    static Resolution fatal(Retirements retirements) {
        return new Resolution(null, retirements);
    }

    /**
     * Gets resolved configuration.
     *
     * @return Optional of ResolvedConfig, empty when fatal.
     */
    public Optional<ResolvedConfig> getConfig() {
        return Optional.ofNullable(config);
    }

    /**
     * Must startup stop.
     *
     * @return Boolean.
     */
    public boolean isFatal() {
        return retirements.isFatal();
    }

    /**
     * Gets fatal issues.
     *
     * @return List of messages.
     */
    public List<String> getFatalIssues() {
        return retirements.getFatalIssues();
    }

    /**
     * Gets retirement warnings.
     *
     * @return List of messages.
     */
    public List<String> getWarnings() {
        return retirements.getWarnings();
    }
}
