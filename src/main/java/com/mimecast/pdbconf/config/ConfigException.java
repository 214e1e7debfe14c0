package com.mimecast.pdbconf.config;

/**
 * Configuration resolution failure.
 *
 * <p>Raised synchronously by every resolution step and never recovered from inside the engine.
 * <p>The {@link Kind} tag tells callers and tests which class of problem was found.
 */
public class ConfigException extends RuntimeException {

    /**
     * Failure categories.
     */
    public enum Kind {
        /**
         * Malformed section header.
         */
        GRAMMAR,

        /**
         * Duplicate section or subsection.
         */
        STRUCTURE,

        /**
         * Missing required key or value of the wrong coarse type.
         */
        SCHEMA,

        /**
         * Value cannot be converted or violates a constraint.
         */
        CONVERSION,

        /**
         * Cross-field or internal invariant broken.
         */
        INVARIANT
    }

    private final Kind kind;

    /**
     * Constructs a new ConfigException.
     *
     * @param kind    Failure category.
     * @param message Human readable message.
     */
    public ConfigException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    /**
     * Constructs a new ConfigException with cause.
     *
     * @param kind    Failure category.
     * @param message Human readable message.
     * @param cause   Underlying cause.
     */
    public ConfigException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    /**
     * Gets failure category.
     *
     * @return Kind.
     */
    public Kind getKind() {
        return kind;
    }
}
