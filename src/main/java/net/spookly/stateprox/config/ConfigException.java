package net.spookly.stateprox.config;

/**
 * Raised when configuration cannot be read, bound or validated.
 */
public class ConfigException extends RuntimeException {
    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
