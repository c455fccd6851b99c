package net.spookly.appurls.config;

/**
 * Raised for unreadable, invalid or missing configuration.
 */
public class ConfigException extends RuntimeException {
    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
