package de.bsommerfeld.mindshare.core.config;

/**
 * Thrown when the configuration is missing, unreadable or invalid. Always
 * fatal: the job stops before touching the store.
 */
public class ConfigurationException extends Exception {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
