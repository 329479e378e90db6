package net.eventmail.core.error;

/**
 * Malformed setting or parameter schema. Stops the process only when raised at startup;
 * raised mid-tick it fails the row that carries the bad definition.
 */
public class ConfigurationException extends EventMailException {
    public ConfigurationException(String message) { super(message); }
}
