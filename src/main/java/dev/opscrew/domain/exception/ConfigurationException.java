package dev.opscrew.domain.exception;

/**
 * Thrown while wiring the crew when required setup is missing or inconsistent:
 * no model credentials, duplicate capability names, an unknown coordinator.
 * Never thrown from inside a running loop.
 */
public class ConfigurationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
