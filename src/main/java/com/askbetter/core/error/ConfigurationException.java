package com.askbetter.core.error;

/**
 * Missing or invalid credentials or service settings, detected at startup.
 */
public class ConfigurationException extends ReviewException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.CONFIGURATION;
    }
}
