package com.cardroll.common.exception;

/**
 * Thrown when catalog or pack type data is internally inconsistent.
 *
 * Fatal when raised while the application context starts. If it ever surfaces
 * while serving a request it is reported as a server fault and not retried.
 */
public class ConfigurationException extends CardRollException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
