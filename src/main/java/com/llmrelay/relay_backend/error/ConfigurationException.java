package com.llmrelay.relay_backend.error;

/** A required credential or setting was missing when a provider was constructed. Never retried. */
public class ConfigurationException extends ProviderException {

    public ConfigurationException(String message) {
        super(ErrorKind.CONFIGURATION, message);
    }
}
