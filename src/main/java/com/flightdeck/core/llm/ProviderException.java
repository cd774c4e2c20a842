package com.flightdeck.core.llm;

/**
 * A model backend failed: unreachable endpoint, HTTP error, broken or stalled stream.
 * Fatal for the agent run that hit it; never retried by the engine.
 */
public class ProviderException extends RuntimeException {

    public ProviderException(String message) {
        super(message);
    }

    public ProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
