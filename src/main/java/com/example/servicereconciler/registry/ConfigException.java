package com.example.servicereconciler.registry;

/**
 * The service registry is unusable: unreadable, malformed, or its dependency graph is invalid.
 * Fatal at startup; on an explicit reload the previous registry stays in effect.
 */
public class ConfigException extends RuntimeException {

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
