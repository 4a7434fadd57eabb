package com.example.punchsync.config;

/**
 * Invalid or unreadable configuration. Only raised at startup, before any worker runs.
 */
public class ConfigException extends RuntimeException {
    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
