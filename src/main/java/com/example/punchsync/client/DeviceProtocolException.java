package com.example.punchsync.client;

/**
 * The terminal answered, but not with something we understand.
 */
public class DeviceProtocolException extends DeviceException {
    public DeviceProtocolException(String message) {
        super(message);
    }

    public DeviceProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
