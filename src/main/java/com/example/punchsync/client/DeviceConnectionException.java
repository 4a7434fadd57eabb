package com.example.punchsync.client;

/**
 * Transport-level failure: connection refused, timed out or reset.
 */
public class DeviceConnectionException extends DeviceException {
    public DeviceConnectionException(String message) {
        super(message);
    }

    public DeviceConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
