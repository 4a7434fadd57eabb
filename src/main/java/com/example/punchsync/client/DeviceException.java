package com.example.punchsync.client;

import java.io.IOException;

/**
 * Failure talking to a terminal. Both subtypes are retried by the worker with backoff.
 */
public abstract class DeviceException extends IOException {
    protected DeviceException(String message) {
        super(message);
    }

    protected DeviceException(String message, Throwable cause) {
        super(message, cause);
    }
}
