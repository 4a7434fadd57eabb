package com.example.punchsync.store;

/**
 * The attendance database could not be reached or rejected a statement for a reason other
 * than a duplicate punch.
 */
public class StoreException extends RuntimeException {
    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
