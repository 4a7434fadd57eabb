package com.example.punchsync.service;

/**
 * A device record that cannot be turned into a punch. Only that record is dropped.
 */
public class RecordValidationException extends IllegalArgumentException {
    public RecordValidationException(String message) {
        super(message);
    }
}
