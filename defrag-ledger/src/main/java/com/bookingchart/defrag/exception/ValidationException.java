package com.bookingchart.defrag.exception;

/**
 * Malformed input to a batch or move operation. Raised before any state change.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }
}
