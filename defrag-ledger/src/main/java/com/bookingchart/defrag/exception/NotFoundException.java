package com.bookingchart.defrag.exception;

/**
 * A referenced property, batch or move does not exist.
 */
public class NotFoundException extends RuntimeException {

    public NotFoundException(String message) {
        super(message);
    }

    public static NotFoundException property(String propertyCode) {
        return new NotFoundException("Property not found: " + propertyCode);
    }

    public static NotFoundException batch(long batchId) {
        return new NotFoundException("Batch not found: " + batchId);
    }

    public static NotFoundException move(long moveId) {
        return new NotFoundException("Move not found: " + moveId);
    }
}
