package com.bookingchart.defrag.exception;

/**
 * The store failed mid-operation. The enclosing unit of work has already been rolled back.
 */
public class PersistenceException extends RuntimeException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
