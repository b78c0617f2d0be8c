package com.bookingchart.defrag.exception;

/**
 * A holiday calendar source failed, timed out or returned data we could not read.
 * Never escapes the holiday layer.
 */
public class UpstreamUnavailableException extends RuntimeException {

    public UpstreamUnavailableException(String message) {
        super(message);
    }

    public UpstreamUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
