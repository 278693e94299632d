package com.releasewatch.watchers.api;

/**
 * Upstream could not be read. The status code is 0 when no HTTP response was received.
 */
public class FetchException extends Exception {
    private final int statusCode;

    public FetchException(String message) {
        this(message, 0, null);
    }

    public FetchException(String message, Throwable cause) {
        this(message, 0, cause);
    }

    public FetchException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public int statusCode() {
        return statusCode;
    }
}
