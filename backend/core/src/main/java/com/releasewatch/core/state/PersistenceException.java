package com.releasewatch.core.state;

public class PersistenceException extends IllegalStateException {
    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
