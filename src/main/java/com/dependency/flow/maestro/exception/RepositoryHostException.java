package com.dependency.flow.maestro.exception;

/**
 * The repository host was unreachable or rejected a call.
 */
public class RepositoryHostException extends RuntimeException {

    public RepositoryHostException(String message) {
        super(message);
    }

    public RepositoryHostException(String message, Throwable cause) {
        super(message, cause);
    }
}
