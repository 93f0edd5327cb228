package com.dependency.flow.maestro.exception;

/**
 * The branch synchronization service was unreachable or rejected a request.
 */
public class CodeFlowServiceException extends RuntimeException {

    public CodeFlowServiceException(String message) {
        super(message);
    }

    public CodeFlowServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
