package com.models_api.exception;

/**
 * Raised when a model already has an active task, or a task is not in a state that allows the request.
 */
public class ConflictException extends RuntimeException {

    public ConflictException(String message) {
        super(message);
    }
}
