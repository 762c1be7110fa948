package com.models_api.exception;


public class TaskCancelledException extends RuntimeException {

    public TaskCancelledException() {
        super("Operation stopped by cancellation request.");
    }

    public TaskCancelledException(String message) {
        super(message);
    }
}
