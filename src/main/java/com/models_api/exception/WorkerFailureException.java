package com.models_api.exception;

import lombok.Getter;

/**
 * Wraps whatever a worker-side operation raised. It never reaches the submitter: the worker
 * records its message as the task's failure payload.
 */
@Getter
public class WorkerFailureException extends RuntimeException {

    private final String taskId;

    public WorkerFailureException(String taskId, Throwable cause) {
        super(describe(cause), cause);
        this.taskId = taskId;
    }

    private static String describe(Throwable cause) {
        String message = cause.getMessage();
        return message == null || message.isBlank()
                ? cause.getClass().getSimpleName()
                : cause.getClass().getSimpleName() + ": " + message;
    }
}
