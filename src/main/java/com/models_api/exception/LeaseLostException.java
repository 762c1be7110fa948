package com.models_api.exception;

/**
 * Raised at a checkpoint when the task's row is no longer PROCESSING, typically because its
 * lease expired. The task must stop without writing anything.
 */
public class LeaseLostException extends RuntimeException {

    public LeaseLostException(String taskId) {
        super("Task " + taskId + " is no longer processing; its lease was lost");
    }
}
