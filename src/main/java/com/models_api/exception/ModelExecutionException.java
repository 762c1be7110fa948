package com.models_api.exception;

/**
 * A model plugin failed while training or predicting.
 */
public class ModelExecutionException extends RuntimeException {

    public ModelExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
