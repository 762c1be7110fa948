package com.models_api.exception;

/**
 * The task broker or its result backend could not be reached.
 */
public class BrokerException extends RuntimeException {

    public BrokerException(String message, Throwable cause) {
        super(message, cause);
    }
}
