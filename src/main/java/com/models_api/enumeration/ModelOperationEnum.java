package com.models_api.enumeration;

/**
 * Operations a background task can run against a single model.
 * {@link #OUTPUT} is the only one that leaves the stored artifact untouched.
 */
public enum ModelOperationEnum {
    INPUT,
    OUTPUT,
    UPDATE,
    DELETE,
    INPUT_DB,
    UPDATE_DB
}
