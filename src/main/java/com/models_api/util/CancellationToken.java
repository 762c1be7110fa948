package com.models_api.util;

import com.models_api.exception.TaskCancelledException;

/**
 * Cooperative cancellation passed into worker-side operations. Operations call
 * {@link #checkpoint(String)} between steps; an implementation throws
 * {@link TaskCancelledException} once cancellation has been requested.
 */
@FunctionalInterface
public interface CancellationToken {

    CancellationToken NONE = step -> { };

    void checkpoint(String step);
}
