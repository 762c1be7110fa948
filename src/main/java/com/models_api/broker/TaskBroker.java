package com.models_api.broker;

import com.models_api.dto.task.TaskPayload;
import com.models_api.dto.task.TaskResult;
import com.models_api.enumeration.ModelOperationEnum;

import java.util.Optional;

/**
 * Task queue plus result backend as seen by the orchestrator.
 *
 * <p>Implementations throw {@link com.models_api.exception.BrokerException} when the backend is
 * unreachable.</p>
 */
public interface TaskBroker {

    /**
     * Enqueues a task in state {@code NOT_PROCESSED} and returns its id without waiting.
     */
    String submit(String modelName, ModelOperationEnum operation, TaskPayload payload, int priority);

    /**
     * @throws com.models_api.exception.NotFoundException when no task has this id
     */
    TaskResult getResult(String taskId);

    /**
     * Requests cooperative cancellation. A task nobody has claimed yet is cancelled at once.
     */
    void revoke(String taskId);

    Optional<TaskResult> findLatest(String modelName);
}
