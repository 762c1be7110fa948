package com.models_api.dto.task;

import com.models_api.enumeration.ModelOperationEnum;
import com.models_api.enumeration.status.TaskStatusEnum;

import java.time.ZonedDateTime;

/**
 * State of a task as stored by the result backend.
 */
public record TaskResult(
        String taskId,
        String modelName,
        ModelOperationEnum operation,
        TaskStatusEnum status,
        ZonedDateTime submittedAt,
        ZonedDateTime finishedAt,
        Object result,
        String error
) {}
