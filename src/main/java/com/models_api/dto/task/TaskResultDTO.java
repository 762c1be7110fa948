package com.models_api.dto.task;

import com.models_api.enumeration.status.TaskStatusEnum;

public record TaskResultDTO(
        String taskId,
        TaskStatusEnum status,
        Object result,
        String error
) {}
