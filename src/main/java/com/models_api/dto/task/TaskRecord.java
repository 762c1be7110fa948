package com.models_api.dto.task;

import com.models_api.enumeration.ModelOperationEnum;
import com.models_api.enumeration.status.TaskStatusEnum;
import lombok.Builder;
import lombok.Value;

import java.time.ZonedDateTime;

/**
 * Orchestrator-side view of the task currently tracked for a model.
 * Immutable; refreshing from the broker produces a new record.
 */
@Value
@Builder(toBuilder = true)
public class TaskRecord {

    String taskId;
    String modelName;
    ModelOperationEnum operation;
    TaskStatusEnum status;
    ZonedDateTime startedAt;
    ZonedDateTime finishedAt;
    Object result;
    String error;

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public TaskRecord refreshedFrom(TaskResult result) {
        return toBuilder()
                .status(result.status())
                .finishedAt(result.finishedAt())
                .result(result.result())
                .error(result.error())
                .build();
    }

    public static TaskRecord adopt(TaskResult result) {
        return TaskRecord.builder()
                .taskId(result.taskId())
                .modelName(result.modelName())
                .operation(result.operation())
                .status(result.status())
                .startedAt(result.submittedAt())
                .finishedAt(result.finishedAt())
                .result(result.result())
                .error(result.error())
                .build();
    }
}
