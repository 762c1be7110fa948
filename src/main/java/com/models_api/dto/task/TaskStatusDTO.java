package com.models_api.dto.task;

import com.models_api.enumeration.ModelOperationEnum;
import com.models_api.enumeration.status.TaskStatusEnum;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.ZonedDateTime;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class TaskStatusDTO {

    private String taskId;
    private String modelName;
    private ModelOperationEnum operation;
    private TaskStatusEnum status;
    private ZonedDateTime startedAt;
    private ZonedDateTime finishedAt;
    private String error;
    // true once polling can stop
    private boolean terminal;
}
