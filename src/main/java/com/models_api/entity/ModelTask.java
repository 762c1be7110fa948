package com.models_api.entity;

import com.models_api.enumeration.ModelOperationEnum;
import com.models_api.enumeration.status.TaskStatusEnum;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.ZonedDateTime;

/**
 * One unit of background work. The {@code model_task} table is the queue workers claim from and
 * the store the orchestrator reads results back from.
 */
@Entity
@Table(name = "model_task", indexes = {
        @Index(name = "idx_model_task_status", columnList = "status, priority, submittedAt"),
        @Index(name = "idx_model_task_model", columnList = "modelName, submittedAt")
})
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
@ToString(exclude = {"payload", "result"})
public class ModelTask {

    @Id
    private String taskId;

    @Column(nullable = false)
    private String modelName;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ModelOperationEnum operation;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private TaskStatusEnum status; // NOT_PROCESSED, PROCESSING, SUCCESS, FAILURE, CANCELLED

    private int priority;

    // JSON
    @Column(length = 1_000_000)
    private String payload;

    @Column(length = 1_000_000)
    private String result;

    @Column(length = 4000)
    private String errorMessage;

    private String workerId;

    private ZonedDateTime submittedAt;
    private ZonedDateTime startedAt;
    private ZonedDateTime heartbeatAt;
    private ZonedDateTime finishedAt;

    @Column(nullable = false)
    private boolean stopRequested;
}
