package com.models_api.broker;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.models_api.dto.task.TaskPayload;
import com.models_api.dto.task.TaskResult;
import com.models_api.entity.ModelTask;
import com.models_api.enumeration.ModelOperationEnum;
import com.models_api.enumeration.status.TaskStatusEnum;
import com.models_api.exception.BrokerException;
import com.models_api.exception.NotFoundException;
import com.models_api.exception.TaskCancelledException;
import com.models_api.repository.ModelTaskRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.ZonedDateTime;
import java.util.Optional;
import java.util.UUID;

@Component
@RequiredArgsConstructor
@Slf4j
public class DatabaseTaskBroker implements TaskBroker {

    private final ModelTaskRepository modelTaskRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    public String submit(String modelName, ModelOperationEnum operation, TaskPayload payload, int priority) {
        String taskId = UUID.randomUUID().toString();
        ModelTask task = ModelTask.builder()
                .taskId(taskId)
                .modelName(modelName)
                .operation(operation)
                .status(TaskStatusEnum.NOT_PROCESSED)
                .priority(priority)
                .payload(write(payload))
                .submittedAt(ZonedDateTime.now(clock))
                .stopRequested(false)
                .build();
        try {
            modelTaskRepository.save(task);
        } catch (DataAccessException e) {
            throw new BrokerException("Unable to submit " + operation + " task for model instance " + modelName, e);
        }
        log.info("[TASK INIT] [{}] [{}] model={} priority={}", operation, taskId, modelName, priority);
        return taskId;
    }

    @Override
    public TaskResult getResult(String taskId) {
        try {
            return modelTaskRepository.findById(taskId)
                    .map(this::toResult)
                    .orElseThrow(() -> new NotFoundException("Task not found: " + taskId));
        } catch (DataAccessException e) {
            throw new BrokerException("Unable to read task " + taskId, e);
        }
    }

    @Override
    public void revoke(String taskId) {
        try {
            if (modelTaskRepository.requestStop(taskId) == 0) {
                throw new NotFoundException("Task not found: " + taskId);
            }
            int cancelled = modelTaskRepository.cancelPending(taskId, ZonedDateTime.now(clock),
                    new TaskCancelledException().getMessage(),
                    TaskStatusEnum.NOT_PROCESSED, TaskStatusEnum.CANCELLED);
            log.info("🛑 revoke({}) stopRequested=true, cancelledBeforeStart={}", taskId, cancelled == 1);
        } catch (DataAccessException e) {
            throw new BrokerException("Unable to revoke task " + taskId, e);
        }
    }

    @Override
    public Optional<TaskResult> findLatest(String modelName) {
        try {
            return modelTaskRepository.findFirstByModelNameOrderBySubmittedAtDesc(modelName).map(this::toResult);
        } catch (DataAccessException e) {
            throw new BrokerException("Unable to read tasks of model instance " + modelName, e);
        }
    }

    private TaskResult toResult(ModelTask task) {
        return new TaskResult(
                task.getTaskId(),
                task.getModelName(),
                task.getOperation(),
                task.getStatus(),
                task.getSubmittedAt(),
                task.getFinishedAt(),
                read(task.getTaskId(), task.getResult()),
                task.getErrorMessage());
    }

    private String write(TaskPayload payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new BrokerException("Unable to encode task payload", e);
        }
    }

    private Object read(String taskId, String json) {
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.readValue(json, Object.class);
        } catch (JsonProcessingException e) {
            throw new BrokerException("Unable to decode result of task " + taskId, e);
        }
    }
}
