package com.models_api.service;

import com.models_api.broker.TaskBroker;
import com.models_api.config.ModelsProperties;
import com.models_api.dto.model.ModelInstanceDTO;
import com.models_api.dto.task.TaskPayload;
import com.models_api.dto.task.TaskRecord;
import com.models_api.dto.task.TaskResult;
import com.models_api.dto.task.TaskResultDTO;
import com.models_api.dto.task.TaskStatusDTO;
import com.models_api.enumeration.ModelOperationEnum;
import com.models_api.enumeration.status.TaskStatusEnum;
import com.models_api.exception.ConflictException;
import com.models_api.helper.ModelsBackgroundHandler;
import jakarta.annotation.PreDestroy;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.modelmapper.ModelMapper;

import java.time.Clock;
import java.time.ZonedDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Submits model operations to the {@link TaskBroker} and tracks one task per model name.
 *
 * <p>A model with a task that is not terminal refuses further submissions with a
 * {@link ConflictException}; nothing is queued behind it. Failures inside the worker never raise
 * here, they show up as a {@code FAILURE} status with the error message.</p>
 */
@Slf4j
public class ModelsBackgroundManager {

    @Getter
    protected final ModelsManager models;
    protected final TaskBroker broker;
    protected final ModelsBackgroundHandler handler;
    private final TaskTrackingContext context;
    private final ModelMapper modelMapper;
    protected final ModelsProperties.Background settings;
    private final Clock clock;

    public ModelsBackgroundManager(ModelsManager models,
                                   TaskBroker broker,
                                   ModelsBackgroundHandler handler,
                                   TaskTrackingContext context,
                                   ModelMapper modelMapper,
                                   ModelsProperties.Background settings,
                                   Clock clock) {
        this.models = models;
        this.broker = broker;
        this.handler = handler;
        this.context = context;
        this.modelMapper = modelMapper;
        this.settings = settings;
        this.clock = clock;
    }

    public String input(String name, List<Map<String, Object>> data, Map<String, Object> options) {
        return input(name, data, options, settings.getDefaultPriority());
    }

    public String input(String name, List<Map<String, Object>> data, Map<String, Object> options, int priority) {
        handler.handleData(data);
        return start(name, ModelOperationEnum.INPUT, TaskPayload.builder()
                .data(data)
                .options(copy(options))
                .build(), priority);
    }

    public String output(String name, List<Map<String, Object>> data, Map<String, Object> options) {
        return output(name, data, options, settings.getDefaultPriority());
    }

    public String output(String name, List<Map<String, Object>> data, Map<String, Object> options, int priority) {
        handler.handleData(data);
        return start(name, ModelOperationEnum.OUTPUT, TaskPayload.builder()
                .data(data)
                .options(copy(options))
                .build(), priority);
    }

    public String update(String name, Map<String, Object> metadata) {
        handler.handleMetadata(metadata);
        return start(name, ModelOperationEnum.UPDATE, TaskPayload.builder()
                .metadata(metadata)
                .build(), settings.getDefaultPriority());
    }

    public String delete(String name) {
        return start(name, ModelOperationEnum.DELETE, TaskPayload.builder().build(), settings.getDefaultPriority());
    }

    /**
     * Creates the model synchronously. Refused while the model has an active task.
     */
    public ModelInstanceDTO create(String name, String type, Map<String, Object> modelSettings, boolean overwrite) {
        handler.handleName(name);
        handler.handleProcessing(name, track(name));
        return models.create(name, type, modelSettings, overwrite);
    }

    /**
     * Enqueues {@code operation} for {@code name} and returns the task id without waiting for it.
     */
    public String start(String name, ModelOperationEnum operation, TaskPayload payload, int priority) {
        ensureOpen();
        handler.handleRead(name, models.exists(name));
        AtomicReference<String> taskId = new AtomicReference<>();
        context.getTasks().compute(name, (key, current) -> {
            TaskRecord active = current == null ? adoptLatest(key) : refresh(current);
            handler.handleProcessing(key, active);
            String id = broker.submit(key, operation, payload, priority);
            taskId.set(id);
            return TaskRecord.builder()
                    .taskId(id)
                    .modelName(key)
                    .operation(operation)
                    .status(TaskStatusEnum.NOT_PROCESSED)
                    .startedAt(ZonedDateTime.now(clock))
                    .build();
        });
        log.info("🚀 Started {} task {} for model instance [{}]", operation, taskId.get(), name);
        return taskId.get();
    }

    public TaskStatusDTO getStatus(String name) {
        handler.handleName(name);
        TaskRecord record = track(name);
        handler.handleReadState(name, record);
        return modelMapper.map(record, TaskStatusDTO.class);
    }

    /**
     * Result of the last task of {@code name}; {@code Conflict} while it is still running.
     */
    public TaskResultDTO getResult(String name) {
        handler.handleName(name);
        TaskRecord record = track(name);
        handler.handleReadState(name, record);
        handler.handleProcessing(name, record);
        return new TaskResultDTO(record.getTaskId(), record.getStatus(), record.getResult(), record.getError());
    }

    public TaskStatusDTO cancel(String name) {
        handler.handleName(name);
        TaskRecord record = track(name);
        handler.handleCancel(name, record);
        broker.revoke(record.getTaskId());
        log.info("🛑 Cancellation requested for task {} of model instance [{}]", record.getTaskId(), name);
        TaskRecord refreshed = context.getTasks().computeIfPresent(name, (key, current) -> refresh(current));
        return modelMapper.map(refreshed == null ? record : refreshed, TaskStatusDTO.class);
    }

    /**
     * Forgets the finished task of {@code name}. The broker keeps its row.
     */
    public void evict(String name) {
        handler.handleName(name);
        TaskRecord record = track(name);
        handler.handleReadState(name, record);
        handler.handleProcessing(name, record);
        context.getEvicted().put(name, record.getTaskId());
        context.getTasks().remove(name, record);
        log.debug("Evicted task {} of model instance [{}]", record.getTaskId(), name);
    }

    @PreDestroy
    public void shutdown() {
        if (!context.isOpen()) {
            return;
        }
        if (settings.isCancelOnShutdown()) {
            context.getTasks().values().stream()
                    .filter(record -> !record.isTerminal())
                    .forEach(this::revokeQuietly);
        }
        context.close();
        log.info("Task orchestrator shut down");
    }

    private void revokeQuietly(TaskRecord record) {
        try {
            broker.revoke(record.getTaskId());
            log.info("🛑 Revoked task {} of model instance [{}] on shutdown", record.getTaskId(), record.getModelName());
        } catch (RuntimeException e) {
            log.warn("⚠️ Could not revoke task {} on shutdown: {}", record.getTaskId(), e.getMessage());
        }
    }

    private TaskRecord track(String name) {
        return context.getTasks().compute(name, (key, current) -> current == null ? adoptLatest(key) : refresh(current));
    }

    private TaskRecord refresh(TaskRecord record) {
        if (record.isTerminal()) {
            return record;
        }
        TaskResult result = broker.getResult(record.getTaskId());
        return result.status() == record.getStatus() ? record : record.refreshedFrom(result);
    }

    // covers an orchestrator restart: the broker may still know about tasks this process never saw
    private TaskRecord adoptLatest(String name) {
        return broker.findLatest(name)
                .filter(result -> !result.taskId().equals(context.getEvicted().get(name)))
                .map(TaskRecord::adopt)
                .orElse(null);
    }

    private void ensureOpen() {
        if (!context.isOpen()) {
            throw new IllegalStateException("Task orchestrator is shut down");
        }
    }

    private static Map<String, Object> copy(Map<String, Object> options) {
        return options == null ? new LinkedHashMap<>() : new LinkedHashMap<>(options);
    }
}
