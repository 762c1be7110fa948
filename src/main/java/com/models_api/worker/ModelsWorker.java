package com.models_api.worker;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.models_api.config.ModelsProperties;
import com.models_api.dto.task.TaskPayload;
import com.models_api.entity.ModelTask;
import com.models_api.exception.LeaseLostException;
import com.models_api.exception.TaskCancelledException;
import com.models_api.exception.WorkerFailureException;
import com.models_api.service.ModelsDBManager;
import com.models_api.service.ModelsManager;
import com.models_api.service.TaskStatusService;
import com.models_api.util.CancellationToken;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Semaphore;

/**
 * Claims tasks from the broker table and runs them against its own {@link ModelsManager}.
 * Several processes may run a worker over the same table and folder.
 */
@Component
@ConditionalOnProperty(prefix = "models.worker", name = "enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class ModelsWorker {

    private final ModelsManager models;
    private final ModelsDBManager dbModels;
    private final TaskStatusService taskStatusService;
    private final ThreadPoolTaskExecutor executor;
    private final ObjectMapper objectMapper;
    private final String workerId;
    private final Semaphore permits;

    public ModelsWorker(@Qualifier("workerModelsManager") ModelsManager models,
                        @Qualifier("workerModelsDBManager") ModelsDBManager dbModels,
                        TaskStatusService taskStatusService,
                        @Qualifier("modelsWorkerExecutor") ThreadPoolTaskExecutor executor,
                        ObjectMapper objectMapper,
                        ModelsProperties properties) {
        this.models = models;
        this.dbModels = dbModels;
        this.taskStatusService = taskStatusService;
        this.executor = executor;
        this.objectMapper = objectMapper;
        String id = properties.getWorker().getId();
        this.workerId = id == null || id.isBlank() ? "worker-" + UUID.randomUUID().toString().substring(0, 8) : id;
        this.permits = new Semaphore(Math.max(1, properties.getWorker().getConcurrency()));
        log.info("[WORKER] {} ready with {} slot(s) on {}", workerId, permits.availablePermits(), models.getFolder());
    }

    @Scheduled(fixedDelayString = "${models.worker.poll-interval-ms:500}")
    public void poll() {
        int free = permits.availablePermits();
        if (free == 0) {
            return;
        }
        List<ModelTask> claimed = taskStatusService.claimNext(workerId, free);
        for (ModelTask task : claimed) {
            permits.acquireUninterruptibly();
            try {
                executor.execute(() -> {
                    try {
                        execute(task);
                    } finally {
                        permits.release();
                    }
                });
            } catch (TaskRejectedException e) {
                permits.release();
                log.error("[WORKER] Executor rejected task {}", task.getTaskId(), e);
                taskStatusService.taskFailed(task.getTaskId(), new WorkerFailureException(task.getTaskId(), e).getMessage());
            }
        }
    }

    /**
     * Runs one claimed task to a terminal state. Never throws.
     */
    public void execute(ModelTask task) {
        String taskId = task.getTaskId();
        try (MDC.MDCCloseable ignored = MDC.putCloseable("taskId", taskId)) {
            log.info("🔍 [WORKER] {} started for model instance [{}]", task.getOperation(), task.getModelName());
            CancellationToken token = new BrokerCancellationToken(taskId, taskStatusService);
            try {
                token.checkpoint("start");
                Object result = run(task, token);
                taskStatusService.completeTask(taskId, result);
            } catch (TaskCancelledException e) {
                taskStatusService.taskCancelled(taskId);
            } catch (LeaseLostException e) {
                log.warn("⚠️ [WORKER] Task {} abandoned: {}", taskId, e.getMessage());
            } catch (Exception e) {
                WorkerFailureException failure = new WorkerFailureException(taskId, e);
                log.error("[WORKER] Task {} failed", taskId, failure);
                taskStatusService.taskFailed(taskId, failure.getMessage());
            }
        }
    }

    private Object run(ModelTask task, CancellationToken token) throws IOException {
        String name = task.getModelName();
        TaskPayload payload = objectMapper.readValue(task.getPayload(), TaskPayload.class);
        Map<String, Object> options = payload.getOptions() == null ? Map.of() : payload.getOptions();

        switch (task.getOperation()) {
            case INPUT -> {
                models.input(name, payload.getData(), options, token);
                return Map.of("rows", payload.getData().size());
            }
            case OUTPUT -> {
                token.checkpoint("load");
                return models.output(name, payload.getData(), options);
            }
            case UPDATE -> {
                token.checkpoint("persist");
                return models.update(name, payload.getMetadata());
            }
            case DELETE -> {
                token.checkpoint("persist");
                models.delete(name);
                return Map.of("deleted", name);
            }
            case INPUT_DB -> {
                dbModels.inputDb(name, payload.getTable(), options, token);
                return Map.of("table", payload.getTable());
            }
            case UPDATE_DB -> {
                return dbModels.updateDb(name, payload.getTable(), payload.getOutputTable(), options, token);
            }
            default -> throw new IllegalStateException("Unsupported operation " + task.getOperation());
        }
    }
}
