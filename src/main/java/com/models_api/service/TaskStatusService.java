package com.models_api.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.models_api.entity.ModelTask;
import com.models_api.enumeration.status.TaskStatusEnum;
import com.models_api.exception.LeaseLostException;
import com.models_api.exception.TaskCancelledException;
import com.models_api.repository.ModelTaskRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Worker-side transitions of {@link ModelTask} rows. Every transition is a conditional update,
 * so a row that already reached a terminal state is left alone.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TaskStatusService {

    static final String LEASE_EXPIRED = "Task lease expired: no heartbeat from its worker";
    private static final int MAX_ERROR_LENGTH = 4000;

    private final ModelTaskRepository modelTaskRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * Claims up to {@code limit} pending tasks for {@code workerId}, highest priority then oldest
     * first. Rows taken by another worker in the meantime are skipped.
     */
    public List<ModelTask> claimNext(String workerId, int limit) {
        List<ModelTask> claimed = new ArrayList<>();
        if (limit <= 0) {
            return claimed;
        }
        List<ModelTask> candidates = modelTaskRepository.findByStatusOrderByPriorityDescSubmittedAtAsc(
                TaskStatusEnum.NOT_PROCESSED, PageRequest.of(0, limit * 2));
        for (ModelTask candidate : candidates) {
            if (claimed.size() == limit) {
                break;
            }
            int updated = modelTaskRepository.claim(candidate.getTaskId(), workerId, ZonedDateTime.now(clock),
                    TaskStatusEnum.NOT_PROCESSED, TaskStatusEnum.PROCESSING);
            if (updated == 1) {
                modelTaskRepository.findById(candidate.getTaskId()).ifPresent(claimed::add);
                log.info("[TASK CLAIM] [{}] [{}] model={} worker={}",
                        candidate.getOperation(), candidate.getTaskId(), candidate.getModelName(), workerId);
            }
        }
        return claimed;
    }

    /**
     * Renews the lease of a processing task.
     *
     * @throws LeaseLostException when the row already left PROCESSING (expired or finished elsewhere)
     */
    public void heartbeat(String taskId) {
        int updated = modelTaskRepository.heartbeat(taskId, ZonedDateTime.now(clock), TaskStatusEnum.PROCESSING);
        if (updated == 0) {
            throw new LeaseLostException(taskId);
        }
    }

    public boolean stopRequested(String taskId) {
        Boolean result = modelTaskRepository.findStopRequested(taskId);
        log.debug("🧪 stopRequested({}) = {}", taskId, result);
        return Boolean.TRUE.equals(result);
    }

    public void completeTask(String taskId, Object result) {
        String json;
        try {
            json = result == null ? null : objectMapper.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            taskFailed(taskId, "Unable to encode task result: " + e.getOriginalMessage());
            return;
        }
        finish(taskId, TaskStatusEnum.SUCCESS, json, null);
        log.info("✅ Task completed [{}]", taskId);
    }

    public void taskFailed(String taskId, String errorMessage) {
        finish(taskId, TaskStatusEnum.FAILURE, null, truncate(errorMessage));
        log.info("❌ Task failed [{}]: {}", taskId, errorMessage);
    }

    public void taskCancelled(String taskId) {
        finish(taskId, TaskStatusEnum.CANCELLED, null, new TaskCancelledException().getMessage());
        log.info("🛑 Task {} marked as CANCELLED", taskId);
    }

    /**
     * Fails every processing task whose heartbeat is older than {@code ttl}.
     */
    public int expireLeases(Duration ttl) {
        ZonedDateTime now = ZonedDateTime.now(clock);
        int expired = modelTaskRepository.expireLeases(now.minus(ttl), now, LEASE_EXPIRED,
                TaskStatusEnum.PROCESSING, TaskStatusEnum.FAILURE);
        if (expired > 0) {
            log.warn("⏱️ Expired {} task lease(s) older than {}", expired, ttl);
        }
        return expired;
    }

    private void finish(String taskId, TaskStatusEnum status, String result, String error) {
        int updated = modelTaskRepository.finish(taskId, status, result, error, ZonedDateTime.now(clock),
                TaskStatusEnum.PROCESSING);
        if (updated == 0) {
            log.warn("⚠️ Task {} was no longer processing; {} not recorded", taskId, status);
        }
    }

    private static String truncate(String message) {
        if (message == null || message.length() <= MAX_ERROR_LENGTH) {
            return message;
        }
        return message.substring(0, MAX_ERROR_LENGTH);
    }
}
