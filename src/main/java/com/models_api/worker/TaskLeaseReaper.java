package com.models_api.worker;

import com.models_api.config.ModelsProperties;
import com.models_api.service.TaskStatusService;
import lombok.RequiredArgsConstructor;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Fails processing tasks whose worker stopped sending heartbeats, which frees their model for
 * new submissions.
 */
@Component
@RequiredArgsConstructor
public class TaskLeaseReaper {

    private final TaskStatusService taskStatusService;
    private final ModelsProperties properties;

    @Scheduled(fixedDelayString = "${models.background.reaper-interval-ms:30000}")
    public void reap() {
        taskStatusService.expireLeases(properties.getBackground().getTaskTtl());
    }
}
