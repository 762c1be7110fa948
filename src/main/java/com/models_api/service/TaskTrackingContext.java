package com.models_api.service;

import com.models_api.dto.task.TaskRecord;
import com.models_api.enumeration.status.TaskStatusEnum;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Tracking state owned by one orchestrator: the task record per model name and, per model name,
 * the id of the last evicted record so it is not adopted back from the broker. Only the last id
 * matters because adoption always looks at the latest broker row.
 */
@Getter
@Slf4j
public class TaskTrackingContext {

    private final ConcurrentMap<String, TaskRecord> tasks = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, String> evicted = new ConcurrentHashMap<>();
    private final Set<TaskStatusEnum> states = Collections.unmodifiableSet(EnumSet.allOf(TaskStatusEnum.class));
    private volatile boolean open = true;

    public void close() {
        open = false;
        log.info("Task tracking context closed with {} tracked model(s)", tasks.size());
        tasks.clear();
        evicted.clear();
    }
}
