package com.models_api.worker;

import com.models_api.exception.TaskCancelledException;
import com.models_api.service.TaskStatusService;
import com.models_api.util.CancellationToken;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Checkpoints renew the task's heartbeat and stop the operation once its row is flagged.
 * A lost lease also stops it, through {@link com.models_api.exception.LeaseLostException}.
 */
@Slf4j
@RequiredArgsConstructor
public class BrokerCancellationToken implements CancellationToken {

    private final String taskId;
    private final TaskStatusService taskStatusService;

    @Override
    public void checkpoint(String step) {
        taskStatusService.heartbeat(taskId);
        if (taskStatusService.stopRequested(taskId)) {
            log.info("🛑 Task {} stopping at checkpoint [{}]", taskId, step);
            throw new TaskCancelledException();
        }
    }
}
