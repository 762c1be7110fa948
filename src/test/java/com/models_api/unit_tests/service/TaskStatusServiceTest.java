package com.models_api.unit_tests.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.models_api.entity.ModelTask;
import com.models_api.enumeration.ModelOperationEnum;
import com.models_api.enumeration.status.TaskStatusEnum;
import com.models_api.repository.ModelTaskRepository;
import com.models_api.service.TaskStatusService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.data.domain.Pageable;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class TaskStatusServiceTest {

    private static final ZonedDateTime NOW = ZonedDateTime.of(2024, 5, 1, 12, 0, 0, 0, ZoneOffset.UTC);

    @Mock
    private ModelTaskRepository modelTaskRepository;

    private TaskStatusService taskStatusService;

    @BeforeEach
    void setUp() {
        taskStatusService = new TaskStatusService(modelTaskRepository, new ObjectMapper(),
                Clock.fixed(Instant.from(NOW), ZoneOffset.UTC));
    }

    private static ModelTask task(String taskId) {
        return ModelTask.builder()
                .taskId(taskId)
                .modelName("m-" + taskId)
                .operation(ModelOperationEnum.INPUT)
                .status(TaskStatusEnum.NOT_PROCESSED)
                .build();
    }

    @Test
    void claimNext_SkipsRowsTakenByAnotherWorker() {
        when(modelTaskRepository.findByStatusOrderByPriorityDescSubmittedAtAsc(eq(TaskStatusEnum.NOT_PROCESSED), any(Pageable.class)))
                .thenReturn(List.of(task("a"), task("b"), task("c")));
        when(modelTaskRepository.claim(eq("a"), eq("w1"), any(), any(), any())).thenReturn(0);
        when(modelTaskRepository.claim(eq("b"), eq("w1"), any(), any(), any())).thenReturn(1);
        when(modelTaskRepository.claim(eq("c"), eq("w1"), any(), any(), any())).thenReturn(1);
        when(modelTaskRepository.findById("b")).thenReturn(Optional.of(task("b")));
        when(modelTaskRepository.findById("c")).thenReturn(Optional.of(task("c")));

        List<ModelTask> claimed = taskStatusService.claimNext("w1", 1);

        assertThat(claimed).extracting(ModelTask::getTaskId).containsExactly("b");
        verify(modelTaskRepository, never()).claim(eq("c"), any(), any(), any(), any());
    }

    @Test
    void claimNext_NothingWhenNoFreeSlots() {
        assertThat(taskStatusService.claimNext("w1", 0)).isEmpty();
        verify(modelTaskRepository, never()).findByStatusOrderByPriorityDescSubmittedAtAsc(any(), any());
    }

    @Test
    void completeTask_StoresJsonResult() {
        when(modelTaskRepository.finish(any(), any(), any(), any(), any(), any())).thenReturn(1);

        taskStatusService.completeTask("t1", Map.of("rows", 3));

        verify(modelTaskRepository).finish(eq("t1"), eq(TaskStatusEnum.SUCCESS), eq("{\"rows\":3}"), isNull(),
                eq(NOW), eq(TaskStatusEnum.PROCESSING));
    }

    @Test
    void taskFailed_TruncatesLongMessages() {
        taskStatusService.taskFailed("t1", "x".repeat(5000));

        verify(modelTaskRepository).finish(eq("t1"), eq(TaskStatusEnum.FAILURE), isNull(), eq("x".repeat(4000)),
                eq(NOW), eq(TaskStatusEnum.PROCESSING));
    }

    @Test
    void taskCancelled_RecordsCancellation() {
        taskStatusService.taskCancelled("t1");

        verify(modelTaskRepository).finish(eq("t1"), eq(TaskStatusEnum.CANCELLED), isNull(),
                eq("Operation stopped by cancellation request."), eq(NOW), eq(TaskStatusEnum.PROCESSING));
    }

    @Test
    void stopRequested_NullMeansNo() {
        when(modelTaskRepository.findStopRequested("gone")).thenReturn(null);
        when(modelTaskRepository.findStopRequested("t1")).thenReturn(true);

        assertThat(taskStatusService.stopRequested("gone")).isFalse();
        assertThat(taskStatusService.stopRequested("t1")).isTrue();
    }

    @Test
    void expireLeases_UsesTtlCutoff() {
        when(modelTaskRepository.expireLeases(any(), any(), any(), any(), any())).thenReturn(2);

        int expired = taskStatusService.expireLeases(Duration.ofMinutes(5));

        assertThat(expired).isEqualTo(2);
        verify(modelTaskRepository).expireLeases(eq(NOW.minusMinutes(5)), eq(NOW), any(),
                eq(TaskStatusEnum.PROCESSING), eq(TaskStatusEnum.FAILURE));
    }
}
