package com.models_api.unit_tests.broker;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.models_api.broker.DatabaseTaskBroker;
import com.models_api.dto.task.TaskPayload;
import com.models_api.dto.task.TaskResult;
import com.models_api.entity.ModelTask;
import com.models_api.enumeration.ModelOperationEnum;
import com.models_api.enumeration.status.TaskStatusEnum;
import com.models_api.exception.BrokerException;
import com.models_api.exception.NotFoundException;
import com.models_api.repository.ModelTaskRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class DatabaseTaskBrokerTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    @Mock
    private ModelTaskRepository repository;

    private ObjectMapper objectMapper;
    private DatabaseTaskBroker broker;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper().findAndRegisterModules();
        broker = new DatabaseTaskBroker(repository, objectMapper, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Should store a pending row with the encoded payload")
    void submit_StoresPendingRow() throws Exception {
        TaskPayload payload = TaskPayload.builder().data(List.of(Map.of("a", 1))).build();

        String taskId = broker.submit("m1", ModelOperationEnum.INPUT, payload, 5);

        ArgumentCaptor<ModelTask> saved = ArgumentCaptor.forClass(ModelTask.class);
        verify(repository).save(saved.capture());
        ModelTask task = saved.getValue();
        assertThat(task.getTaskId()).isEqualTo(taskId);
        assertThat(task.getStatus()).isEqualTo(TaskStatusEnum.NOT_PROCESSED);
        assertThat(task.getPriority()).isEqualTo(5);
        assertThat(task.getSubmittedAt()).isEqualTo(ZonedDateTime.ofInstant(NOW, ZoneOffset.UTC));
        assertThat(objectMapper.readValue(task.getPayload(), TaskPayload.class).getData()).hasSize(1);
    }

    @Test
    @DisplayName("Should report an unreachable table as a broker error")
    void submit_BrokerDown() {
        when(repository.save(any())).thenThrow(new DataAccessResourceFailureException("down"));

        assertThatThrownBy(() -> broker.submit("m1", ModelOperationEnum.DELETE, TaskPayload.builder().build(), 0))
                .isInstanceOf(BrokerException.class);
    }

    @Test
    @DisplayName("Should decode the stored result")
    void getResult_DecodesJson() {
        when(repository.findById("t1")).thenReturn(Optional.of(ModelTask.builder()
                .taskId("t1")
                .modelName("m1")
                .operation(ModelOperationEnum.INPUT)
                .status(TaskStatusEnum.SUCCESS)
                .result("{\"rows\":2}")
                .build()));

        TaskResult result = broker.getResult("t1");

        assertThat(result.status()).isEqualTo(TaskStatusEnum.SUCCESS);
        assertThat(result.result()).isEqualTo(Map.of("rows", 2));
    }

    @Test
    @DisplayName("Should fail with NotFound for an unknown task")
    void getResult_Unknown() {
        when(repository.findById("nope")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> broker.getResult("nope"))
                .isInstanceOf(NotFoundException.class)
                .hasMessage("Task not found: nope");
    }

    @Test
    @DisplayName("Should flag the stop and cancel a task that has not started")
    void revoke_RequestsStopThenCancelsPending() {
        when(repository.requestStop("t1")).thenReturn(1);
        when(repository.cancelPending(eq("t1"), any(), anyString(), any(), any())).thenReturn(1);

        broker.revoke("t1");

        var order = inOrder(repository);
        order.verify(repository).requestStop("t1");
        order.verify(repository).cancelPending(eq("t1"), any(), anyString(),
                eq(TaskStatusEnum.NOT_PROCESSED), eq(TaskStatusEnum.CANCELLED));
    }

    @Test
    @DisplayName("Should fail with NotFound when revoking an unknown task")
    void revoke_Unknown() {
        when(repository.requestStop("nope")).thenReturn(0);

        assertThatThrownBy(() -> broker.revoke("nope")).isInstanceOf(NotFoundException.class);
        verify(repository, never()).cancelPending(any(), any(), any(), any(), any());
    }
}
