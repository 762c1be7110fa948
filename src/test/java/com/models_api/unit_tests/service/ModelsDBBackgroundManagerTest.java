package com.models_api.unit_tests.service;

import com.models_api.broker.TaskBroker;
import com.models_api.config.MapperConfig;
import com.models_api.config.ModelsProperties;
import com.models_api.dto.task.TaskPayload;
import com.models_api.dto.task.TaskResult;
import com.models_api.enumeration.ModelOperationEnum;
import com.models_api.enumeration.status.TaskStatusEnum;
import com.models_api.exception.ConflictException;
import com.models_api.exception.ValidationException;
import com.models_api.helper.ModelsBackgroundHandler;
import com.models_api.service.ModelsDBBackgroundManager;
import com.models_api.service.ModelsManager;
import com.models_api.service.TaskTrackingContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.Clock;
import java.time.ZonedDateTime;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ModelsDBBackgroundManagerTest {

    @Mock
    private ModelsManager models;

    @Mock
    private TaskBroker broker;

    private ModelsDBBackgroundManager manager;

    @BeforeEach
    void setUp() {
        manager = new ModelsDBBackgroundManager(models, broker, new ModelsBackgroundHandler(), new TaskTrackingContext(),
                new MapperConfig().modelMapper(), new ModelsProperties.Background(), Clock.systemUTC());
        when(models.exists("m1")).thenReturn(true);
        when(broker.findLatest(anyString())).thenReturn(Optional.empty());
        when(broker.submit(eq("m1"), any(), any(), anyInt())).thenReturn("t1", "t2");
    }

    @Test
    void inputDb_SubmitsTableTask() {
        ArgumentCaptor<TaskPayload> payload = ArgumentCaptor.forClass(TaskPayload.class);

        String taskId = manager.inputDb("m1", "train_rows", Map.of("k", 1));

        assertThat(taskId).isEqualTo("t1");
        verify(broker).submit(eq("m1"), eq(ModelOperationEnum.INPUT_DB), payload.capture(), eq(0));
        assertThat(payload.getValue().getTable()).isEqualTo("train_rows");
        assertThat(payload.getValue().getOptions()).containsEntry("k", 1);
        assertThat(payload.getValue().getData()).isNull();
    }

    @Test
    void inputDb_UsesConfiguredDefaultPriority() {
        ModelsProperties.Background settings = new ModelsProperties.Background();
        settings.setDefaultPriority(7);
        ModelsDBBackgroundManager prioritized = new ModelsDBBackgroundManager(models, broker, new ModelsBackgroundHandler(),
                new TaskTrackingContext(), new MapperConfig().modelMapper(), settings, Clock.systemUTC());

        prioritized.inputDb("m1", "train_rows", null);

        verify(broker).submit(eq("m1"), eq(ModelOperationEnum.INPUT_DB), any(), eq(7));
    }

    @Test
    void updateDb_SubmitsBothTables() {
        ArgumentCaptor<TaskPayload> payload = ArgumentCaptor.forClass(TaskPayload.class);

        manager.updateDb("m1", "in_rows", "out_rows", null);

        verify(broker).submit(eq("m1"), eq(ModelOperationEnum.UPDATE_DB), payload.capture(), eq(0));
        assertThat(payload.getValue().getTable()).isEqualTo("in_rows");
        assertThat(payload.getValue().getOutputTable()).isEqualTo("out_rows");
    }

    @Test
    void inputDb_InvalidTableNameIsRejected() {
        assertThatThrownBy(() -> manager.inputDb("m1", "rows; DROP TABLE model_task", Map.of()))
                .isInstanceOf(ValidationException.class);
        verify(broker, never()).submit(anyString(), any(), any(), anyInt());
    }

    @Test
    void updateDb_SharesTheOneTaskRule() {
        when(broker.getResult("t1")).thenReturn(new TaskResult("t1", "m1", ModelOperationEnum.INPUT_DB,
                TaskStatusEnum.PROCESSING, ZonedDateTime.now(), null, null, null));
        manager.inputDb("m1", "train_rows", Map.of());

        assertThatThrownBy(() -> manager.updateDb("m1", "in_rows", "out_rows", Map.of()))
                .isInstanceOf(ConflictException.class);
    }
}
