package com.models_api.unit_tests.service;

import com.models_api.database.TableStore;
import com.models_api.dto.model.TableReplaceResult;
import com.models_api.exception.NotFoundException;
import com.models_api.exception.TaskCancelledException;
import com.models_api.helper.ModelsHandler;
import com.models_api.service.ModelsDBManager;
import com.models_api.service.ModelsManager;
import com.models_api.util.CancellationToken;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ModelsDBManagerTest {

    @Mock
    private ModelsManager models;

    @Mock
    private TableStore tables;

    private ModelsDBManager dbManager;

    private final List<Map<String, Object>> rows = List.of(Map.of("a", 1), Map.of("a", 3));

    @BeforeEach
    void setUp() {
        when(models.getHandler()).thenReturn(new ModelsHandler());
        dbManager = new ModelsDBManager(models, tables);
    }

    @Test
    void inputDb_TrainsOnTableRows() {
        when(tables.readTable("train")).thenReturn(rows);

        dbManager.inputDb("m1", "train", Map.of("k", "v"));

        verify(models).input(eq("m1"), eq(rows), eq(Map.of("k", "v")), any(CancellationToken.class));
    }

    @Test
    void inputDb_MissingTableDoesNotTrain() {
        when(tables.readTable("ghost")).thenThrow(new NotFoundException("Table not found: ghost"));

        assertThatThrownBy(() -> dbManager.inputDb("m1", "ghost", Map.of()))
                .isInstanceOf(NotFoundException.class);
        verify(models, never()).input(anyString(), anyList(), anyMap(), any(CancellationToken.class));
    }

    @Test
    void updateDb_ReplacesOutputTable() {
        List<Map<String, Object>> predicted = List.of(Map.of("a", 1, "a_mean", 2.0), Map.of("a", 3, "a_mean", 2.0));
        when(tables.readTable("in")).thenReturn(rows);
        when(models.output("m1", rows, Map.of())).thenReturn(predicted);
        when(tables.replaceTable("out", predicted)).thenReturn(2);

        TableReplaceResult result = dbManager.updateDb("m1", "in", "out", Map.of());

        assertThat(result).isEqualTo(new TableReplaceResult("out", 2));
    }

    @Test
    void updateDb_CancelledBeforeReplace() {
        when(tables.readTable("in")).thenReturn(rows);
        when(models.output("m1", rows, Map.of())).thenReturn(rows);

        assertThatThrownBy(() -> dbManager.updateDb("m1", "in", "out", Map.of(), step -> {
            if ("persist".equals(step)) {
                throw new TaskCancelledException();
            }
        })).isInstanceOf(TaskCancelledException.class);

        verify(tables, never()).replaceTable(anyString(), anyList());
    }
}
