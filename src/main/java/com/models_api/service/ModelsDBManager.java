package com.models_api.service;

import com.models_api.database.TableStore;
import com.models_api.dto.model.TableReplaceResult;
import com.models_api.util.CancellationToken;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;

/**
 * Runs {@link ModelsManager} input and output against database tables instead of inline rows.
 */
@Slf4j
@RequiredArgsConstructor
public class ModelsDBManager {

    @Getter
    private final ModelsManager models;
    private final TableStore tables;

    public void inputDb(String name, String table, Map<String, Object> options) {
        inputDb(name, table, options, CancellationToken.NONE);
    }

    public void inputDb(String name, String table, Map<String, Object> options, CancellationToken token) {
        models.getHandler().handleName(name);
        List<Map<String, Object>> rows = tables.readTable(table);
        log.info("📥 Training model instance [{}] on table [{}] ({} rows)", name, table, rows.size());
        models.input(name, rows, options, token);
    }

    public TableReplaceResult updateDb(String name, String inputTable, String outputTable, Map<String, Object> options) {
        return updateDb(name, inputTable, outputTable, options, CancellationToken.NONE);
    }

    /**
     * Predicts on every row of {@code inputTable} and replaces {@code outputTable} with the result.
     */
    public TableReplaceResult updateDb(String name, String inputTable, String outputTable,
                                       Map<String, Object> options, CancellationToken token) {
        models.getHandler().handleName(name);
        List<Map<String, Object>> rows = tables.readTable(inputTable);
        token.checkpoint("load");
        List<Map<String, Object>> output = models.output(name, rows, options);
        token.checkpoint("persist");
        int written = tables.replaceTable(outputTable, output);
        log.info("📤 Model instance [{}] wrote {} rows from [{}] to [{}]", name, written, inputTable, outputTable);
        return new TableReplaceResult(outputTable, written);
    }
}
