package com.models_api.service;

import com.models_api.broker.TaskBroker;
import com.models_api.config.ModelsProperties;
import com.models_api.dto.task.TaskPayload;
import com.models_api.enumeration.ModelOperationEnum;
import com.models_api.helper.ModelsBackgroundHandler;
import com.models_api.util.SqlIdentifiers;
import org.modelmapper.ModelMapper;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Background variant of {@link ModelsDBManager}: table-driven input and output run on a worker
 * under the same one-task-per-model rule.
 */
public class ModelsDBBackgroundManager extends ModelsBackgroundManager {

    public ModelsDBBackgroundManager(ModelsManager models,
                                     TaskBroker broker,
                                     ModelsBackgroundHandler handler,
                                     TaskTrackingContext context,
                                     ModelMapper modelMapper,
                                     ModelsProperties.Background settings,
                                     Clock clock) {
        super(models, broker, handler, context, modelMapper, settings, clock);
    }

    public String inputDb(String name, String table, Map<String, Object> options) {
        SqlIdentifiers.quoteTable(table);
        return start(name, ModelOperationEnum.INPUT_DB, TaskPayload.builder()
                .table(table)
                .options(options == null ? new LinkedHashMap<>() : new LinkedHashMap<>(options))
                .build(), settings.getDefaultPriority());
    }

    public String updateDb(String name, String inputTable, String outputTable, Map<String, Object> options) {
        SqlIdentifiers.quoteTable(inputTable);
        SqlIdentifiers.quoteTable(outputTable);
        return start(name, ModelOperationEnum.UPDATE_DB, TaskPayload.builder()
                .table(inputTable)
                .outputTable(outputTable)
                .options(options == null ? new LinkedHashMap<>() : new LinkedHashMap<>(options))
                .build(), settings.getDefaultPriority());
    }
}
