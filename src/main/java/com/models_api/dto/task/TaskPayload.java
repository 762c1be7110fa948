package com.models_api.dto.task;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Arguments shipped to the worker with a task. Which fields are used depends on the operation.
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TaskPayload {

    private List<Map<String, Object>> data;

    @Builder.Default
    private Map<String, Object> options = new LinkedHashMap<>();

    private Map<String, Object> metadata;

    private String table;

    private String outputTable;
}
