package com.models_api.plugin;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Keeps running means of every numeric column it is trained on. Each input call adds to the
 * totals; prediction copies the row and appends {@code <column>_mean} for every known column.
 */
@Component
public class DemoModelPlugin implements ModelPlugin<DemoModelState> {

    public static final String TYPE = "demo";
    static final String MEAN_SUFFIX = "_mean";

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Override
    public String getType() {
        return TYPE;
    }

    @Override
    public String getDescription() {
        return "Running mean of every numeric column. Input adds rows to the totals, output appends <column>_mean fields.";
    }

    @Override
    public DemoModelState initialize(Map<String, Object> settings) {
        return DemoModelState.builder()
                .settings(settings == null ? new LinkedHashMap<>() : new LinkedHashMap<>(settings))
                .build();
    }

    @Override
    public DemoModelState train(DemoModelState state, List<Map<String, Object>> data, Map<String, Object> options) {
        if (data == null) {
            throw new IllegalArgumentException("Training data is required");
        }
        Map<String, Double> sums = new LinkedHashMap<>(state.getSums());
        Map<String, Long> counts = new LinkedHashMap<>(state.getCounts());
        for (Map<String, Object> row : data) {
            if (row == null) {
                throw new IllegalArgumentException("Training rows must not be null");
            }
            row.forEach((column, value) -> {
                if (value instanceof Number number) {
                    sums.merge(column, number.doubleValue(), Double::sum);
                    counts.merge(column, 1L, Long::sum);
                }
            });
        }
        return state.toBuilder().sums(sums).counts(counts).build();
    }

    @Override
    public List<Map<String, Object>> predict(DemoModelState state, List<Map<String, Object>> data, Map<String, Object> options) {
        if (data == null) {
            throw new IllegalArgumentException("Prediction data is required");
        }
        if (!state.isTrained()) {
            throw new IllegalStateException("Model instance has not been trained");
        }
        List<Map<String, Object>> out = new ArrayList<>(data.size());
        for (Map<String, Object> row : data) {
            Map<String, Object> result = new LinkedHashMap<>(row);
            for (String column : row.keySet()) {
                Double mean = state.mean(column);
                if (mean != null) {
                    result.put(column + MEAN_SUFFIX, mean);
                }
            }
            out.add(result);
        }
        return out;
    }

    @Override
    public byte[] serialize(DemoModelState state) throws IOException {
        return objectMapper.writeValueAsBytes(state);
    }

    @Override
    public DemoModelState deserialize(byte[] bytes) throws IOException {
        return objectMapper.readValue(bytes, DemoModelState.class);
    }
}
