package com.models_api.plugin;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder(toBuilder = true)
@AllArgsConstructor
@NoArgsConstructor
public class DemoModelState {

    @Builder.Default
    private Map<String, Object> settings = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, Double> sums = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, Long> counts = new LinkedHashMap<>();

    @JsonIgnore
    public boolean isTrained() {
        return !counts.isEmpty();
    }

    public Double mean(String column) {
        Long count = counts.get(column);
        if (count == null || count == 0) {
            return null;
        }
        return sums.get(column) / count;
    }
}
