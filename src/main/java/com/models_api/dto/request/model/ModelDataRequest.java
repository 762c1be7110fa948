package com.models_api.dto.request.model;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class ModelDataRequest {
    @NotNull
    private List<Map<String, Object>> data;
    private Map<String, Object> options = new LinkedHashMap<>();
    // background submissions only
    private Integer priority;
}
