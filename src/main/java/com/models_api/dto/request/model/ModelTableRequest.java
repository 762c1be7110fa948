package com.models_api.dto.request.model;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.LinkedHashMap;
import java.util.Map;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class ModelTableRequest {
    @NotBlank
    private String table;
    /** Required when predicting into a table. */
    private String outputTable;
    private Map<String, Object> options = new LinkedHashMap<>();
}
