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
public class ModelCreateRequest {
    @NotBlank
    private String name;
    @NotBlank
    private String type;
    private Map<String, Object> settings = new LinkedHashMap<>();
    private boolean overwrite;
}
