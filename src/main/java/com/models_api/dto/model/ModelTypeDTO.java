package com.models_api.dto.model;

public record ModelTypeDTO(
        String type,
        String description
) {}
