package com.models_api.dto.model;

public record TableReplaceResult(
        String table,
        int rows
) {}
