package com.models_api.dto.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class ModelInstanceDTO {

    private String name;
    private String type;
    private String file;
    private boolean loaded;
    private Instant lastLoaded;
    private Instant lastModified;
    private ModelMetadata metadata;
}
