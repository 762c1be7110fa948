package com.models_api.dto.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Descriptive metadata kept next to a model artifact. Only the fields in
 * {@link #EDITABLE_FIELDS} can be changed through an update.
 */
@Data
@Builder(toBuilder = true)
@AllArgsConstructor
@NoArgsConstructor
public class ModelMetadata {

    public static final Set<String> EDITABLE_FIELDS = Set.of("title", "description", "tags", "source");

    private String title;
    private String description;
    @Builder.Default
    private List<String> tags = new ArrayList<>();
    private String source;
    private String model;
    @Builder.Default
    private boolean canInput = true;
    @Builder.Default
    private boolean canOutput = true;
    @Builder.Default
    private boolean canUpdate = true;
    private ZonedDateTime createdAt;
    private ZonedDateTime updatedAt;
}
