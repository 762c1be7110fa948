package com.models_api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

@AllArgsConstructor
@NoArgsConstructor
@Setter
@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Metadata {

    @Builder.Default
    private Instant timestamp = Instant.now();

    @Builder.Default
    private String requestId = UUID.randomUUID().toString();

    private String path;

    private String taskId;

    public static Metadata forPath(String path) {
        return Metadata.builder().path(path).build();
    }
}
