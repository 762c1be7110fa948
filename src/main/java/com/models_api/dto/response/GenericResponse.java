package com.models_api.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GenericResponse<T> {
    private T data;
    private String errorCode;
    private String message;
    private Metadata metadata;

    public static <T> GenericResponse<T> success(String message, T data) {
        return GenericResponse.<T>builder()
                .message(message)
                .data(data)
                .metadata(new Metadata())
                .errorCode("")
                .build();
    }

    /**
     * Response to a background submission. The task id is returned both as data and in the
     * metadata so clients can correlate it with later status calls.
     */
    public static GenericResponse<Map<String, String>> accepted(String message, String taskId) {
        return GenericResponse.<Map<String, String>>builder()
                .message(message)
                .data(Map.of("taskId", taskId))
                .metadata(Metadata.builder().taskId(taskId).build())
                .errorCode("")
                .build();
    }

    public static <T> GenericResponse<T> failure(String errorCode, String message, Metadata metadata) {
        return GenericResponse.<T>builder()
                .errorCode(errorCode)
                .message(message)
                .metadata(metadata)
                .build();
    }
}
