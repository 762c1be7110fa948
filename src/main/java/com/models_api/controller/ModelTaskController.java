package com.models_api.controller;

import com.models_api.dto.response.GenericResponse;
import com.models_api.dto.task.TaskResultDTO;
import com.models_api.dto.task.TaskStatusDTO;
import com.models_api.service.ModelsDBBackgroundManager;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/models/{name}/task")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Model Tasks", description = "Track and cancel the background task of a model instance")
public class ModelTaskController {

    private final ModelsDBBackgroundManager modelsBackgroundManager;

    @Operation(summary = "Status of the model's task")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Status returned"),
            @ApiResponse(responseCode = "404", description = "Model instance has not gone through any processing")
    })
    @GetMapping
    public ResponseEntity<GenericResponse<TaskStatusDTO>> getStatus(@PathVariable String name) {
        TaskStatusDTO status = modelsBackgroundManager.getStatus(name);
        log.debug("Task status of [{}]: {}", name, status);
        return ResponseEntity.ok(GenericResponse.success("Task status retrieved successfully", status));
    }

    @Operation(summary = "Result of the model's finished task")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Result returned"),
            @ApiResponse(responseCode = "404", description = "Model instance has not gone through any processing"),
            @ApiResponse(responseCode = "409", description = "Task not finished yet")
    })
    @GetMapping("/result")
    public ResponseEntity<GenericResponse<TaskResultDTO>> getResult(@PathVariable String name) {
        return ResponseEntity.ok(GenericResponse.success("Task result retrieved successfully",
                modelsBackgroundManager.getResult(name)));
    }

    @Operation(summary = "Cancel the model's task", description = "Pending tasks are cancelled at once, running tasks at their next checkpoint")
    @PutMapping("/cancel")
    public ResponseEntity<GenericResponse<TaskStatusDTO>> cancel(@PathVariable String name) {
        return ResponseEntity.ok(GenericResponse.success("Task stop requested", modelsBackgroundManager.cancel(name)));
    }

    @Operation(summary = "Forget the model's finished task")
    @DeleteMapping
    public ResponseEntity<GenericResponse<String>> evict(@PathVariable String name) {
        modelsBackgroundManager.evict(name);
        return ResponseEntity.ok(GenericResponse.success("Task evicted", name));
    }
}
