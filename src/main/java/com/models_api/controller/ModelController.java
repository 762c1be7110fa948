package com.models_api.controller;

import com.models_api.config.ModelsProperties;
import com.models_api.dto.model.ModelInstanceDTO;
import com.models_api.dto.model.ModelTypeDTO;
import com.models_api.dto.request.model.ModelCreateRequest;
import com.models_api.dto.request.model.ModelDataRequest;
import com.models_api.dto.request.model.ModelTableRequest;
import com.models_api.dto.response.GenericResponse;
import com.models_api.exception.ValidationException;
import com.models_api.service.ModelsDBBackgroundManager;
import com.models_api.service.ModelsManager;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/models")
@Slf4j
@Tag(name = "Models", description = "Create, train and query model instances")
public class ModelController {

    private final ModelsManager modelsManager;
    private final ModelsDBBackgroundManager modelsBackgroundManager;
    private final ModelsProperties properties;

    @Operation(summary = "List model instances", description = "Names of every model instance stored in the models folder")
    @GetMapping
    public ResponseEntity<GenericResponse<List<String>>> list() {
        return ResponseEntity.ok(GenericResponse.success("Model instances retrieved successfully", modelsManager.list()));
    }

    @Operation(summary = "List model types")
    @GetMapping("/types")
    public ResponseEntity<GenericResponse<List<ModelTypeDTO>>> types() {
        return ResponseEntity.ok(GenericResponse.success("Model types retrieved successfully", modelsManager.types()));
    }

    @Operation(summary = "Create model instance")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "201", description = "Model instance created"),
            @ApiResponse(responseCode = "400", description = "Invalid name or unknown type"),
            @ApiResponse(responseCode = "409", description = "Model instance already exists or is processing")
    })
    @PostMapping
    public ResponseEntity<GenericResponse<ModelInstanceDTO>> create(@Valid @RequestBody ModelCreateRequest request) {
        ModelInstanceDTO created = modelsBackgroundManager.create(request.getName(), request.getType(),
                request.getSettings(), request.isOverwrite());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(GenericResponse.success("Model instance created successfully", created));
    }

    @Operation(summary = "Get model instance")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Model instance found"),
            @ApiResponse(responseCode = "404", description = "Model instance not found")
    })
    @GetMapping("/{name}")
    public ResponseEntity<GenericResponse<ModelInstanceDTO>> get(@PathVariable String name) {
        return ResponseEntity.ok(GenericResponse.success("Model instance retrieved successfully", modelsManager.get(name)));
    }

    @Operation(summary = "Train model instance in the background")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "202", description = "Task submitted"),
            @ApiResponse(responseCode = "404", description = "Model instance not found"),
            @ApiResponse(responseCode = "409", description = "Model instance still processing")
    })
    @PostMapping("/{name}/input")
    public ResponseEntity<GenericResponse<Map<String, String>>> input(@PathVariable String name,
                                                                      @Valid @RequestBody ModelDataRequest request) {
        String taskId = modelsBackgroundManager.input(name, request.getData(), request.getOptions(), priority(request));
        return accepted("Input task submitted", taskId);
    }

    @Operation(summary = "Predict with model instance", description = "Runs synchronously and returns one output row per input row")
    @PostMapping("/{name}/output")
    public ResponseEntity<GenericResponse<List<Map<String, Object>>>> output(@PathVariable String name,
                                                                             @Valid @RequestBody ModelDataRequest request) {
        List<Map<String, Object>> rows = modelsManager.output(name, request.getData(), request.getOptions());
        return ResponseEntity.ok(GenericResponse.success("Output produced successfully", rows));
    }

    @Operation(summary = "Predict with model instance in the background")
    @PostMapping("/{name}/output/task")
    public ResponseEntity<GenericResponse<Map<String, String>>> outputTask(@PathVariable String name,
                                                                          @Valid @RequestBody ModelDataRequest request) {
        String taskId = modelsBackgroundManager.output(name, request.getData(), request.getOptions(), priority(request));
        return accepted("Output task submitted", taskId);
    }

    @Operation(summary = "Train model instance from a table in the background")
    @PostMapping("/{name}/input/table")
    public ResponseEntity<GenericResponse<Map<String, String>>> inputTable(@PathVariable String name,
                                                                          @Valid @RequestBody ModelTableRequest request) {
        String taskId = modelsBackgroundManager.inputDb(name, request.getTable(), request.getOptions());
        return accepted("Table input task submitted", taskId);
    }

    @Operation(summary = "Predict from one table into another in the background")
    @PostMapping("/{name}/output/table")
    public ResponseEntity<GenericResponse<Map<String, String>>> outputTable(@PathVariable String name,
                                                                           @Valid @RequestBody ModelTableRequest request) {
        if (request.getOutputTable() == null || request.getOutputTable().isBlank()) {
            throw new ValidationException("outputTable is required");
        }
        String taskId = modelsBackgroundManager.updateDb(name, request.getTable(), request.getOutputTable(),
                request.getOptions());
        return accepted("Table output task submitted", taskId);
    }

    @Operation(summary = "Update model metadata in the background",
            description = "Only title, description, tags and source can be changed")
    @PatchMapping("/{name}/metadata")
    public ResponseEntity<GenericResponse<Map<String, String>>> updateMetadata(@PathVariable String name,
                                                                              @RequestBody Map<String, Object> metadata) {
        return accepted("Update task submitted", modelsBackgroundManager.update(name, metadata));
    }

    @Operation(summary = "Delete model instance in the background")
    @DeleteMapping("/{name}")
    public ResponseEntity<GenericResponse<Map<String, String>>> delete(@PathVariable String name) {
        return accepted("Delete task submitted", modelsBackgroundManager.delete(name));
    }

    private int priority(ModelDataRequest request) {
        return request.getPriority() == null ? properties.getBackground().getDefaultPriority() : request.getPriority();
    }

    private static ResponseEntity<GenericResponse<Map<String, String>>> accepted(String message, String taskId) {
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(GenericResponse.accepted(message, taskId));
    }
}
