package com.models_api.helper;

import com.models_api.dto.model.ModelMetadata;
import com.models_api.exception.AlreadyExistsException;
import com.models_api.exception.NotFoundException;
import com.models_api.exception.ValidationException;
import com.models_api.plugin.ModelTypeRegistry;

import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Checks consulted before any model operation. Name validation always runs because names
 * become file names; the remaining checks can be switched off.
 */
public class ModelsHandler {

    private static final Pattern NAME_PATTERN = Pattern.compile("^[A-Za-z0-9][A-Za-z0-9_-]{0,127}$");

    private final boolean enabled;

    public ModelsHandler() {
        this(true);
    }

    public ModelsHandler(boolean enabled) {
        this.enabled = enabled;
    }

    public boolean isValidName(String name) {
        return name != null && NAME_PATTERN.matcher(name).matches();
    }

    public void handleName(String name) {
        if (!isValidName(name)) {
            throw new ValidationException("Invalid model instance name: " + name);
        }
    }

    public void handleCreate(String name, String type, boolean exists, boolean overwrite, ModelTypeRegistry registry) {
        handleName(name);
        if (enabled) {
            if (!registry.contains(type)) {
                throw new ValidationException("Model type not found: " + type);
            }
            if (exists && !overwrite) {
                throw new AlreadyExistsException("Model instance already exists: " + name);
            }
        }
    }

    public void handleRead(String name, boolean exists) {
        handleName(name);
        if (enabled && !exists) {
            throw new NotFoundException("Model instance not found: " + name);
        }
    }

    public void handleData(List<Map<String, Object>> data) {
        if (enabled && data == null) {
            throw new ValidationException("Data rows are required");
        }
    }

    public void handleMetadata(Map<String, Object> metadata) {
        if (enabled) {
            if (metadata == null || metadata.isEmpty()) {
                throw new ValidationException("Metadata is required");
            }
            for (String key : metadata.keySet()) {
                if (!ModelMetadata.EDITABLE_FIELDS.contains(key)) {
                    throw new ValidationException("Metadata field cannot be updated: " + key);
                }
            }
        }
    }
}
