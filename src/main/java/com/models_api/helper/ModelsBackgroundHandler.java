package com.models_api.helper;

import com.models_api.dto.task.TaskRecord;
import com.models_api.exception.ConflictException;
import com.models_api.exception.NotFoundException;

public class ModelsBackgroundHandler extends ModelsHandler {

    public ModelsBackgroundHandler() {
        super();
    }

    public ModelsBackgroundHandler(boolean enabled) {
        super(enabled);
    }

    public void handleProcessing(String name, TaskRecord record) {
        if (record != null && !record.isTerminal()) {
            throw new ConflictException("Model instance still processing: " + name + " (task " + record.getTaskId() + ")");
        }
    }

    public void handleReadState(String name, TaskRecord record) {
        if (record == null) {
            throw new NotFoundException("Model instance has not gone through any processing: " + name);
        }
    }

    public void handleCancel(String name, TaskRecord record) {
        handleReadState(name, record);
        if (record.isTerminal()) {
            throw new ConflictException("Model instance is not processing: " + name);
        }
    }
}
