package com.models_api.plugin;

import com.models_api.dto.model.ModelTypeDTO;
import com.models_api.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Startup-time registry mapping a model type tag to its {@link ModelPlugin}.
 */
@Component
@Slf4j
public class ModelTypeRegistry {

    private final Map<String, ModelPlugin<?>> plugins = new LinkedHashMap<>();

    public ModelTypeRegistry(List<ModelPlugin<?>> plugins) {
        for (ModelPlugin<?> plugin : plugins) {
            ModelPlugin<?> previous = this.plugins.putIfAbsent(plugin.getType(), plugin);
            if (previous != null) {
                throw new IllegalStateException("Duplicate model type '" + plugin.getType() + "': "
                        + previous.getClass().getName() + " and " + plugin.getClass().getName());
            }
            log.info("🧩 Registered model type [{}] -> {}", plugin.getType(), plugin.getClass().getSimpleName());
        }
    }

    public boolean contains(String type) {
        return type != null && plugins.containsKey(type);
    }

    @SuppressWarnings("unchecked")
    public ModelPlugin<Object> get(String type) {
        ModelPlugin<?> plugin = type == null ? null : plugins.get(type);
        if (plugin == null) {
            throw new ValidationException("Model type not found: " + type);
        }
        return (ModelPlugin<Object>) plugin;
    }

    public List<ModelTypeDTO> describe() {
        return plugins.values().stream()
                .map(p -> new ModelTypeDTO(p.getType(), p.getDescription()))
                .sorted(Comparator.comparing(ModelTypeDTO::type))
                .toList();
    }
}
