package com.models_api.unit_tests.plugin;

import com.models_api.dto.model.ModelTypeDTO;
import com.models_api.exception.ValidationException;
import com.models_api.plugin.DemoModelPlugin;
import com.models_api.plugin.ModelPlugin;
import com.models_api.plugin.ModelTypeRegistry;
import com.models_api.plugin.WekaModelPlugin;
import com.models_api.testsupport.CountingModelPlugin;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ModelTypeRegistryTest {

    @Test
    void describe_ListsTypesSorted() {
        ModelTypeRegistry registry = new ModelTypeRegistry(List.<ModelPlugin<?>>of(new WekaModelPlugin(), new DemoModelPlugin()));

        assertThat(registry.describe()).extracting(ModelTypeDTO::type).containsExactly("demo", "weka");
        assertThat(registry.contains("demo")).isTrue();
        assertThat(registry.contains(null)).isFalse();
    }

    @Test
    void get_UnknownTypeIsValidationError() {
        ModelTypeRegistry registry = new ModelTypeRegistry(List.<ModelPlugin<?>>of(new DemoModelPlugin()));

        assertThatThrownBy(() -> registry.get("weka"))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Model type not found: weka");
    }

    @Test
    void constructor_RejectsDuplicateTypes() {
        assertThatThrownBy(() -> new ModelTypeRegistry(List.<ModelPlugin<?>>of(new DemoModelPlugin(), new CountingModelPlugin())))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Duplicate model type 'demo'");
    }
}
