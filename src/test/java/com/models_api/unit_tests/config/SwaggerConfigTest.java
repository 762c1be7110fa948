package com.models_api.unit_tests.config;

import com.models_api.config.SwaggerConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import static org.assertj.core.api.Assertions.assertThat;

class SwaggerConfigTest {

    @Test
    @DisplayName("Should not clash with the application bean name")
    void beans_DoNotOverrideApplicationBean() {
        new ApplicationContextRunner()
                .withBean("modelsApi", Object.class)
                .withUserConfiguration(SwaggerConfig.class)
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    assertThat(context).hasSingleBean(GroupedOpenApi.class);
                    assertThat(context.getBean(GroupedOpenApi.class).getGroup()).isEqualTo("Models APIs");
                });
    }
}
