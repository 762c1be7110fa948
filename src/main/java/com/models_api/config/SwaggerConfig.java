package com.models_api.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class SwaggerConfig {

    @Bean
    public OpenAPI modelsOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Models API")
                        .version("0.1.0")
                        .description("Create, train and query file-backed model instances, synchronously or as background tasks.")
                        .license(new License()
                                .name("Apache 2.0")
                                .url("https://www.apache.org/licenses/LICENSE-2.0.html")))
                .servers(List.of(
                        new Server().url("http://localhost:8080").description("Local server")
                ));
    }

    @Bean
    public GroupedOpenApi modelsGroupedApi() {
        return GroupedOpenApi.builder()
                .group("Models APIs")
                .pathsToMatch("/api/**")
                .build();
    }
}
