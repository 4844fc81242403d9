package com.wall.infrastructure.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springdoc.core.customizers.OperationCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    private static final String REQUEST_ID_HEADER = "X-Request-Id";

    @Bean
    public OpenAPI customOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Wall API")
                        .version("1.0")
                        .description("Public wall: posts, comments and a cached feed"));
    }

    @Bean
    public OperationCustomizer documentRequestIdHeader() {
        return (operation, handlerMethod) -> {
            if (operation.getDescription() == null) {
                operation.setDescription("Every response echoes the " + REQUEST_ID_HEADER
                        + " header, generated when the request carries none.");
            }
            return operation;
        };
    }
}
