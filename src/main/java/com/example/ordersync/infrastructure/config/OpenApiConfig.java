package com.example.ordersync.infrastructure.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * OpenAPI documentation, split into the ingestion and query groups.
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI orderSyncServiceOpenAPI(@Value("${spring.application.name}") String applicationName) {
        return new OpenAPI()
                .info(new Info()
                        .title(applicationName)
                        .version("1.0.0")
                        .description("""
                                Keeps order aggregates in step with lifecycle events from the delivery system.

                                A batch response lists only the messages to redeliver. Failures are classified as:

                                | Failure | Redelivered |
                                |---|---|
                                | Malformed message | no |
                                | Event for an unknown order | no |
                                | Forbidden, redundant or stale transition | no |
                                | Transition not ready yet | yes |
                                | Store failure, time limit or batch deadline | yes |
                                """));
    }

    @Bean
    public GroupedOpenApi ingestionApi() {
        return GroupedOpenApi.builder()
                .group("ingestion")
                .pathsToMatch("/api/order-sync/**")
                .build();
    }

    @Bean
    public GroupedOpenApi queryApi() {
        return GroupedOpenApi.builder()
                .group("orders")
                .pathsToMatch("/api/orders/**")
                .build();
    }
}
