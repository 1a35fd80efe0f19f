package com.example.inboxsync.config;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@OpenAPIDefinition(
        info = @Info(
                title = "Messaging Sync API",
                version = "0.1",
                description = "Webhook intake, historical backfill and attachment access for the synchronized inbox."),
        tags = {
                @Tag(name = "webhooks", description = "Platform push events"),
                @Tag(name = "sync", description = "Backfill control and attachment access")
        })
public class OpenApiConfig {

    @Bean
    public GroupedOpenApi webhookApi() {
        return GroupedOpenApi.builder()
                .group("webhooks")
                .pathsToMatch("/api/webhooks/**")
                .build();
    }

    @Bean
    public GroupedOpenApi syncOperationsApi() {
        return GroupedOpenApi.builder()
                .group("sync")
                .pathsToMatch("/api/accounts/**", "/api/attachments/**", "/api/dev/**")
                .build();
    }
}
