package com.baykanat.triggers.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/** OpenAPI / Swagger UI bean tanımı. */
@Configuration
public class OpenApiConfig {

    private static final String API_KEY_SCHEME = "apiKey";

    @Bean
    public OpenAPI triggersOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("Triggers - Event Ingestion & Webhook Delivery API")
                        .description("""
                                Accepts account-scoped events, deduplicates them by idempotency key, \
                                and delivers them to matching webhook subscriptions with signed requests, \
                                retries, a dead-letter queue, replay, a pull inbox and a live stream.\
                                """)
                        .version("1.0.0"))
                .components(new Components().addSecuritySchemes(API_KEY_SCHEME, new SecurityScheme()
                        .type(SecurityScheme.Type.HTTP)
                        .scheme("bearer")
                        .description("API key; X-API-Key header is accepted as well")))
                .addSecurityItem(new SecurityRequirement().addList(API_KEY_SCHEME))
                .servers(List.of(
                        new Server().url("http://localhost:8080").description("Local Development")
                ));
    }
}
