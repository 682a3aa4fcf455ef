package com.al.hl7generator.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI/Swagger configuration for auto-generated API documentation.
 * Access Swagger UI at: /swagger-ui.html
 * Access OpenAPI JSON at: /v3/api-docs
 */
@Configuration
public class OpenApiConfig {

        @Value("${spring.application.name:HL7MessageGenerator}")
        private String applicationName;

        @Bean
        public OpenAPI customOpenAPI() {
                return new OpenAPI()
                                .info(new Info()
                                                .title(applicationName + " API")
                                                .version("1.0.0")
                                                .description("""
                                                                Schema-driven generator of synthetic HL7 v2.3 messages.

                                                                ## Features
                                                                - **Trigger Events**: ADT, ORM, ORU and RDE structures read from JSON schemas
                                                                - **Clinical Context**: patient, encounter, order and observation data flow into the message
                                                                - **Temporal Coherence**: related timestamps stay in a plausible order
                                                                - **Reproducibility**: a fixed seed reproduces the same message
                                                                """)
                                                .contact(new Contact()
                                                                .name("HL7MessageGenerator Team")
                                                                .email("support@example.com"))
                                                .license(new License()
                                                                .name("Proprietary License")
                                                                .url("https://example.com/licensing")))
                                .servers(List.of(
                                                new Server()
                                                                .url("http://localhost:8080")
                                                                .description("Local Development")))
                                .tags(List.of(
                                                new Tag().name("Generation")
                                                                .description("HL7 v2 message generation endpoints")));
        }
}
