package com.letterdesk.reviewcore.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Value("${server.port:8080}")
    private String serverPort;

    @Bean
    public OpenAPI letterDeskOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("LetterDesk Review API")
                        .description("""
                                Drafts legal letters from intake facts and routes them through attorney review.

                                ## Flow
                                - Subscribers spend one letter credit per generation request
                                - Drafts land in the review queue as `pending_review`
                                - Attorney admins claim, then approve or reject with a reason
                                - Rejected letters can be revised and resubmitted

                                ## Authentication
                                All protected endpoints require a Bearer token. Use `/auth/login` to obtain one.
                                """)
                        .version("1.0.0"))
                .servers(List.of(new Server()
                        .url("http://localhost:" + serverPort)
                        .description("Local Development Server")))
                .addSecurityItem(new SecurityRequirement().addList("Bearer Authentication"))
                .components(new Components()
                        .addSecuritySchemes("Bearer Authentication",
                                new SecurityScheme()
                                        .type(SecurityScheme.Type.HTTP)
                                        .scheme("bearer")
                                        .bearerFormat("JWT")
                                        .description("Enter JWT Bearer token")));
    }
}
