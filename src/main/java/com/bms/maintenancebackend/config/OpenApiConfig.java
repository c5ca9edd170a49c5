package com.bms.maintenancebackend.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
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
    private int serverPort;

    @Bean
    public OpenAPI maintenanceOpenAPI() {
        final String securitySchemeName = "basicAuth";

        return new OpenAPI()
                .info(new Info()
                        .title("Building Maintenance Backend API")
                        .description("""
                                RESTful API for maintenance scheduling and work-order generation.

                                This API provides endpoints for:
                                - **Maintenance runs**: Materialize tasks from asset schedules and turn due tasks into work orders
                                - **Maintenance tasks**: Inspect due tasks, convert a task manually, cancel tasks
                                - **Complaints**: Convert a tenant complaint into a work order
                                - **Work orders**: Status transitions and completion
                                - **Assets**: Maintenance history and reliability metrics

                                **Real-time Updates**: Work-order changes and run summaries are published over STOMP on `/topic/work-orders` and `/topic/maintenance-runs`.
                                """)
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("Facilities Platform Team")
                                .email("facilities-platform@bms.local")))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Local Development Server")))
                .addSecurityItem(new SecurityRequirement()
                        .addList(securitySchemeName))
                .components(new Components()
                        .addSecuritySchemes(securitySchemeName,
                                new SecurityScheme()
                                        .name(securitySchemeName)
                                        .type(SecurityScheme.Type.HTTP)
                                        .scheme("basic")));
    }
}
