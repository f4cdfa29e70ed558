package com.fintech.subscriptions.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI subscriptionTrackerOpenAPI(@Value("${server.port:3020}") int port) {
        return new OpenAPI()
                .info(new Info()
                        .title("Subscription Tracker API")
                        .description("Health and status endpoints of the service that watches ledger payment accounts for subscription transfers and maintains subscription windows.")
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("FinTech Team")
                                .email("fintech@example.com")))
                .servers(List.of(
                        new Server().url("http://localhost:" + port).description("Local health check server")
                ));
    }
}
