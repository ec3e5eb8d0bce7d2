package com.securepower.antitheft.config;

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

    @Value("${server.port:8080}")
    private String serverPort;

    @Bean
    public OpenAPI securePowerOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("SecurePower Core API")
                        .description("""
                                Escalation and alerting engine behind SecurePower anti-theft protection.
                                
                                ## Features
                                - PIN / password gate in front of device power-off
                                - Graduated lockout after repeated wrong credentials
                                - SMS, e-mail and push alerts to trusted contacts
                                - Bounded, time-limited location tracking sessions
                                
                                ## Callers
                                The device app submits credentials and trigger reports; the location
                                producer streams points into the tracking session of an active alert.
                                """)
                        .version("0.1.0")
                        .contact(new Contact()
                                .name("SecurePower Team")
                                .url("https://securepower.app/support")))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Local Development Server")));
    }
}
