package com.jreinhal.querygate.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import io.swagger.v3.oas.models.servers.Server;
import io.swagger.v3.oas.models.tags.Tag;
import java.util.List;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * API documentation at /swagger-ui.html.
 */
@Configuration
public class OpenApiConfig {

    @Value("${app.auth-mode:DEV}")
    private String authMode;

    @Bean
    public OpenAPI queryGateOpenAPI() {
        return new OpenAPI()
                .info(apiInfo())
                .components(securityComponents())
                .security(List.of(
                        new SecurityRequirement().addList("operatorHeader"),
                        new SecurityRequirement().addList("gatewayToken")
                ))
                .servers(List.of(
                        new Server().url("/").description("Current Server")
                ))
                .tags(List.of(
                        new Tag().name("Query").description("Questions over permitted business data"),
                        new Tag().name("System").description("Liveness")
                ));
    }

    private Info apiInfo() {
        return new Info()
                .title("QueryGate API")
                .description("""
                        **QueryGate** answers questions over operational records using only the data the caller's
                        role, tenant and sites allow. Answers are templated from retrieved records.

                        ## Authentication Modes
                        - **DEV**: loopback only, identity from X-Operator-Id / X-Tenant-Id / X-Role / X-Site-Ids
                        - **GATEWAY**: the same headers forwarded by an authenticating gateway with X-Gateway-Token

                        ## Current Mode: `%s`
                        """.formatted(authMode))
                .version("1.0.0");
    }

    private Components securityComponents() {
        return new Components()
                .addSecuritySchemes("operatorHeader",
                        new SecurityScheme()
                                .type(SecurityScheme.Type.APIKEY)
                                .in(SecurityScheme.In.HEADER)
                                .name("X-Operator-Id")
                                .description("Caller id (DEV and GATEWAY modes)"))
                .addSecuritySchemes("gatewayToken",
                        new SecurityScheme()
                                .type(SecurityScheme.Type.APIKEY)
                                .in(SecurityScheme.In.HEADER)
                                .name("X-Gateway-Token")
                                .description("Shared secret of the fronting gateway (GATEWAY mode)"));
    }
}
