package com.pricelens.engine.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.PathItem;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import org.springdoc.core.customizers.OpenApiCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {
    private static final String ADMIN_KEY = "adminKey";

    @Bean
    public OpenAPI priceEngineOpenAPI() {
        SecurityScheme adminKeyScheme = new SecurityScheme()
                .type(SecurityScheme.Type.APIKEY)
                .in(SecurityScheme.In.HEADER)
                .name("x-admin-key");

        return new OpenAPI()
                .info(new Info()
                        .title("PriceLens Price Engine API")
                        .version("0.1.0")
                        .description("Catalog import, competitor matching, price recommendations and their review lifecycle."))
                .components(new Components().addSecuritySchemes(ADMIN_KEY, adminKeyScheme));
    }

    /** Every mutating operation, plus the audit trail, requires the admin key. */
    @Bean
    public OpenApiCustomizer adminSecurityCustomizer() {
        return openAPI -> {
            if (openAPI.getPaths() == null) return;
            SecurityRequirement adminRequirement = new SecurityRequirement().addList(ADMIN_KEY);
            openAPI.getPaths().forEach((path, item) -> {
                addToMutations(item, adminRequirement);
                if (path.endsWith("/audit") && item.getGet() != null) {
                    item.getGet().addSecurityItem(adminRequirement);
                }
            });
        };
    }

    private static void addToMutations(PathItem item, SecurityRequirement requirement) {
        if (item.getPost() != null) item.getPost().addSecurityItem(requirement);
        if (item.getPut() != null) item.getPut().addSecurityItem(requirement);
        if (item.getPatch() != null) item.getPatch().addSecurityItem(requirement);
        if (item.getDelete() != null) item.getDelete().addSecurityItem(requirement);
    }
}
