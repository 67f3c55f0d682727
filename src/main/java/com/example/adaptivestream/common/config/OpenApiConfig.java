package com.example.adaptivestream.common.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import io.swagger.v3.oas.models.tags.Tag;
import org.springdoc.core.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    private static final String API_TOKEN_SCHEME = "apiToken";

    @Bean
    public OpenAPI adaptiveStreamOpenApi(AppQualityProperties appQualityProperties) {
        StringBuilder tiers = new StringBuilder();
        for (AppQualityProperties.Tier tier : appQualityProperties.getTiers()) {
            if (tiers.length() > 0) {
                tiers.append(", ");
            }
            tiers.append(tier.getHeight()).append('p');
        }
        return new OpenAPI()
                .info(new Info()
                        .title("Adaptive Stream API")
                        .description("Delivery sessions over several content providers. Quality tiers: " + tiers)
                        .version("v1"))
                .addTagsItem(new Tag().name("sessions").description("Load, seek, quality and buffered segments"))
                .addTagsItem(new Tag().name("providers").description("Provider scores and overrides"))
                .addSecurityItem(new SecurityRequirement().addList(API_TOKEN_SCHEME))
                .components(new Components()
                        .addSecuritySchemes(API_TOKEN_SCHEME,
                                new SecurityScheme()
                                        .type(SecurityScheme.Type.HTTP)
                                        .scheme("bearer")
                                        .description("Static token from app.security.api-token")));
    }

    @Bean
    public GroupedOpenApi sessionApi() {
        return GroupedOpenApi.builder().group("sessions").pathsToMatch("/api/v1/sessions/**").build();
    }

    @Bean
    public GroupedOpenApi providerApi() {
        return GroupedOpenApi.builder().group("providers").pathsToMatch("/api/v1/providers/**").build();
    }
}
