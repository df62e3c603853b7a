package com.healthtech.glucose.config;

import io.swagger.v3.oas.models.ExternalDocumentation;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * API documentation, served at /swagger-ui.html and /v3/api-docs.
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI glucoseHistoryOpenAPI(@Value("${spring.application.name:glucose-history-service}") String appName) {
        return new OpenAPI()
                .info(new Info()
                        .title(appName)
                        .version("1.0.0")
                        .description("""
                                Per-minute glucose averages for completed days, backfilled from Nightscout.

                                A day fetched without usable readings is reported as `checked_empty`;
                                a day the backfill has not reached yet is reported as `no_data`.
                                Today is never served because it is not complete.
                                """))
                .tags(List.of(
                        new Tag().name("Glucose Averages").description("Stored minute averages by day"),
                        new Tag().name("Monitoring").description("Backfill watermark and store health")))
                .externalDocs(new ExternalDocumentation()
                        .description("Nightscout entries API")
                        .url("https://nightscout.github.io/nightscout/setup_variables/"));
    }
}
