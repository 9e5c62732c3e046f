package com.ogt.crm.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    public static final String TAG_MIGRATION = "migration";
    public static final String TAG_PROGRESS = "progress";
    public static final String TAG_ANALYSIS = "analysis";

    @Bean
    public OpenAPI crmMigrationOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("CRM Migration Service API")
                        .description("Análisis de la planilla CRM legada, sugerencias de mapeo y control de la migración con progreso en vivo (SSE).")
                        .version("1.0"))
                .tags(List.of(
                        new Tag().name(TAG_MIGRATION).description("start / pause / abort / status y estadísticas"),
                        new Tag().name(TAG_PROGRESS).description("Canal SSE de progreso (ping cada 30s)"),
                        new Tag().name(TAG_ANALYSIS).description("Detección de encabezados y sugerencias de mapeo, sin escribir datos")
                ));
    }
}
