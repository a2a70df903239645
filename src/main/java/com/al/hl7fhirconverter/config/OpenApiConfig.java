package com.al.hl7fhirconverter.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI metadata.
 * Swagger UI: /swagger-ui.html
 * OpenAPI JSON: /v3/api-docs
 */
@Configuration
public class OpenApiConfig {

        @Value("${spring.application.name:hl7-fhir-converter}")
        private String applicationName;

        @Value("${app.version:0.2.0}")
        private String version;

        @Bean
        public OpenAPI customOpenAPI() {
                return new OpenAPI()
                                .info(new Info()
                                                .title(applicationName + " API")
                                                .version(version)
                                                .description("""
                                                                HL7 v2.x (ADT/ORU) to FHIR R4 conversion API.

                                                                ## Endpoints
                                                                - **Convert**: HL7 text to a FHIR collection Bundle
                                                                - **Detailed**: decoded message, Bundle, violations and summary in one response
                                                                - **Parse**: decoded intermediate form only
                                                                - **Validate**: structural checks as a FHIR OperationOutcome
                                                                """))
                                .servers(List.of(
                                                new Server()
                                                                .url("http://localhost:8080")
                                                                .description("Local Development")))
                                .tags(List.of(
                                                new Tag().name("Conversion")
                                                                .description("HL7 v2 to FHIR conversion endpoints")));
        }
}
