package com.chatdesk.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.parser.OpenAPIV3Parser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

@Slf4j
@Configuration
public class OpenApiConfig {

    static final String DOCUMENT_LOCATION = "api/openapi.yaml";

    @Bean
    public OpenAPI customOpenAPI() {
        try {
            ClassPathResource resource = new ClassPathResource(DOCUMENT_LOCATION);
            String yamlContent = new String(resource.getInputStream().readAllBytes(), StandardCharsets.UTF_8);

            OpenAPI document = new OpenAPIV3Parser().readContents(yamlContent, null, null).getOpenAPI();
            if (document != null) {
                return document;
            }
            log.warn("Could not parse {}, serving a minimal API description", DOCUMENT_LOCATION);
        } catch (IOException e) {
            log.warn("Could not read {}, serving a minimal API description", DOCUMENT_LOCATION, e);
        }
        return new OpenAPI()
                .info(new Info()
                        .title("Chatdesk Realtime API")
                        .description("Webhook ingestion and realtime delivery endpoints")
                        .version("1.0.0"));
    }
}
