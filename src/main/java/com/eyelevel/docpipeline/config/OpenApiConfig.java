package com.eyelevel.docpipeline.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.info.BuildProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;

import java.util.Optional;

@Configuration
@Profile("!prod")
@RequiredArgsConstructor
public class OpenApiConfig {

    private final Optional<BuildProperties> buildProperties;

    @Bean
    public OpenAPI customOpenAPI() {
        final String version = buildProperties.map(BuildProperties::getVersion).orElse("<NOT_FOUND>");
        final String appName = buildProperties.map(BuildProperties::getName).orElse("Document Pipeline API");

        return new OpenAPI()
                .info(new Info().title(appName)
                        .version(version)
                        .description("""
                                Operational API of the document pipeline. Every document that lands in the
                                watched bucket runs once through metadata extraction, OCR, sentiment analysis
                                and result publication; progress is checkpointed after each stage.

                                Key features include:
                                * **Idempotent start:** repeated triggers for a document join its existing execution.
                                * **Status:** current stage, attempt count and last error of any execution.
                                * **Control:** cancel, resume, replay and retry-from-stage for individual executions.

                                **Note:** replay and retry rerun external calls and overwrite the published result.
                                """)
                        .contact(new Contact()
                                .name("EyeLevel.ai Support")
                                .url("https://www.eyelevel.ai")));
    }
}
