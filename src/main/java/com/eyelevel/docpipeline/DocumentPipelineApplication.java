package com.eyelevel.docpipeline;

import com.eyelevel.docpipeline.config.PipelineProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.core.env.Environment;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * The main entry point for the Document Pipeline Spring Boot application.
 * <p>
 * This class bootstraps the application context and enables key Spring features:
 * <ul>
 *     <li>{@link SpringBootApplication}: auto-configuration, component scanning and property support.</li>
 *     <li>{@link EnableConfigurationProperties}: binds the "app.pipeline" properties to {@link PipelineProperties}.</li>
 *     <li>{@link EnableScheduling}: activates the stalled-execution recovery job.</li>
 *     <li>{@link EnableJpaRepositories}: configures the base package for the execution record repositories.</li>
 * </ul>
 */
@Slf4j
@EnableScheduling
@SpringBootApplication
@EnableJpaRepositories(basePackages = "com.eyelevel.docpipeline.repository")
@EnableConfigurationProperties(value = PipelineProperties.class)
public class DocumentPipelineApplication {

    public static void main(final String[] args) {
        log.info("🚀 Starting DocumentPipelineApplication...");

        final ConfigurableApplicationContext context = SpringApplication.run(DocumentPipelineApplication.class, args);
        final Environment env = context.getEnvironment();

        log.info("------------------------------------------------------------------");
        log.info("Application '{}' is now running!", env.getProperty("spring.application.name", "DocumentPipeline"));
        log.info("  - Local:      http://localhost:{}", env.getProperty("server.port", "8080"));
        log.info("  - Worker ID:  {}", env.getProperty("app.pipeline.worker-id", "<generated>"));
        log.info("  - Profile(s): {}", String.join(", ", env.getActiveProfiles().length > 0
                ? env.getActiveProfiles()
                : new String[]{"default"}));
        log.info("------------------------------------------------------------------");
    }
}
