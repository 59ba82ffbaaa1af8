package com.eyelevel.docpipeline;

import org.junit.jupiter.api.Test;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.scheduling.annotation.EnableScheduling;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Checks the features the application class switches on, without starting a context.
 */
class DocumentPipelineApplicationTest {

    @Test
    void applicationClass_enablesSchedulingAndRepositories() {
        assertThat(DocumentPipelineApplication.class.isAnnotationPresent(EnableScheduling.class)).isTrue();
        assertThat(DocumentPipelineApplication.class.getAnnotation(EnableJpaRepositories.class).basePackages())
                .containsExactly("com.eyelevel.docpipeline.repository");
    }

    @Test
    void applicationClass_retriesOnlyThroughRetryTemplates() {
        // no @Retryable beans exist, so no retry proxies are set up
        assertThat(DocumentPipelineApplication.class.isAnnotationPresent(EnableRetry.class)).isFalse();
    }
}
