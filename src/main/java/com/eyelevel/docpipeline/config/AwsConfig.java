package com.eyelevel.docpipeline.config;

import com.eyelevel.docpipeline.stage.impl.AnalysisStage;
import com.eyelevel.docpipeline.stage.impl.PersistenceStage;
import com.eyelevel.docpipeline.stage.impl.TextExtractionStage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.core.env.Profiles;
import org.springframework.util.StringUtils;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.core.retry.RetryMode;
import software.amazon.awssdk.core.retry.RetryPolicy;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.comprehend.ComprehendClient;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.sqs.SqsAsyncClient;
import software.amazon.awssdk.services.textract.TextractClient;

import java.time.Duration;

/**
 * Configures the AWS SDK clients used by the pipeline: S3 for results, Textract for OCR, Comprehend for
 * sentiment and SQS for trigger events. The credential strategy depends on the active Spring profile.
 */
@Slf4j
@Configuration
public class AwsConfig {

    @Value("${aws.region}")
    private String awsRegion;

    @Value("${aws.access-key:}")
    private String accessKey;

    @Value("${aws.secret-key:}")
    private String secretKey;

    @Value("${aws.retry-count:3}")
    private int retryCount;

    /**
     * Static keys for the 'local' profile, the default provider chain (IAM role) everywhere else.
     */
    @Bean
    public AwsCredentialsProvider awsCredentialsProvider(final Environment environment) {
        if (environment.acceptsProfiles(Profiles.of("local"))) {
            log.info("Local profile active. Using StaticCredentialsProvider.");
            if (!StringUtils.hasText(accessKey) || !StringUtils.hasText(secretKey)) {
                throw new IllegalArgumentException(
                        "aws.access-key and aws.secret-key must be set for the 'local' profile.");
            }
            return StaticCredentialsProvider.create(AwsBasicCredentials.create(accessKey, secretKey));
        }
        log.info("Non-local profile active. Using DefaultCredentialsProvider (for IAM role).");
        return DefaultCredentialsProvider.create();
    }

    /**
     * Shared SDK-level retry policy. These retries happen inside a single stage attempt; the stage retry budget
     * applies on top of them.
     */
    @Bean
    public ClientOverrideConfiguration clientOverrideConfiguration() {
        final RetryPolicy retryPolicy = RetryPolicy.forRetryMode(RetryMode.ADAPTIVE).toBuilder()
                .numRetries(retryCount)
                .build();
        return ClientOverrideConfiguration.builder().retryPolicy(retryPolicy).build();
    }

    /**
     * Settings for the client a stage calls. The SDK gives up on the call, its own retries included, before the
     * stage timeout abandons the attempt, so no request of a timed-out attempt is left running.
     */
    static ClientOverrideConfiguration forStage(final ClientOverrideConfiguration base,
                                                final PipelineProperties properties, final String stageName) {
        return properties.getStages().stream()
                .filter(stage -> stageName.equals(stage.getName()))
                .map(PipelineProperties.Stage::getTimeout)
                .findFirst()
                .map(timeout -> base.toBuilder().apiCallTimeout(apiCallTimeoutWithin(timeout)).build())
                .orElse(base);
    }

    /**
     * Nine tenths of the stage timeout.
     */
    static Duration apiCallTimeoutWithin(final Duration stageTimeout) {
        return stageTimeout.minus(stageTimeout.dividedBy(10));
    }

    @Bean
    public S3Client s3Client(final AwsCredentialsProvider credentialsProvider,
                             final ClientOverrideConfiguration clientOverrideConfig,
                             final PipelineProperties properties) {
        log.info("Configuring AWS S3Client for region: {}", awsRegion);
        return S3Client.builder().credentialsProvider(credentialsProvider).region(Region.of(awsRegion))
                .overrideConfiguration(forStage(clientOverrideConfig, properties, PersistenceStage.NAME)).build();
    }

    @Bean
    public TextractClient textractClient(final AwsCredentialsProvider credentialsProvider,
                                         final ClientOverrideConfiguration clientOverrideConfig,
                                         final PipelineProperties properties) {
        log.info("Configuring AWS TextractClient for region: {}", awsRegion);
        return TextractClient.builder().credentialsProvider(credentialsProvider).region(Region.of(awsRegion))
                .overrideConfiguration(forStage(clientOverrideConfig, properties, TextExtractionStage.NAME)).build();
    }

    @Bean
    public ComprehendClient comprehendClient(final AwsCredentialsProvider credentialsProvider,
                                             final ClientOverrideConfiguration clientOverrideConfig,
                                             final PipelineProperties properties) {
        log.info("Configuring AWS ComprehendClient for region: {}", awsRegion);
        return ComprehendClient.builder().credentialsProvider(credentialsProvider).region(Region.of(awsRegion))
                .overrideConfiguration(forStage(clientOverrideConfig, properties, AnalysisStage.NAME)).build();
    }

    @Bean
    public SqsAsyncClient sqsAsyncClient(final AwsCredentialsProvider credentialsProvider) {
        log.info("Configuring AWS SqsAsyncClient for region: {}", awsRegion);
        return SqsAsyncClient.builder().region(Region.of(awsRegion)).credentialsProvider(credentialsProvider).build();
    }
}
