package com.eyelevel.docpipeline.config;

import io.awspring.cloud.sqs.config.SqsMessageListenerContainerFactory;
import io.awspring.cloud.sqs.listener.acknowledgement.handler.AcknowledgementMode;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.services.sqs.SqsAsyncClient;

import java.time.Duration;

@Configuration
public class SqsListenerConfig {

    /**
     * Container factory for the S3 trigger listener, configured from 'app.sqs.listener.trigger-queue'.
     * Messages are acknowledged only when the listener returns normally, so a failed start is redelivered.
     */
    @Bean("triggerContainerFactory")
    public SqsMessageListenerContainerFactory<Object> triggerContainerFactory(
            final SqsAsyncClient sqsAsyncClient,
            @Value("${app.sqs.listener.trigger-queue.concurrency-limit}") final int concurrency,
            @Value("${app.sqs.listener.trigger-queue.max-messages-per-poll}") final int maxMessagesPerPoll,
            @Value("${app.sqs.listener.trigger-queue.poll-timeout-seconds}") final int pollTimeoutSeconds) {

        final SqsMessageListenerContainerFactory<Object> factory = new SqsMessageListenerContainerFactory<>();
        factory.setSqsAsyncClient(sqsAsyncClient);
        factory.configure(options -> options.acknowledgementMode(AcknowledgementMode.ON_SUCCESS)
                .maxConcurrentMessages(concurrency).maxMessagesPerPoll(maxMessagesPerPoll)
                .pollTimeout(Duration.ofSeconds(pollTimeoutSeconds)));
        return factory;
    }
}
