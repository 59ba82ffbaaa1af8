package com.eyelevel.docpipeline.consumer;

import com.eyelevel.docpipeline.collaborator.ResultLocator;
import com.eyelevel.docpipeline.common.json.JsonParser;
import com.eyelevel.docpipeline.consumer.dto.S3EventNotification;
import com.eyelevel.docpipeline.exception.ExecutionStoreException;
import com.eyelevel.docpipeline.exception.MessageProcessingFailedException;
import com.eyelevel.docpipeline.exception.json.JsonParsingException;
import com.eyelevel.docpipeline.model.DocumentRef;
import com.eyelevel.docpipeline.model.ExecutionId;
import com.eyelevel.docpipeline.orchestrator.PipelineOrchestrator;
import io.awspring.cloud.sqs.annotation.SqsListener;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;

/**
 * Listens for S3 object-created notifications and starts the pipeline for every new document.
 * <p>
 * Duplicate notifications are harmless because starting is idempotent per document. Objects written by the
 * pipeline itself (under the results prefix) are ignored so that publishing a result never re-triggers it.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DocumentTriggerConsumer {

    private final PipelineOrchestrator orchestrator;
    private final ResultLocator resultLocator;
    private final JsonParser jsonParser;

    /**
     * @param message The raw SQS message body, an S3 event notification document.
     * @throws MessageProcessingFailedException if the execution store is unavailable, so that SQS redelivers.
     */
    @SqsListener(value = "${aws.sqs.trigger-queue-name}", factory = "triggerContainerFactory")
    public void onObjectCreated(@Payload final String message) {
        log.debug("Received message on trigger queue: {}", message);

        final S3EventNotification notification;
        try {
            notification = jsonParser.parseObject(message, S3EventNotification.class);
        } catch (JsonParsingException e) {
            log.error("[FATAL] Trigger message is not a valid S3 event notification. Message will be dropped. "
                              + "Payload: {}", message);
            return;
        }

        if (notification.isTestEvent()) {
            log.info("Received S3 test event; acknowledging.");
            return;
        }
        if (notification.getRecords() == null || notification.getRecords().isEmpty()) {
            log.warn("S3 event notification contains no records. Message will be dropped. Payload: {}", message);
            return;
        }

        for (final S3EventNotification.EventRecord eventRecord : notification.getRecords()) {
            final DocumentRef document = toDocumentRef(eventRecord);
            if (document == null) {
                log.warn("Skipping S3 event record without bucket or key: {}", eventRecord);
                continue;
            }
            if (resultLocator.isResultKey(document.key())) {
                log.debug("Ignoring pipeline output object {}", document);
                continue;
            }
            try {
                final ExecutionId executionId = orchestrator.start(document);
                log.info("Trigger for {} handed to execution {}", document, executionId);
            } catch (ExecutionStoreException e) {
                log.error("Could not start execution for {}. Re-throwing to trigger SQS retry.", document, e);
                throw new MessageProcessingFailedException("Starting execution failed for " + document, e);
            }
        }
    }

    private static DocumentRef toDocumentRef(final S3EventNotification.EventRecord eventRecord) {
        final S3EventNotification.S3Entity s3 = eventRecord.getS3();
        if (s3 == null || s3.getBucket() == null || s3.getObject() == null) {
            return null;
        }
        final String bucket = s3.getBucket().getName();
        final String rawKey = s3.getObject().getKey();
        if (!StringUtils.hasText(bucket) || !StringUtils.hasText(rawKey)) {
            return null;
        }
        return new DocumentRef(bucket, URLDecoder.decode(rawKey, StandardCharsets.UTF_8));
    }
}
