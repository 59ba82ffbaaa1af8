package com.eyelevel.docpipeline.collaborator.aws;

import com.eyelevel.docpipeline.collaborator.TextDetector;
import com.eyelevel.docpipeline.exception.PermanentCollaboratorException;
import com.eyelevel.docpipeline.exception.TransientCollaboratorException;
import com.eyelevel.docpipeline.model.DocumentRef;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.textract.TextractClient;
import software.amazon.awssdk.services.textract.model.AccessDeniedException;
import software.amazon.awssdk.services.textract.model.BadDocumentException;
import software.amazon.awssdk.services.textract.model.Block;
import software.amazon.awssdk.services.textract.model.BlockType;
import software.amazon.awssdk.services.textract.model.DetectDocumentTextRequest;
import software.amazon.awssdk.services.textract.model.DetectDocumentTextResponse;
import software.amazon.awssdk.services.textract.model.Document;
import software.amazon.awssdk.services.textract.model.DocumentTooLargeException;
import software.amazon.awssdk.services.textract.model.InternalServerErrorException;
import software.amazon.awssdk.services.textract.model.InvalidParameterException;
import software.amazon.awssdk.services.textract.model.InvalidS3ObjectException;
import software.amazon.awssdk.services.textract.model.ProvisionedThroughputExceededException;
import software.amazon.awssdk.services.textract.model.S3Object;
import software.amazon.awssdk.services.textract.model.ThrottlingException;
import software.amazon.awssdk.services.textract.model.UnsupportedDocumentException;

import java.util.List;

/**
 * {@link TextDetector} backed by Amazon Textract's synchronous {@code DetectDocumentText} API, reading the
 * document straight from S3. Only {@code LINE} blocks are returned, in the order Textract reports them.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TextractTextDetector implements TextDetector {

    private static final String OPERATION = "Textract DetectDocumentText";

    private final TextractClient textractClient;

    @Override
    public List<String> detectText(final DocumentRef document) {
        final DetectDocumentTextRequest request = DetectDocumentTextRequest.builder()
                .document(Document.builder()
                        .s3Object(S3Object.builder().bucket(document.container()).name(document.key()).build())
                        .build())
                .build();

        log.debug("Calling {} for s3://{}", OPERATION, document);
        final DetectDocumentTextResponse response;
        try {
            response = textractClient.detectDocumentText(request);
        } catch (BadDocumentException | UnsupportedDocumentException | DocumentTooLargeException
                 | InvalidS3ObjectException | InvalidParameterException | AccessDeniedException e) {
            throw new PermanentCollaboratorException(
                    OPERATION + " cannot process " + document + ": " + e.getMessage(), e);
        } catch (ThrottlingException | ProvisionedThroughputExceededException | InternalServerErrorException e) {
            throw new TransientCollaboratorException(OPERATION + " is unavailable: " + e.getMessage(), e);
        } catch (SdkException e) {
            throw AwsFailures.classify(OPERATION, e);
        }

        final List<String> lines = response.blocks().stream()
                .filter(block -> block.blockType() == BlockType.LINE)
                .map(Block::text)
                .toList();
        log.debug("{} returned {} blocks, {} lines for {}", OPERATION, response.blocks().size(), lines.size(), document);
        return lines;
    }
}
