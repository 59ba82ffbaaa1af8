package com.eyelevel.docpipeline.collaborator.aws;

import com.eyelevel.docpipeline.collaborator.ResultWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

import java.nio.charset.StandardCharsets;

/**
 * {@link ResultWriter} that puts the result document into S3 as {@code application/json}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class S3ResultWriter implements ResultWriter {

    private static final String OPERATION = "S3 PutObject";

    private final S3Client s3Client;

    @Override
    public String write(final String container, final String key, final String json) {
        final PutObjectRequest request = PutObjectRequest.builder()
                .bucket(container)
                .key(key)
                .contentType(MediaType.APPLICATION_JSON_VALUE)
                .build();
        try {
            s3Client.putObject(request, RequestBody.fromString(json, StandardCharsets.UTF_8));
        } catch (SdkException e) {
            throw AwsFailures.classify(OPERATION, e);
        }
        final String location = "s3://" + container + "/" + key;
        log.debug("Wrote {} characters to {}", json.length(), location);
        return location;
    }
}
