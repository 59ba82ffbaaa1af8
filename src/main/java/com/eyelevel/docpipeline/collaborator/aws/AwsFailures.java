package com.eyelevel.docpipeline.collaborator.aws;

import com.eyelevel.docpipeline.exception.CollaboratorException;
import com.eyelevel.docpipeline.exception.PermanentCollaboratorException;
import com.eyelevel.docpipeline.exception.TransientCollaboratorException;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.exception.SdkException;

/**
 * Maps AWS SDK failures that an adapter has no specific rule for onto the collaborator exception types.
 * Client-side errors (network, timeouts), throttling (HTTP 429) and 5xx responses are transient; every
 * other service error is permanent.
 */
final class AwsFailures {

    private static final int TOO_MANY_REQUESTS = 429;

    private AwsFailures() {
    }

    static CollaboratorException classify(final String operation, final SdkException e) {
        if (e instanceof SdkClientException) {
            return new TransientCollaboratorException(operation + " could not reach the service: " + e.getMessage(), e);
        }
        if (e instanceof AwsServiceException serviceException) {
            final int status = serviceException.statusCode();
            if (serviceException.isThrottlingException() || status == TOO_MANY_REQUESTS || status >= 500) {
                return new TransientCollaboratorException(
                        String.format("%s failed with status %d: %s", operation, status, e.getMessage()), e);
            }
            return new PermanentCollaboratorException(
                    String.format("%s rejected with status %d: %s", operation, status, e.getMessage()), e);
        }
        if (e.retryable()) {
            return new TransientCollaboratorException(operation + " failed: " + e.getMessage(), e);
        }
        return new PermanentCollaboratorException(operation + " failed: " + e.getMessage(), e);
    }
}
