package com.eyelevel.docpipeline.collaborator.aws;

import com.eyelevel.docpipeline.collaborator.SentimentDetector;
import com.eyelevel.docpipeline.collaborator.SentimentResult;
import com.eyelevel.docpipeline.exception.PermanentCollaboratorException;
import com.eyelevel.docpipeline.exception.TransientCollaboratorException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.comprehend.ComprehendClient;
import software.amazon.awssdk.services.comprehend.model.DetectSentimentRequest;
import software.amazon.awssdk.services.comprehend.model.DetectSentimentResponse;
import software.amazon.awssdk.services.comprehend.model.InternalServerException;
import software.amazon.awssdk.services.comprehend.model.InvalidRequestException;
import software.amazon.awssdk.services.comprehend.model.SentimentScore;
import software.amazon.awssdk.services.comprehend.model.TextSizeLimitExceededException;
import software.amazon.awssdk.services.comprehend.model.TooManyRequestsException;
import software.amazon.awssdk.services.comprehend.model.UnsupportedLanguageException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@link SentimentDetector} backed by Amazon Comprehend's {@code DetectSentiment} API.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ComprehendSentimentDetector implements SentimentDetector {

    private static final String OPERATION = "Comprehend DetectSentiment";

    private final ComprehendClient comprehendClient;

    @Override
    public SentimentResult detectSentiment(final String text, final String languageCode) {
        final DetectSentimentRequest request = DetectSentimentRequest.builder()
                .text(text)
                .languageCode(languageCode)
                .build();

        final DetectSentimentResponse response;
        try {
            response = comprehendClient.detectSentiment(request);
        } catch (TooManyRequestsException | InternalServerException e) {
            throw new TransientCollaboratorException(OPERATION + " is unavailable: " + e.getMessage(), e);
        } catch (TextSizeLimitExceededException | UnsupportedLanguageException | InvalidRequestException e) {
            throw new PermanentCollaboratorException(OPERATION + " rejected the request: " + e.getMessage(), e);
        } catch (SdkException e) {
            throw AwsFailures.classify(OPERATION, e);
        }

        final SentimentScore score = response.sentimentScore();
        final Map<String, Double> scores = new LinkedHashMap<>();
        if (score != null) {
            putScore(scores, "Positive", score.positive());
            putScore(scores, "Negative", score.negative());
            putScore(scores, "Neutral", score.neutral());
            putScore(scores, "Mixed", score.mixed());
        }
        log.debug("{} returned {} for {} characters", OPERATION, response.sentimentAsString(), text.length());
        return new SentimentResult(response.sentimentAsString(), scores);
    }

    private static void putScore(final Map<String, Double> scores, final String label, final Float value) {
        if (value != null) {
            scores.put(label, value.doubleValue());
        }
    }
}
