package com.eyelevel.docpipeline.consumer.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * The subset of an S3 event notification the trigger listener reads. S3 sends a single {@code s3:TestEvent}
 * message without records when a notification is first configured.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class S3EventNotification {

    public static final String TEST_EVENT = "s3:TestEvent";

    @Builder.Default
    @JsonProperty("Records")
    private List<EventRecord> records = new ArrayList<>();

    @JsonProperty("Event")
    private String event;

    public boolean isTestEvent() {
        return TEST_EVENT.equals(event);
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EventRecord {
        private String eventName;
        private S3Entity s3;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class S3Entity {
        private Bucket bucket;
        private S3Object object;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Bucket {
        private String name;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class S3Object {
        /**
         * URL-encoded object key, as delivered by S3.
         */
        private String key;
        private Long size;
    }
}
