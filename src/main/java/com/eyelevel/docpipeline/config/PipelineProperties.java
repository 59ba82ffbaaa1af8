package com.eyelevel.docpipeline.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Binds application properties under the "app.pipeline" prefix: the stage list with per-stage retry policy,
 * ownership leases, the execution store, stage tuning and the worker pools.
 */
@Data
@ConfigurationProperties(prefix = "app.pipeline")
public class PipelineProperties {

    /**
     * Stages in execution order.
     */
    private List<Stage> stages = new ArrayList<>();

    /**
     * Upper bound for the exponential retry backoff of every stage.
     */
    private Duration maxBackoff = Duration.ofMinutes(5);

    /**
     * Identity written into execution leases. A random id is generated per process when empty.
     */
    private String workerId;

    private Duration leaseDuration = Duration.ofMinutes(10);

    private Store store = new Store();
    private Analysis analysis = new Analysis();
    private Results results = new Results();
    private Recovery recovery = new Recovery();
    private Executor executor = new Executor();

    @Data
    public static class Stage {
        private String name;
        private int maxAttempts = 3;
        private Duration backoffBase = Duration.ofSeconds(1);
        private Duration timeout = Duration.ofMinutes(2);
    }

    @Data
    public static class Store {
        /**
         * {@code jpa} or {@code in-memory}.
         */
        private String type = "jpa";
        private int checkpointAttempts = 3;
        private Duration checkpointBackoff = Duration.ofMillis(500);
    }

    @Data
    public static class Analysis {
        private int maxInputChars = 5000;
        private String languageCode = "en";
    }

    @Data
    public static class Results {
        private String prefix = "results/";
        private String suffix = ".json";
    }

    @Data
    public static class Recovery {
        private boolean enabled = true;
        private String cron = "0 */5 * * * *";
        private Duration pendingGrace = Duration.ofMinutes(15);
    }

    @Data
    public static class Executor {
        private int coreSize = 4;
        private int maxSize = 16;
        private int queueCapacity = 500;
        private int stageCallMaxSize = 32;
    }
}
