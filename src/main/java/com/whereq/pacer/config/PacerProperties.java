package com.whereq.pacer.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for WhereQ Pacer.
 *
 * @author WhereQ Inc.
 */
@Configuration
@ConfigurationProperties(prefix = "pacer")
@Data
public class PacerProperties {

    private ArtifactConfig artifacts = new ArtifactConfig();

    private JobsConfig jobs = new JobsConfig();

    private StoreConfig store = new StoreConfig();

    private GeneratorConfig generator = new GeneratorConfig();

    private NotificationConfig notifications = new NotificationConfig();

    private CorsConfig cors = new CorsConfig();

    @Data
    public static class ArtifactConfig {
        /**
         * Directory holding generated plan spreadsheets.
         * Relative paths resolve against the working directory.
         */
        private String directory = "training_plans";
    }

    @Data
    public static class JobsConfig {
        /**
         * Maximum number of generations running at the same time.
         */
        private int runnerThreads = 10;

        /**
         * Generations allowed to wait for a runner thread.
         */
        private int runnerQueueCapacity = 1000;

        /**
         * Optional upper bound on a single generation.
         * Unset means a generation may run indefinitely.
         */
        private Duration generationTimeout;
    }

    @Data
    public static class StoreConfig {
        /**
         * Backing store for job records.
         */
        private StoreType type = StoreType.MEMORY;

        /**
         * Redis key prefix (REDIS only).
         */
        private String keyPrefix = "pacer:plan:";

        /**
         * Time to keep a record in Redis (REDIS only).
         */
        private Duration ttl = Duration.ofDays(7);
    }

    @Data
    public static class GeneratorConfig {
        /**
         * Base URL of the plan generation backend.
         */
        private String baseUrl = "http://localhost:8000";

        /**
         * Path that accepts generation requests.
         */
        private String submitPath = "/plans";

        /**
         * Time allowed for one backend call, including the artifact transfer.
         */
        private Duration timeout = Duration.ofMinutes(10);
    }

    @Data
    public static class NotificationConfig {
        /**
         * Webhook called on every terminal transition. Disabled when empty.
         */
        private String webhookUrl;
    }

    @Data
    public static class CorsConfig {
        /**
         * Origins allowed to call the API from a browser.
         */
        private List<String> allowedOrigins = new ArrayList<>(List.of("*"));
    }

    public enum StoreType {
        /**
         * Records kept in process memory, lost on restart.
         */
        MEMORY,

        /**
         * Records kept in Redis hashes, shared across instances.
         */
        REDIS
    }
}
