package com.whereq.newscaster.config;

import com.whereq.newscaster.model.PollingPolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for WhereQ Newscaster.
 *
 * @author WhereQ Inc.
 */
@Configuration
@ConfigurationProperties(prefix = "newscaster")
@Data
public class NewscasterProperties {

    private RenderConfig render = new RenderConfig();

    private PollingConfig polling = new PollingConfig();

    private StoreConfig store = new StoreConfig();

    private StorageConfig storage = new StorageConfig();

    private PipelineConfig pipeline = new PipelineConfig();

    private NotificationConfig notifications = new NotificationConfig();

    @Data
    public static class RenderConfig {
        /**
         * Base URL of the lip-sync render API.
         */
        private String baseUrl = "https://api.sync.so/v2";

        /**
         * API key sent as x-api-key.
         */
        private String apiKey;

        /**
         * Model and version used for video renders.
         */
        private String model = "lipsync-1.9.0-beta";

        /**
         * Avatar video template the audio is lip-synced onto.
         */
        private String videoTemplateUrl;

        /**
         * Output options passed through to the render API.
         */
        private Map<String, Object> options = defaultOptions();

        /**
         * Timeout of a single submit call.
         */
        private Duration submitTimeout = Duration.ofSeconds(30);

        private static Map<String, Object> defaultOptions() {
            Map<String, Object> options = new LinkedHashMap<>();
            options.put("output_format", "mp4");
            options.put("sync_mode", "bounce");
            options.put("fps", 25);
            options.put("output_resolution", List.of(1280, 720));
            options.put("active_speaker", true);
            return options;
        }
    }

    @Data
    public static class PollingConfig {
        private Duration interval = Duration.ofSeconds(30);

        private int maxAttempts = 30;

        /**
         * Poll until done or canceled. Only honoured where a cancel path exists.
         */
        private boolean indefinite = false;

        private Duration perCallTimeout = Duration.ofSeconds(30);

        private int transientRetries = 3;

        private Duration transientBackoff = Duration.ofSeconds(1);

        private Duration maxTransientBackoff = Duration.ofSeconds(10);

        public PollingPolicy toPolicy() {
            return PollingPolicy.builder()
                .interval(interval)
                .maxAttempts(maxAttempts)
                .indefinite(indefinite)
                .perCallTimeout(perCallTimeout)
                .transientRetries(transientRetries)
                .transientBackoff(transientBackoff)
                .maxTransientBackoff(maxTransientBackoff)
                .build();
        }
    }

    @Data
    public static class StoreConfig {
        /**
         * Job record backend.
         */
        private StoreType type = StoreType.REDIS;

        /**
         * Directory of the file backend.
         */
        private String directory = "data/jobs";

        /**
         * Key prefix of the Redis backend.
         */
        private String keyPrefix = "newscaster:job:";

        /**
         * Timeout of a single Redis operation.
         */
        private Duration timeout = Duration.ofSeconds(5);
    }

    @Data
    public static class StorageConfig {
        private String bucket;

        private String region = "us-west-2";

        /**
         * Endpoint override for S3-compatible stores (R2, MinIO).
         */
        private String endpoint;

        private String accessKey;

        private String secretKey;

        /**
         * Public URL prefix of uploaded objects. Defaults to the virtual-hosted S3 URL.
         */
        private String publicBaseUrl;

        /**
         * Key prefix of rehosted video artifacts.
         */
        private String videoPrefix = "videos";

        /**
         * Key prefix of published audio artifacts.
         */
        private String audioPrefix = "audio";

        /**
         * Timeout of an artifact download.
         */
        private Duration downloadTimeout = Duration.ofMinutes(5);
    }

    @Data
    public static class PipelineConfig {
        /**
         * Delay between work items to respect upstream rate limits.
         */
        private Duration interItemDelay = Duration.ofSeconds(15);

        /**
         * Number of items processed concurrently.
         */
        private int parallelism = 1;

        /**
         * Maximum items accepted in one batch.
         */
        private int maxBatchSize = 50;

        /**
         * How long a finished run stays available for inspection.
         */
        private Duration runRetention = Duration.ofHours(1);

        /**
         * Upper bound on finished runs kept in memory; the oldest go first.
         */
        private int maxRetainedRuns = 100;
    }

    @Data
    public static class NotificationConfig {
        /**
         * Webhook notified when a job reaches a terminal status.
         */
        private String webhook;

        private Duration timeout = Duration.ofSeconds(10);
    }

    public enum StoreType {
        /**
         * Redis, shared across instances (default)
         */
        REDIS,

        /**
         * One JSON file per job on local disk
         */
        FILE,

        /**
         * Non-durable, for tests and dry runs
         */
        MEMORY
    }
}
