package com.whereq.contextforge.config;

import com.whereq.contextforge.model.JobPriority;
import com.whereq.contextforge.model.JobType;
import com.whereq.contextforge.model.NotificationEvent.EventType;
import com.whereq.contextforge.model.RetryPolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Configuration properties for WhereQ ContextForge.
 *
 * @author WhereQ Inc.
 */
@Configuration
@ConfigurationProperties(prefix = "contextforge")
@Data
public class ContextForgeProperties {

    private QueueConfig queue = new QueueConfig();

    private WorkersConfig workers = new WorkersConfig();

    /**
     * Retry budget and backoff for failed jobs.
     */
    private RetryPolicy retry = RetryPolicy.defaultPolicy();

    private PipelineDefaults pipeline = new PipelineDefaults();

    private NotificationsConfig notifications = new NotificationsConfig();

    private AiConfig ai = new AiConfig();

    @Data
    public static class QueueConfig {
        /**
         * Maximum number of jobs waiting to run before new jobs are rejected.
         */
        private long maxSize = 1000;

        /**
         * How long finished jobs stay queryable.
         */
        private Duration retention = Duration.ofDays(7);

        /**
         * How often finished jobs past their retention are purged.
         */
        private Duration purgeInterval = Duration.ofHours(1);
    }

    @Data
    public static class WorkersConfig {
        /**
         * Concurrent workers per job type.
         */
        private int defaultConcurrency = 2;

        /**
         * Per-type overrides of the default concurrency.
         */
        private Map<JobType, Integer> concurrency = new EnumMap<>(JobType.class);

        /**
         * Delay before an idle worker polls again.
         */
        private Duration pollInterval = Duration.ofMillis(500);

        /**
         * Limit for a single job execution.
         */
        private Duration executionTimeout = Duration.ofMinutes(5);
    }

    @Data
    public static class PipelineDefaults {
        private boolean enableAutoClassification = true;
        private boolean enableAutoOptimization = true;
        private boolean enableDuplicateDetection = true;
        private boolean enableQualityAssessment = true;

        /**
         * Items processed concurrently per chunk in batch mode.
         */
        private int batchSize = 10;

        private JobPriority priority = JobPriority.NORMAL;

        /**
         * Pause between batch chunks.
         */
        private Duration batchDelay = Duration.ofSeconds(1);
    }

    @Data
    public static class NotificationsConfig {
        /**
         * Webhook receiving notification events; notifications are off when empty.
         */
        private String webhookUrl;

        /**
         * Event types delivered to the webhook.
         */
        private Set<EventType> events = EnumSet.of(EventType.JOB_COMPLETED, EventType.JOB_FAILED);
    }

    @Data
    public static class AiConfig {
        /**
         * Base URL of the AI gateway.
         */
        private String baseUrl = "http://localhost:8090";

        private String apiKey;

        /**
         * Timeout for a single gateway call.
         */
        private Duration timeout = Duration.ofSeconds(60);
    }
}
