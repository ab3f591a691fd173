package com.lbg.markets.surveillance.courier.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import java.time.Duration;
import java.util.Optional;

/**
 * Configuration for the Courier transfer worker.
 */
@ConfigMapping(prefix = "courier")
public interface CourierConfiguration {

    @WithName("node-name")
    @WithDefault("courier-local")
    String nodeName();

    @WithName("retry")
    RetryConfig retry();

    @WithName("worker")
    WorkerConfig worker();

    @WithName("queue")
    QueueConfig queue();

    @WithName("dlq")
    DeadLetterConfig dlq();

    @WithName("storage")
    StorageConfig storage();

    @WithName("health")
    HealthConfig health();

    @WithName("stats")
    StatsConfig stats();

    interface RetryConfig {

        /**
         * Delay before the first retry. Doubles with every further retry.
         */
        @WithName("base-delay")
        @WithDefault("PT1S")
        Duration baseDelay();

        @WithName("max-delay")
        @WithDefault("PT30S")
        Duration maxDelay();

        /**
         * Attempt budget for events that do not carry metadata.maxRetries.
         */
        @WithName("default-max-retries")
        @WithDefault("3")
        int defaultMaxRetries();

        @WithName("checksum-mismatch-retryable")
        @WithDefault("false")
        boolean checksumMismatchRetryable();
    }

    interface WorkerConfig {

        @WithName("enabled")
        @WithDefault("true")
        boolean enabled();

        /**
         * Threads running transfer attempts. Bounds concurrent attempts.
         */
        @WithName("threads")
        @WithDefault("4")
        int threads();

        /**
         * Events taken off the queue and not yet finished, including those waiting out a backoff.
         */
        @WithName("max-in-flight")
        @WithDefault("16")
        int maxInFlight();

        @WithName("poll-timeout")
        @WithDefault("PT1S")
        Duration pollTimeout();

        @WithName("attempt-timeout")
        @WithDefault("PT5M")
        Duration attemptTimeout();

        @WithName("shutdown-grace")
        @WithDefault("PT30S")
        Duration shutdownGrace();

        /**
         * How long a delivery of an event that is already being processed is held back before redelivery.
         */
        @WithName("deferral-delay")
        @WithDefault("PT5S")
        Duration deferralDelay();
    }

    enum QueueType {
        MEMORY,
        PUBSUB
    }

    interface QueueConfig {

        @WithName("type")
        @WithDefault("memory")
        QueueType type();

        @WithName("pubsub")
        Optional<PubSubSubscriptionConfig> pubsub();

        /**
         * Ack deadline granted to in-flight deliveries on each renewal.
         */
        @WithName("lease-duration")
        @WithDefault("PT60S")
        Duration leaseDuration();

        /**
         * Read by the scheduler; keep well below {@code lease-duration}.
         */
        @WithName("lease-renewal-interval")
        @WithDefault("20s")
        String leaseRenewalInterval();
    }

    interface PubSubSubscriptionConfig {

        @WithName("project-id")
        String projectId();

        @WithName("subscription")
        String subscription();

        @WithName("max-messages")
        @WithDefault("10")
        int maxMessages();
    }

    interface DeadLetterConfig {

        @WithName("type")
        @WithDefault("memory")
        QueueType type();

        @WithName("pubsub")
        Optional<PubSubTopicConfig> pubsub();
    }

    interface PubSubTopicConfig {

        @WithName("project-id")
        String projectId();

        @WithName("topic")
        String topic();

        @WithName("publish-timeout")
        @WithDefault("PT10S")
        Duration publishTimeout();
    }

    enum StorageMode {
        /**
         * Every provider is simulated under a local directory.
         */
        LOCAL,
        /**
         * Real provider backends; providers without one are rejected.
         */
        CLOUD
    }

    interface StorageConfig {

        @WithName("mode")
        @WithDefault("local")
        StorageMode mode();

        @WithName("local")
        LocalStorageConfig local();

        @WithName("gcs")
        Optional<GcsConfig> gcs();
    }

    interface LocalStorageConfig {

        @WithName("path")
        @WithDefault("./target/storage")
        String path();
    }

    interface GcsConfig {

        @WithName("project-id")
        String projectId();

        /**
         * host:port of a storage emulator for local development.
         */
        @WithName("emulator-host")
        Optional<String> emulatorHost();
    }

    interface HealthConfig {

        /**
         * Success rate, in percent, at or below which the worker reports itself degraded.
         */
        @WithName("degraded-success-rate")
        @WithDefault("95.0")
        double degradedSuccessRate();
    }

    interface StatsConfig {

        /**
         * Interval of the periodic statistics report, in scheduler syntax (e.g. 5m).
         */
        @WithName("report-interval")
        @WithDefault("5m")
        String reportInterval();
    }
}
