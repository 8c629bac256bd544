package com.baykanat.triggers.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;
import java.util.Map;

/** app.* için tip güvenli configuration (topic adları, ingestion limitleri, rate limit, delivery, inbox, stream). */
@Configuration
@ConfigurationProperties(prefix = "app")
@Getter
@Setter
public class AppProperties {

    private KafkaTopicProperties kafka = new KafkaTopicProperties();
    private IngestionProperties ingestion = new IngestionProperties();
    private RateLimitProperties rateLimit = new RateLimitProperties();
    private DeliveryProperties delivery = new DeliveryProperties();
    private InboxProperties inbox = new InboxProperties();
    private ReplayProperties replay = new ReplayProperties();
    private StreamProperties stream = new StreamProperties();
    private SchedulerProperties scheduler = new SchedulerProperties();

    @Getter
    @Setter
    public static class KafkaTopicProperties {
        private TopicNames topic = new TopicNames();

        @Getter
        @Setter
        public static class TopicNames {
            private String eventsIngestion = "events-ingestion";
        }
    }

    @Getter
    @Setter
    public static class IngestionProperties {
        /** Tek event data alanı için üst sınır (byte). */
        private int maxEventBytes = 256 * 1024;
        /** Batch isteğinin toplam gövde sınırı (byte). */
        private int maxBatchBytes = 1024 * 1024;
        private int maxBatchSize = 100;
        private long idempotencyTtlSeconds = 86400;
    }

    @Getter
    @Setter
    public static class RateLimitProperties {
        /** redis | memory */
        private String store = "redis";
        private String defaultTier = "standard";
        private Map<String, TierProperties> tiers = new LinkedHashMap<>(Map.of(
                "standard", new TierProperties(100, 1000.0 / 60.0)));

        /** Tier bilgisi yoksa varsayılan tier'a düşer. */
        public TierProperties resolveTier(String tier) {
            TierProperties resolved = tier != null ? tiers.get(tier) : null;
            if (resolved == null) {
                resolved = tiers.getOrDefault(defaultTier, new TierProperties());
            }
            return resolved;
        }
    }

    @Getter
    @Setter
    public static class TierProperties {
        /** Burst kapasitesi (token). */
        private int capacity = 100;
        /** Saniyede eklenen token. */
        private double refillPerSecond = 1000.0 / 60.0;

        public TierProperties() {
        }

        public TierProperties(int capacity, double refillPerSecond) {
            this.capacity = capacity;
            this.refillPerSecond = refillPerSecond;
        }
    }

    @Getter
    @Setter
    public static class DeliveryProperties {
        private long pollRate = 500;
        /** Poll başına en fazla claim edilecek task. */
        private int claimBatchSize = 50;
        private int workerThreads = 16;
        private int workerQueueCapacity = 200;
        /** Claim edilen task'ın diğer worker'lardan gizli kaldığı süre (ms). */
        private long visibilityTimeoutMs = 60000;
        private long connectTimeoutMs = 5000;
        private long httpTimeoutMs = 30000;
        /** Lease yenilemede HTTP timeout üzerine eklenen pay (ms). */
        private long leaseMarginMs = 10000;
        private double jitterRatio = 0.1;
        /** Paused subscription task'ları için bekleme (ms). */
        private long pausedRetryDelayMs = 60000;
        private int responseBodyLimit = 10000;
        private String userAgent = "Triggers-Webhook/1.0";
        private int defaultMaxAttempts = 5;
        private long defaultInitialDelayMs = 1000;
        private long defaultMaxDelayMs = 3600000;
        private double defaultMultiplier = 2.0;
    }

    @Getter
    @Setter
    public static class InboxProperties {
        private int defaultVisibilityTimeoutSeconds = 30;
        private int maxVisibilityTimeoutSeconds = 43200;
        private int defaultLimit = 50;
        private int maxLimit = 100;
    }

    @Getter
    @Setter
    public static class ReplayProperties {
        private int maxReplays = 3;
    }

    @Getter
    @Setter
    public static class StreamProperties {
        /** Abone başına bekleyen frame sınırı; dolarsa abone düşürülür. */
        private int bufferSize = 256;
        private long heartbeatInterval = 15000;
    }

    @Getter
    @Setter
    public static class SchedulerProperties {
        private long idempotencyCleanupRate = 3600000;
        private long pendingRecoveryRate = 60000;
        /** Bu süreden uzun pending kalan event'ler kuyruğa yeniden yazılır (ms). */
        private long pendingRecoveryThresholdMs = 120000;
        private int pendingRecoveryBatchSize = 500;
    }
}
