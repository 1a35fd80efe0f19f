package com.example.inboxsync.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "sync")
public class SyncProperties {

    /**
     * Provider name recorded on accounts when an event does not carry one.
     */
    private String defaultProvider = "linkedin";

    @NestedConfigurationProperty
    private final Redis redis = new Redis();

    @NestedConfigurationProperty
    private final Kafka kafka = new Kafka();

    @NestedConfigurationProperty
    private final Lock lock = new Lock();

    @NestedConfigurationProperty
    private final Backfill backfill = new Backfill();

    @NestedConfigurationProperty
    private final Attachments attachments = new Attachments();

    @NestedConfigurationProperty
    private final Provider provider = new Provider();

    @NestedConfigurationProperty
    private final Storage storage = new Storage();

    @NestedConfigurationProperty
    private final Dispatch dispatch = new Dispatch();

    @NestedConfigurationProperty
    private final Enrichment enrichment = new Enrichment();

    @NestedConfigurationProperty
    private final Simulation simulation = new Simulation();

    @NestedConfigurationProperty
    private final Executor executor = new Executor();

    public String getDefaultProvider() {
        return defaultProvider;
    }

    public void setDefaultProvider(String defaultProvider) {
        this.defaultProvider = defaultProvider;
    }

    public Redis getRedis() {
        return redis;
    }

    public Kafka getKafka() {
        return kafka;
    }

    public Lock getLock() {
        return lock;
    }

    public Backfill getBackfill() {
        return backfill;
    }

    public Attachments getAttachments() {
        return attachments;
    }

    public Provider getProvider() {
        return provider;
    }

    public Storage getStorage() {
        return storage;
    }

    public Dispatch getDispatch() {
        return dispatch;
    }

    public Enrichment getEnrichment() {
        return enrichment;
    }

    public Simulation getSimulation() {
        return simulation;
    }

    public Executor getExecutor() {
        return executor;
    }

    @Validated
    public static class Redis {

        /**
         * Prefix applied to all Redis keys controlled by the sync module.
         */
        private String keyPrefix = "inboxsync";

        public String getKeyPrefix() {
            return keyPrefix;
        }

        public void setKeyPrefix(String keyPrefix) {
            this.keyPrefix = keyPrefix;
        }
    }

    @Validated
    public static class Kafka {

        /**
         * Kafka topic receiving sync outcome events.
         */
        private String eventTopic = "inboxsync.events";

        public String getEventTopic() {
            return eventTopic;
        }

        public void setEventTopic(String eventTopic) {
            this.eventTopic = eventTopic;
        }
    }

    @Validated
    public static class Lock {

        /**
         * {@code redis} for a cluster-wide chat lock, {@code local} for a single node.
         */
        private String mode = "redis";

        /**
         * Longest a worker waits for a busy chat before giving the event back as transient.
         */
        private Duration acquireTimeout = Duration.ofSeconds(30);

        /**
         * Lease Redisson keeps renewing while the holder is alive.
         */
        private Duration watchdogTimeout = Duration.ofSeconds(30);

        public String getMode() {
            return mode;
        }

        public void setMode(String mode) {
            this.mode = mode;
        }

        public Duration getAcquireTimeout() {
            return acquireTimeout;
        }

        public void setAcquireTimeout(Duration acquireTimeout) {
            this.acquireTimeout = acquireTimeout;
        }

        public Duration getWatchdogTimeout() {
            return watchdogTimeout;
        }

        public void setWatchdogTimeout(Duration watchdogTimeout) {
            this.watchdogTimeout = watchdogTimeout;
        }
    }

    @Validated
    public static class Backfill {

        @Positive
        private int maxChats = 1000;

        @Positive
        private int pageSize = 50;

        @Positive
        private int maxMessagesPerChat = 100;

        @Positive
        private int messageBatchSize = 50;

        @Positive
        private int maxAttendeesPerChat = 100;

        /**
         * Delay between an account connecting and its historical backfill starting.
         */
        private Duration initialDelay = Duration.ofSeconds(10);

        /**
         * A run still marked running after this long is considered abandoned.
         */
        private Duration staleAfter = Duration.ofHours(2);

        /** How often abandoned runs are looked for. */
        private Duration housekeepingInterval = Duration.ofMinutes(5);

        public int getMaxChats() {
            return maxChats;
        }

        public void setMaxChats(int maxChats) {
            this.maxChats = maxChats;
        }

        public int getPageSize() {
            return pageSize;
        }

        public void setPageSize(int pageSize) {
            this.pageSize = pageSize;
        }

        public int getMaxMessagesPerChat() {
            return maxMessagesPerChat;
        }

        public void setMaxMessagesPerChat(int maxMessagesPerChat) {
            this.maxMessagesPerChat = maxMessagesPerChat;
        }

        public int getMessageBatchSize() {
            return messageBatchSize;
        }

        public void setMessageBatchSize(int messageBatchSize) {
            this.messageBatchSize = messageBatchSize;
        }

        public int getMaxAttendeesPerChat() {
            return maxAttendeesPerChat;
        }

        public void setMaxAttendeesPerChat(int maxAttendeesPerChat) {
            this.maxAttendeesPerChat = maxAttendeesPerChat;
        }

        public Duration getInitialDelay() {
            return initialDelay;
        }

        public void setInitialDelay(Duration initialDelay) {
            this.initialDelay = initialDelay;
        }

        public Duration getStaleAfter() {
            return staleAfter;
        }

        public void setStaleAfter(Duration staleAfter) {
            this.staleAfter = staleAfter;
        }

        public Duration getHousekeepingInterval() {
            return housekeepingInterval;
        }

        public void setHousekeepingInterval(Duration housekeepingInterval) {
            this.housekeepingInterval = housekeepingInterval;
        }
    }

    @Validated
    public static class Attachments {

        /**
         * Platform URLs expiring within this window are treated as already stale.
         */
        private Duration expirySafetyMargin = Duration.ofMinutes(5);

        /**
         * Upload newly ingested attachments to the durable cache right away.
         */
        private boolean cacheOnIngest = true;

        /**
         * Leading path segment of durable cache object keys.
         */
        private String keyPrefix = "attachments";

        public Duration getExpirySafetyMargin() {
            return expirySafetyMargin;
        }

        public void setExpirySafetyMargin(Duration expirySafetyMargin) {
            this.expirySafetyMargin = expirySafetyMargin;
        }

        public boolean isCacheOnIngest() {
            return cacheOnIngest;
        }

        public void setCacheOnIngest(boolean cacheOnIngest) {
            this.cacheOnIngest = cacheOnIngest;
        }

        public String getKeyPrefix() {
            return keyPrefix;
        }

        public void setKeyPrefix(String keyPrefix) {
            this.keyPrefix = keyPrefix;
        }
    }

    @Validated
    public static class Provider {

        /**
         * Base URL of the messaging platform API, e.g. {@code https://api1.unipile.com:13111/api/v1}.
         */
        private String baseUrl = "http://localhost:13111/api/v1";

        private String apiKey;

        private Duration timeout = Duration.ofSeconds(30);

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }
    }

    @Validated
    public static class Storage {

        /**
         * S3-compatible endpoint of the durable attachment cache.
         */
        private String endpoint = "http://localhost:9000";

        private String region = "auto";

        private String bucket = "attachments";

        private String accessKey;

        private String secretKey;

        /**
         * Base for public object URLs. Defaults to {@code endpoint/bucket}.
         */
        private String publicBaseUrl;

        public String getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(String endpoint) {
            this.endpoint = endpoint;
        }

        public String getRegion() {
            return region;
        }

        public void setRegion(String region) {
            this.region = region;
        }

        public String getBucket() {
            return bucket;
        }

        public void setBucket(String bucket) {
            this.bucket = bucket;
        }

        public String getAccessKey() {
            return accessKey;
        }

        public void setAccessKey(String accessKey) {
            this.accessKey = accessKey;
        }

        public String getSecretKey() {
            return secretKey;
        }

        public void setSecretKey(String secretKey) {
            this.secretKey = secretKey;
        }

        public String getPublicBaseUrl() {
            return publicBaseUrl;
        }

        public void setPublicBaseUrl(String publicBaseUrl) {
            this.publicBaseUrl = publicBaseUrl;
        }
    }

    @Validated
    public static class Dispatch {

        /**
         * Endpoint receiving outbound {@code {event, data}} deliveries.
         */
        private String targetUrl = "http://localhost:8080/api/webhooks/messaging";

        @Min(1)
        private int maxAttempts = 3;

        /**
         * Delay before the first retry; doubled on every further attempt.
         */
        private Duration baseDelay = Duration.ofSeconds(1);

        public String getTargetUrl() {
            return targetUrl;
        }

        public void setTargetUrl(String targetUrl) {
            this.targetUrl = targetUrl;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getBaseDelay() {
            return baseDelay;
        }

        public void setBaseDelay(Duration baseDelay) {
            this.baseDelay = baseDelay;
        }
    }

    @Validated
    public static class Enrichment {

        /**
         * Fetch full profiles for new participants and profile viewers.
         */
        private boolean enabled = false;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }

    @Validated
    public static class Simulation {

        /**
         * Exposes the simulated-message trigger endpoints.
         */
        private boolean enabled = false;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }

    @Validated
    public static class Executor {

        @Positive
        private int corePoolSize = 4;

        @Positive
        private int maxPoolSize = 16;

        @Min(0)
        private int queueCapacity = 500;

        public int getCorePoolSize() {
            return corePoolSize;
        }

        public void setCorePoolSize(int corePoolSize) {
            this.corePoolSize = corePoolSize;
        }

        public int getMaxPoolSize() {
            return maxPoolSize;
        }

        public void setMaxPoolSize(int maxPoolSize) {
            this.maxPoolSize = maxPoolSize;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }
    }
}
