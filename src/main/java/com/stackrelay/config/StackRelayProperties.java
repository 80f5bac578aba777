package com.stackrelay.config;

import com.stackrelay.model.AccessMode;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Configuration properties for StackRelay.
 */
@Data
@Component
@ConfigurationProperties(prefix = "stackrelay")
public class StackRelayProperties {

    private ApiConfig api = new ApiConfig();
    private QueueConfig queue = new QueueConfig();
    private CacheConfig cache = new CacheConfig();
    private QuotaConfig quota = new QuotaConfig();
    private RetryConfig retry = new RetryConfig();

    @Data
    public static class ApiConfig {
        private String baseUrl = "https://api.stackexchange.com/2.3";
        private String apiKey;
        private String site = "stackoverflow";
        private AccessMode accessMode = AccessMode.AUTO;
        private Duration timeout = Duration.ofSeconds(30);
        private boolean validateKeyOnStartup = true;

        public boolean hasApiKey() {
            return apiKey != null && !apiKey.isBlank();
        }
    }

    @Data
    public static class QueueConfig {
        private int maxConcurrent = 5;
        /**
         * Maximum number of queued (not in-flight) requests; 0 means unbounded.
         */
        private int maxPending = 100;
        private AbandonedPolicy abandonedPolicy = AbandonedPolicy.COMPLETE;
    }

    @Data
    public static class CacheConfig {
        private Duration ttl = Duration.ofMinutes(5);
        private int maxSize = 500;
        private Duration purgeInterval = Duration.ofMinutes(1);
    }

    @Data
    public static class QuotaConfig {
        private int lowWaterMark = 50;
        /**
         * How long the authenticated path stays disabled after a rate-limit error without a retry hint.
         */
        private Duration rateLimitCooldown = Duration.ofMinutes(5);
        /**
         * Client-side pacing; 0 disables it.
         */
        private int maxRequestsPerMinute = 30;
    }

    @Data
    public static class RetryConfig {
        private int maxAttempts = 3;
        private Duration baseDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofSeconds(30);
    }

    /**
     * What happens to a request whose callers have all stopped waiting while it is in flight or backing off.
     */
    public enum AbandonedPolicy {
        /**
         * Keep going (including retries) so the result still warms the cache.
         */
        COMPLETE,

        /**
         * Let the current call finish but schedule no further retries.
         */
        DROP
    }
}
