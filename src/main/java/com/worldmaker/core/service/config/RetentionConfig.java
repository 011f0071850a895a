package com.worldmaker.core.service.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for data retention and eviction.
 *
 * Controls TTLs for synthesized traces, eviction schedules, and capacity limits.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "worldmaker.retention")
public class RetentionConfig {

    /**
     * Trace retention settings.
     */
    private TraceRetention trace = new TraceRetention();

    @Getter
    @Setter
    public static class TraceRetention {

        /**
         * TTL for traces in minutes after synthesis (0 = no automatic eviction).
         */
        private long ttlMinutes = 10;

        /**
         * Maximum number of traces to keep in memory.
         */
        private int maxCount = 10000;

        /**
         * Eviction check interval in milliseconds.
         */
        private long evictionIntervalMs = 60000; // 1 minute
    }
}
