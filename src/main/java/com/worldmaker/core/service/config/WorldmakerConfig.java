package com.worldmaker.core.service.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Overall application configuration for WorldMaker Core Service.
 *
 * Contains toggles, feature flags, and engine tuning.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "worldmaker")
public class WorldmakerConfig {

    /**
     * Enable or disable the entire service.
     */
    private boolean enabled = true;

    /**
     * Feature flags for optional capabilities.
     */
    private Features features = new Features();

    /**
     * Trace synthesis settings.
     */
    private TraceSettings trace = new TraceSettings();

    /**
     * Dependency resolution settings.
     */
    private ResolutionSettings resolution = new ResolutionSettings();

    @Getter
    @Setter
    public static class Features {

        /**
         * Serve dependency resolutions through the TTL cache.
         */
        private boolean resolutionCacheEnabled = true;

        /**
         * Enable metrics collection.
         */
        private boolean metricsEnabled = true;
    }

    @Getter
    @Setter
    public static class TraceSettings {

        /**
         * Seed for the trace generator. Unset means a fresh seed per start.
         */
        private Long seed;

        /**
         * Environment stamped on traces when the caller gives none.
         */
        private String defaultEnvironment = "prod";
    }

    @Getter
    @Setter
    public static class ResolutionSettings {

        /**
         * Lifetime of a cached resolution in seconds.
         */
        private long cacheTtlSeconds = 60;

        /**
         * Expired-entry sweep interval in milliseconds.
         */
        private long cacheEvictionIntervalMs = 60000; // 1 minute
    }
}
