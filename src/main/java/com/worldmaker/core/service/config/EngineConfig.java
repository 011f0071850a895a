package com.worldmaker.core.service.config;

import com.worldmaker.core.graph.EdgeStore;
import com.worldmaker.core.graph.GraphQueries;
import com.worldmaker.core.impact.ImpactCalculator;
import com.worldmaker.core.resolve.DependencyResolver;
import com.worldmaker.core.resolve.ResolutionCache;
import com.worldmaker.core.service.catalog.EntityCatalog;
import com.worldmaker.core.trace.TraceSynthesizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.Random;

/**
 * Configuration for engine beans.
 *
 * Creates the graph, impact, resolution and trace engines as Spring beans
 * for injection into service adapters.
 */
@Slf4j
@Configuration
public class EngineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Append-only dependency edge store with cycle flagging.
     */
    @Bean
    public EdgeStore edgeStore(Clock clock) {
        log.info("Initializing EdgeStore");
        return new EdgeStore(clock);
    }

    /**
     * Transitive, blast-radius and cycle queries.
     * Entity names are resolved through the catalog.
     */
    @Bean
    public GraphQueries graphQueries(EdgeStore edgeStore, EntityCatalog catalog) {
        log.info("Initializing GraphQueries");
        return new GraphQueries(edgeStore, catalog);
    }

    @Bean
    public ImpactCalculator impactCalculator(GraphQueries graphQueries, EntityCatalog catalog) {
        log.info("Initializing ImpactCalculator");
        return new ImpactCalculator(graphQueries, catalog);
    }

    @Bean
    public DependencyResolver dependencyResolver(GraphQueries graphQueries, ImpactCalculator impactCalculator) {
        return new DependencyResolver(graphQueries, impactCalculator);
    }

    /**
     * TTL cache in front of the resolver.
     */
    @Bean
    public ResolutionCache resolutionCache(DependencyResolver resolver, WorldmakerConfig config, Clock clock) {
        var ttl = Duration.ofSeconds(config.getResolution().getCacheTtlSeconds());
        log.info("Initializing ResolutionCache, TTL: {}", ttl);
        return new ResolutionCache(resolver, ttl, clock);
    }

    /**
     * Trace synthesizer. A configured seed makes every run reproducible.
     */
    @Bean
    public TraceSynthesizer traceSynthesizer(WorldmakerConfig config, EntityCatalog catalog, Clock clock) {
        Long seed = config.getTrace().getSeed();
        log.info("Initializing TraceSynthesizer (seed: {})", seed != null ? seed : "random");
        Random random = seed != null ? new Random(seed) : new Random();
        return new TraceSynthesizer(random, clock, catalog);
    }
}
