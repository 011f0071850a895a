package com.worldmaker.core.service.runtime;

import com.worldmaker.core.service.config.MetricsConfig;
import com.worldmaker.core.service.config.RetentionConfig;
import com.worldmaker.core.service.config.WorldmakerConfig;
import com.worldmaker.core.trace.StatusCode;
import com.worldmaker.core.trace.Trace;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryTraceBufferTest {

    private static final Instant START = Instant.parse("2024-05-01T10:00:00Z");

    private SimpleMeterRegistry registry;
    private RetentionConfig retention;
    private SteppingClock clock;
    private InMemoryTraceBuffer buffer;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        retention = new RetentionConfig();
        clock = new SteppingClock();
        buffer = new InMemoryTraceBuffer(new MetricsConfig(registry, new WorldmakerConfig()), retention, clock);
        buffer.init();
    }

    @Test
    @DisplayName("Stored traces are retrievable by id and by flow, newest first")
    void storeAndQuery() {
        buffer.store(trace("t1", "checkout"));
        buffer.store(trace("t2", "checkout"));
        buffer.store(trace("t3", "signup"));

        assertThat(buffer.getTrace("t2")).isPresent();
        assertThat(buffer.getTrace("missing")).isEmpty();
        assertThat(buffer.getTracesForFlow("checkout")).extracting(Trace::traceId).containsExactly("t2", "t1");
        assertThat(buffer.getAll()).extracting(Trace::traceId).containsExactly("t3", "t2", "t1");
        assertThat(buffer.getTracesForFlow("unknown")).isEmpty();
    }

    @Test
    @DisplayName("Store gauge tracks the buffer size")
    void gaugeRegistered() {
        buffer.store(trace("t1", "checkout"));

        assertThat(registry.get("worldmaker.store.traces.count").gauge().value()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Oldest traces are dropped once max count is exceeded")
    void capacityEviction() {
        retention.getTrace().setMaxCount(2);

        buffer.store(trace("t1", "checkout"));
        buffer.store(trace("t2", "checkout"));
        buffer.store(trace("t3", "checkout"));

        assertThat(buffer.count()).isEqualTo(2);
        assertThat(buffer.getTrace("t1")).isEmpty();
        assertThat(buffer.getTracesForFlow("checkout")).extracting(Trace::traceId).containsExactly("t3", "t2");
    }

    @Test
    @DisplayName("Traces older than the TTL are evicted")
    void ttlEviction() {
        retention.getTrace().setTtlMinutes(10);

        buffer.store(trace("old", "checkout"));
        clock.advance(Duration.ofMinutes(6));
        buffer.store(trace("recent", "checkout"));
        clock.advance(Duration.ofMinutes(5));

        assertThat(buffer.evictExpired()).isEqualTo(1);
        assertThat(buffer.getTrace("old")).isEmpty();
        assertThat(buffer.getTrace("recent")).isPresent();
    }

    @Test
    @DisplayName("Zero TTL disables time-based eviction")
    void ttlDisabled() {
        retention.getTrace().setTtlMinutes(0);
        buffer.store(trace("t1", "checkout"));
        clock.advance(Duration.ofDays(1));

        assertThat(buffer.evictExpired()).isZero();
        assertThat(buffer.count()).isEqualTo(1);
    }

    @Test
    @DisplayName("Deleting by flow removes only that flow's traces")
    void deleteTracesForFlow() {
        buffer.store(trace("t1", "checkout"));
        buffer.store(trace("t2", "signup"));

        assertThat(buffer.deleteTracesForFlow("checkout")).isEqualTo(1);
        assertThat(buffer.deleteTracesForFlow("checkout")).isZero();
        assertThat(buffer.delete("t2")).isTrue();
        assertThat(buffer.delete("t2")).isFalse();
        assertThat(buffer.count()).isZero();
    }

    private Trace trace(String traceId, String flowId) {
        return new Trace(traceId, "exec-" + traceId, flowId, flowId, "prod",
                START, START.plusMillis(5), 5.0, StatusCode.OK, 1, null, List.of(), List.of());
    }

    private static class SteppingClock extends Clock {

        private Instant now = START;

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
