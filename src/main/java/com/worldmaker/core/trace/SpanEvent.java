package com.worldmaker.core.trace;

import java.time.Instant;
import java.util.Map;

/**
 * A timestamped log line inside a span.
 */
public record SpanEvent(String name, Instant timestamp, Map<String, Object> attributes) {}
