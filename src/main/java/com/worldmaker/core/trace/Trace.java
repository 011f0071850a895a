package com.worldmaker.core.trace;

import com.worldmaker.core.trace.format.JaegerSpan;
import com.worldmaker.core.trace.format.OtelSpan;

import java.time.Instant;
import java.util.List;

/**
 * Complete result of one flow execution. Immutable once returned.
 *
 * @param spans every span, root first, in OpenTelemetry shape
 * @param spansJaeger the same spans in Jaeger shape
 * @param error failure details, null when every hop succeeded
 */
public record Trace(
        String traceId,
        String executionId,
        String flowId,
        String flowName,
        String environment,
        Instant startTime,
        Instant endTime,
        double durationMs,
        StatusCode status,
        int spanCount,
        TraceError error,
        List<OtelSpan> spans,
        List<JaegerSpan> spansJaeger
) {

    public boolean failed() {
        return status == StatusCode.ERROR;
    }
}
