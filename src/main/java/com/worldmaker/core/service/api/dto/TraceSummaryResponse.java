package com.worldmaker.core.service.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.worldmaker.core.trace.Trace;
import com.worldmaker.core.trace.TraceError;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * DTO for trace summary responses.
 *
 * Provides a lightweight view of a trace for listing endpoints.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TraceSummaryResponse {

    private String traceId;
    private String executionId;
    private String flowId;
    private String flowName;
    private String environment;

    /**
     * STATUS_CODE_OK or STATUS_CODE_ERROR.
     */
    private String status;

    private Instant startTime;
    private double durationMs;
    private int spanCount;

    /**
     * Failure details (null when every hop succeeded).
     */
    private TraceError error;

    public static TraceSummaryResponse from(Trace trace) {
        return TraceSummaryResponse.builder()
                .traceId(trace.traceId())
                .executionId(trace.executionId())
                .flowId(trace.flowId())
                .flowName(trace.flowName())
                .environment(trace.environment())
                .status(trace.status().wireName())
                .startTime(trace.startTime())
                .durationMs(trace.durationMs())
                .spanCount(trace.spanCount())
                .error(trace.error())
                .build();
    }
}
