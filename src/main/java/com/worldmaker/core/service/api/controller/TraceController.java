package com.worldmaker.core.service.api.controller;

import com.worldmaker.core.service.api.dto.ApiResponse;
import com.worldmaker.core.service.api.dto.TraceSpansResponse;
import com.worldmaker.core.service.api.dto.TraceSummaryResponse;
import com.worldmaker.core.service.runtime.TraceBuffer;
import com.worldmaker.core.trace.Trace;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Controller for trace queries.
 *
 * Serves buffered traces and their spans in OpenTelemetry or Jaeger shape.
 */
@Slf4j
@RestController
@RequestMapping("/traces")
@Tag(name = "Trace Queries", description = "Endpoints for querying synthesized traces")
@RequiredArgsConstructor
public class TraceController {

    static final String FORMAT_OTEL = "otel";
    static final String FORMAT_JAEGER = "jaeger";

    private final TraceBuffer traceBuffer;

    @GetMapping
    @Operation(summary = "List traces", description = "Returns summaries of buffered traces, newest first")
    public ResponseEntity<ApiResponse<List<TraceSummaryResponse>>> listTraces(
            @Parameter(description = "Maximum number of traces to return")
            @RequestParam(defaultValue = "100") int limit) {
        var summaries = traceBuffer.getAll().stream()
                .limit(Math.max(limit, 0))
                .map(TraceSummaryResponse::from)
                .toList();
        return ResponseEntity.ok(ApiResponse.success(summaries,
                Map.of("count", summaries.size(), "total", traceBuffer.count())));
    }

    /**
     * Gets trace details by ID.
     */
    @GetMapping("/{traceId}")
    @Operation(summary = "Get trace details",
               description = "Returns the complete trace including spans in both formats")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Trace found"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Trace not found or evicted")
    })
    public ResponseEntity<ApiResponse<Trace>> getTrace(
            @Parameter(description = "Trace ID") @PathVariable String traceId) {
        log.debug("Getting trace details: {}", traceId);

        return traceBuffer.getTrace(traceId)
                .map(trace -> ResponseEntity.ok(ApiResponse.success(trace)))
                .orElseGet(() -> notFound(traceId));
    }

    @GetMapping("/{traceId}/spans")
    @Operation(summary = "Get trace spans", description = "Returns the spans of a trace in otel or jaeger format")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Trace found"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Unknown format"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Trace not found or evicted")
    })
    public ResponseEntity<ApiResponse<TraceSpansResponse>> getSpans(
            @Parameter(description = "Trace ID") @PathVariable String traceId,
            @Parameter(description = "otel or jaeger")
            @RequestParam(defaultValue = FORMAT_OTEL) String format) {
        String normalized = format.toLowerCase(Locale.ROOT);
        if (!FORMAT_OTEL.equals(normalized) && !FORMAT_JAEGER.equals(normalized)) {
            throw new IllegalArgumentException("Unknown span format: " + format);
        }

        return traceBuffer.getTrace(traceId)
                .map(trace -> ResponseEntity.ok(ApiResponse.success(toSpansResponse(trace, normalized))))
                .orElseGet(() -> notFound(traceId));
    }

    // --- Private helpers ---

    private TraceSpansResponse toSpansResponse(Trace trace, String format) {
        List<?> spans = FORMAT_JAEGER.equals(format) ? trace.spansJaeger() : trace.spans();
        return TraceSpansResponse.builder()
                .traceId(trace.traceId())
                .format(format)
                .spanCount(spans.size())
                .spans(spans)
                .build();
    }

    private <T> ResponseEntity<ApiResponse<T>> notFound(String traceId) {
        log.warn("Trace not found: {}", traceId);
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(ApiResponse.error("Trace not found or evicted", "NOT_FOUND"));
    }
}
