package com.worldmaker.core.service.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * DTO for the spans of one trace in a chosen wire format.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TraceSpansResponse {

    private String traceId;

    /**
     * otel or jaeger.
     */
    private String format;

    private int spanCount;
    private List<?> spans;
}
