package com.worldmaker.core.service.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * DTO for an edge that closed a dependency cycle, with display names.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CircularDependencyResponse {

    private String edgeId;
    private String sourceId;
    private String sourceName;
    private String targetId;
    private String targetName;
    private String dependencyType;
    private String severity;
    private Instant createdAt;
}
