package com.worldmaker.core.service.api.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * DTO for dependency creation requests.
 *
 * Omitted types default to {@code service}, the dependency type to
 * {@code runtime} and the severity to {@code medium}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateDependencyRequest {

    /**
     * The dependent entity.
     */
    @NotBlank(message = "sourceId is required")
    private String sourceId;

    private String sourceType;

    /**
     * The entity depended upon.
     */
    @NotBlank(message = "targetId is required")
    private String targetId;

    private String targetType;

    /**
     * Free-form kind, e.g. runtime, build, data.
     */
    private String dependencyType;

    /**
     * One of low, medium, high, critical.
     */
    private String severity;
}
