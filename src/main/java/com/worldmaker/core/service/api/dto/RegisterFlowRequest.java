package com.worldmaker.core.service.api.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * DTO for flow registration requests.
 *
 * Steps may arrive in any order; they execute by step number.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RegisterFlowRequest {

    @NotBlank(message = "id is required")
    private String id;

    @NotBlank(message = "name is required")
    private String name;

    /**
     * Business category, e.g. checkout, onboarding.
     */
    private String flowType;

    @Valid
    @NotNull(message = "steps is required")
    @Builder.Default
    private List<StepDto> steps = new ArrayList<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class StepDto {

        @NotNull(message = "stepNumber is required")
        private Integer stepNumber;

        @NotBlank(message = "fromServiceId is required")
        private String fromServiceId;

        @NotBlank(message = "toServiceId is required")
        private String toServiceId;

        /**
         * Protocol override for this hop: rest, grpc, event_driven, graphql, batch.
         */
        private String serviceType;
    }
}
