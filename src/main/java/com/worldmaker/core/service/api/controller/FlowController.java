package com.worldmaker.core.service.api.controller;

import com.worldmaker.core.service.api.dto.ApiResponse;
import com.worldmaker.core.service.api.dto.RegisterFlowRequest;
import com.worldmaker.core.service.api.dto.TraceSummaryResponse;
import com.worldmaker.core.service.catalog.EntityCatalog;
import com.worldmaker.core.service.engine.TraceSynthesizerAdapter;
import com.worldmaker.core.service.runtime.TraceBuffer;
import com.worldmaker.core.trace.FlowDefinition;
import com.worldmaker.core.trace.FlowStep;
import com.worldmaker.core.trace.Trace;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Controller for flows.
 * Handles flow registration and synthetic execution.
 */
@Slf4j
@RestController
@RequestMapping("/flows")
@Tag(name = "Flows", description = "Endpoints for registering flows and synthesizing their traces")
@RequiredArgsConstructor
public class FlowController {

    private final EntityCatalog catalog;
    private final TraceSynthesizerAdapter synthesizer;
    private final TraceBuffer traceBuffer;

    @PostMapping
    @Operation(summary = "Register a flow", description = "Stores a flow and its ordered service-to-service steps")
    public ResponseEntity<ApiResponse<Map<String, Object>>> registerFlow(
            @Valid @RequestBody RegisterFlowRequest request) {
        var flow = new FlowDefinition(request.getId(), request.getName(), request.getFlowType());
        List<FlowStep> steps = request.getSteps().stream()
                .map(step -> new FlowStep(step.getStepNumber(), step.getFromServiceId(),
                        step.getToServiceId(), step.getServiceType()))
                .toList();

        catalog.registerFlow(flow, steps);

        Map<String, Object> registered = Map.of(
                "flowId", flow.id(),
                "name", flow.name(),
                "stepCount", steps.size());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(registered));
    }

    @PostMapping("/{flowId}/execute")
    @Operation(summary = "Execute a flow",
               description = "Synthesizes one trace of the flow, optionally failing a hop")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Trace synthesized"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Flow has no steps"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Flow not found")
    })
    public ResponseEntity<ApiResponse<Trace>> executeFlow(
            @Parameter(description = "Flow ID") @PathVariable String flowId,
            @Parameter(description = "Deployment environment stamped on the spans")
            @RequestParam(required = false) String environment,
            @Parameter(description = "Fail one hop of the flow")
            @RequestParam(defaultValue = "false") boolean injectFailure,
            @Parameter(description = "Zero-based hop to fail; random when omitted")
            @RequestParam(required = false) Integer failureStep) {
        var trace = synthesizer.executeFlow(flowId, environment, injectFailure, failureStep);
        return ResponseEntity.ok(ApiResponse.success(trace));
    }

    @PostMapping("/execute-all")
    @Operation(summary = "Execute every flow", description = "Synthesizes one trace per registered flow")
    public ResponseEntity<ApiResponse<List<TraceSummaryResponse>>> executeAll(
            @Parameter(description = "Deployment environment stamped on the spans")
            @RequestParam(required = false) String environment) {
        var summaries = synthesizer.executeAll(environment).stream()
                .map(TraceSummaryResponse::from)
                .toList();
        return ResponseEntity.ok(ApiResponse.success(summaries, Map.of("count", summaries.size())));
    }

    @GetMapping("/{flowId}/traces")
    @Operation(summary = "List traces of a flow", description = "Returns buffered traces of the flow, newest first")
    public ResponseEntity<ApiResponse<List<TraceSummaryResponse>>> getFlowTraces(
            @Parameter(description = "Flow ID") @PathVariable String flowId) {
        var summaries = traceBuffer.getTracesForFlow(flowId).stream()
                .map(TraceSummaryResponse::from)
                .toList();
        return ResponseEntity.ok(ApiResponse.success(summaries, Map.of("count", summaries.size())));
    }
}
