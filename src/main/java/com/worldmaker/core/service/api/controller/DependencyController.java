package com.worldmaker.core.service.api.controller;

import com.worldmaker.core.graph.DependencyEdge;
import com.worldmaker.core.graph.GraphOverview;
import com.worldmaker.core.graph.Severity;
import com.worldmaker.core.impact.FailureSimulation;
import com.worldmaker.core.impact.ImpactReport;
import com.worldmaker.core.resolve.CacheStats;
import com.worldmaker.core.resolve.DependencyResolution;
import com.worldmaker.core.resolve.ResolutionMode;
import com.worldmaker.core.service.api.dto.ApiResponse;
import com.worldmaker.core.service.api.dto.CircularDependencyResponse;
import com.worldmaker.core.service.api.dto.CreateDependencyRequest;
import com.worldmaker.core.service.catalog.EntityCatalog;
import com.worldmaker.core.service.engine.DependencyGraphAdapter;
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
 * Controller for the dependency graph.
 * Handles edge creation, dependency resolution, impact analysis and cache management.
 */
@Slf4j
@RestController
@Tag(name = "Dependency Graph", description = "Endpoints for recording and analysing service dependencies")
@RequiredArgsConstructor
public class DependencyController {

    private final DependencyGraphAdapter graph;
    private final EntityCatalog catalog;

    // ==================== Edges ====================

    @PostMapping("/dependencies")
    @Operation(summary = "Record a dependency",
               description = "Adds a source-depends-on-target edge; flags it circular when it closes a cycle")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "201", description = "Dependency recorded"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Invalid request")
    })
    public ResponseEntity<ApiResponse<DependencyEdge>> createDependency(
            @Valid @RequestBody CreateDependencyRequest request) {
        log.debug("Creating dependency: {} -> {}", request.getSourceId(), request.getTargetId());

        var edge = graph.addDependency(
                request.getSourceId(),
                request.getSourceType(),
                request.getTargetId(),
                request.getTargetType(),
                request.getDependencyType(),
                Severity.fromWire(request.getSeverity()));

        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(edge));
    }

    @GetMapping("/dependencies/circular")
    @Operation(summary = "List circular dependencies",
               description = "Returns the edges that closed a cycle when they were recorded")
    public ResponseEntity<ApiResponse<List<CircularDependencyResponse>>> getCircularDependencies(
            @Parameter(description = "Maximum number of edges to return")
            @RequestParam(defaultValue = "100") int limit) {
        var circular = graph.circularDependencies(limit).stream()
                .map(this::toCircularResponse)
                .toList();

        log.info("Returning {} circular dependencies", circular.size());
        return ResponseEntity.ok(ApiResponse.success(circular, Map.of("count", circular.size())));
    }

    @GetMapping("/dependencies/overview")
    @Operation(summary = "Graph overview", description = "Returns edge, circular edge and entity counts")
    public ResponseEntity<ApiResponse<GraphOverview>> getOverview() {
        return ResponseEntity.ok(ApiResponse.success(graph.overview()));
    }

    // ==================== Resolution & Impact ====================

    @GetMapping("/services/{serviceId}/dependencies")
    @Operation(summary = "Resolve dependencies",
               description = "Resolves direct, transitive, blast-radius or full dependencies, served from the TTL cache")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Resolution computed"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Unknown depth")
    })
    public ResponseEntity<ApiResponse<DependencyResolution>> getDependencies(
            @Parameter(description = "Service ID") @PathVariable String serviceId,
            @Parameter(description = "direct, transitive, blast-radius or full")
            @RequestParam(defaultValue = "direct") String depth) {
        log.debug("Resolving dependencies: serviceId={}, depth={}", serviceId, depth);
        var resolution = graph.resolve(serviceId, ResolutionMode.fromWire(depth));
        return ResponseEntity.ok(ApiResponse.success(resolution));
    }

    @GetMapping("/services/{serviceId}/blast-radius")
    @Operation(summary = "Blast radius",
               description = "Returns every entity that transitively depends on the service, with recommendations")
    public ResponseEntity<ApiResponse<ImpactReport>> getBlastRadius(
            @Parameter(description = "Service ID") @PathVariable String serviceId) {
        return ResponseEntity.ok(ApiResponse.success(graph.blastRadius(serviceId)));
    }

    @PostMapping("/simulate/failure/{serviceId}")
    @Operation(summary = "Simulate failure",
               description = "Estimates the impact of the service going down")
    public ResponseEntity<ApiResponse<FailureSimulation>> simulateFailure(
            @Parameter(description = "Service ID") @PathVariable String serviceId) {
        return ResponseEntity.ok(ApiResponse.success(graph.simulateFailure(serviceId)));
    }

    // ==================== Cache ====================

    @GetMapping("/dependencies/cache/stats")
    @Operation(summary = "Resolution cache statistics")
    public ResponseEntity<ApiResponse<CacheStats>> getCacheStats() {
        return ResponseEntity.ok(ApiResponse.success(graph.cacheStats()));
    }

    @DeleteMapping("/dependencies/cache")
    @Operation(summary = "Invalidate the resolution cache")
    public ResponseEntity<ApiResponse<Map<String, Object>>> invalidateCache() {
        graph.invalidateCache();
        Map<String, Object> result = Map.of("invalidated", "all");
        return ResponseEntity.ok(ApiResponse.success(result));
    }

    @DeleteMapping("/dependencies/cache/{entityId}")
    @Operation(summary = "Invalidate cached resolutions of one entity")
    public ResponseEntity<ApiResponse<Map<String, Object>>> invalidateCache(
            @Parameter(description = "Entity ID") @PathVariable String entityId) {
        int removed = graph.invalidateCache(entityId);
        Map<String, Object> result = Map.of("entityId", entityId, "invalidated", removed);
        return ResponseEntity.ok(ApiResponse.success(result));
    }

    // --- Private helpers ---

    private CircularDependencyResponse toCircularResponse(DependencyEdge edge) {
        return CircularDependencyResponse.builder()
                .edgeId(edge.id())
                .sourceId(edge.sourceId())
                .sourceName(catalog.resolve(edge.sourceType(), edge.sourceId()).name())
                .targetId(edge.targetId())
                .targetName(catalog.resolve(edge.targetType(), edge.targetId()).name())
                .dependencyType(edge.dependencyType())
                .severity(edge.severity().wireName())
                .createdAt(edge.createdAt())
                .build();
    }
}
