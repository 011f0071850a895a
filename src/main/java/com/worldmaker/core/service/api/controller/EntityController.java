package com.worldmaker.core.service.api.controller;

import com.worldmaker.core.EngineException;
import com.worldmaker.core.graph.EntityRecord;
import com.worldmaker.core.service.api.dto.ApiResponse;
import com.worldmaker.core.service.api.dto.RegisterEntityRequest;
import com.worldmaker.core.service.catalog.EntityCatalog;
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

/**
 * Controller for the entity catalog.
 * Registers the services and platforms the graph refers to.
 */
@Slf4j
@RestController
@RequestMapping("/entities")
@Tag(name = "Entity Catalog", description = "Endpoints for registering services, platforms and other entities")
@RequiredArgsConstructor
public class EntityController {

    private final EntityCatalog catalog;

    @PostMapping
    @Operation(summary = "Register an entity", description = "Stores or replaces an entity by type and id")
    public ResponseEntity<ApiResponse<EntityRecord>> registerEntity(
            @Valid @RequestBody RegisterEntityRequest request) {
        var entity = catalog.register(new EntityRecord(
                request.getType(), request.getId(), request.getName(), request.getFields()));

        log.info("Registered {} {}", entity.type(), entity.id());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(entity));
    }

    @GetMapping("/{type}/{id}")
    @Operation(summary = "Get an entity")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Entity found"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Entity not found")
    })
    public ResponseEntity<ApiResponse<EntityRecord>> getEntity(
            @Parameter(description = "Entity type") @PathVariable String type,
            @Parameter(description = "Entity ID") @PathVariable String id) {
        return catalog.get(type, id)
                .map(entity -> ResponseEntity.ok(ApiResponse.success(entity)))
                .orElseThrow(() -> EngineException.entityNotFound(type, id));
    }
}
