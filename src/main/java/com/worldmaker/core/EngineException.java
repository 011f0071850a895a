package com.worldmaker.core;

/**
 * Exception thrown when a caller hands the engine malformed input or asks for
 * a collaborator that was never configured.
 *
 * Graph states such as cycles, unreachable nodes or unknown ids are data, not
 * errors, and never surface as this exception.
 */
public class EngineException extends RuntimeException {

    public static final String INVALID_INPUT = "INVALID_INPUT";
    public static final String UNCONFIGURED = "UNCONFIGURED";
    public static final String FLOW_NOT_FOUND = "FLOW_NOT_FOUND";
    public static final String ENTITY_NOT_FOUND = "ENTITY_NOT_FOUND";

    private final String entityId;
    private final String errorCode;

    public EngineException(String message, String errorCode) {
        super(message);
        this.entityId = null;
        this.errorCode = errorCode;
    }

    public EngineException(String message, String entityId, String errorCode) {
        super(message);
        this.entityId = entityId;
        this.errorCode = errorCode;
    }

    public static EngineException invalidInput(String message, String entityId) {
        return new EngineException(message, entityId, INVALID_INPUT);
    }

    public static EngineException unconfigured(String collaborator) {
        return new EngineException(collaborator + " not configured", UNCONFIGURED);
    }

    public static EngineException flowNotFound(String flowId) {
        return new EngineException("Flow not found: " + flowId, flowId, FLOW_NOT_FOUND);
    }

    public static EngineException entityNotFound(String type, String id) {
        return new EngineException("Entity not found: " + type + "/" + id, id, ENTITY_NOT_FOUND);
    }

    public String getEntityId() {
        return entityId;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
