package com.worldmaker.core.trace;

/**
 * The flow being executed.
 */
public record FlowDefinition(String id, String name, String flowType) {}
