package com.worldmaker.core.trace;

/**
 * Where and how a flow execution failed.
 *
 * @param step zero-based index of the failing hop
 */
public record TraceError(int step, String fromService, String toService, String error) {}
