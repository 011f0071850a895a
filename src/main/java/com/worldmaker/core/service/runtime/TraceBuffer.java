package com.worldmaker.core.service.runtime;

import com.worldmaker.core.trace.Trace;

import java.util.Collection;
import java.util.Optional;

/**
 * Interface for the synthesized trace buffer.
 *
 * Temporary in-memory store for traces produced by flow executions.
 */
public interface TraceBuffer {

    /**
     * Stores a trace, evicting the oldest traces if the buffer is full.
     *
     * @param trace the trace to store
     */
    void store(Trace trace);

    /**
     * Retrieves a trace by ID.
     *
     * @param traceId the trace identifier
     * @return the trace if found
     */
    Optional<Trace> getTrace(String traceId);

    /**
     * Retrieves all stored traces, newest first.
     *
     * @return collection of traces
     */
    Collection<Trace> getAll();

    /**
     * Retrieves all traces of a flow, newest first.
     *
     * @param flowId the flow identifier
     * @return collection of traces
     */
    Collection<Trace> getTracesForFlow(String flowId);

    /**
     * Deletes a trace.
     *
     * @param traceId the trace identifier
     * @return true if deleted
     */
    boolean delete(String traceId);

    /**
     * Deletes all traces for a flow.
     *
     * @param flowId the flow identifier
     * @return number of traces deleted
     */
    int deleteTracesForFlow(String flowId);

    /**
     * Gets the count of stored traces.
     *
     * @return number of traces
     */
    int count();

    /**
     * Evicts expired traces based on TTL.
     *
     * @return number of traces evicted
     */
    int evictExpired();
}
