package com.worldmaker.core.service.engine;

import com.worldmaker.core.service.config.MetricsConfig;
import com.worldmaker.core.service.config.WorldmakerConfig;
import com.worldmaker.core.service.runtime.TraceBuffer;
import com.worldmaker.core.trace.Trace;
import com.worldmaker.core.trace.TraceSynthesizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Adapter for the trace synthesizer.
 * Runs executions one at a time and retains every trace in the {@link TraceBuffer}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TraceSynthesizerAdapter {

    private final TraceSynthesizer synthesizer;
    private final TraceBuffer traceBuffer;
    private final WorldmakerConfig config;
    private final MetricsConfig metricsConfig;

    // ==================== Public API ====================

    /**
     * Executes one registered flow.
     *
     * @param environment deployment environment, the configured default when blank
     */
    public Trace executeFlow(String flowId, String environment, boolean injectFailure, Integer failureStep) {
        log.debug("Executing flow: flowId={}, injectFailure={}, failureStep={}", flowId, injectFailure, failureStep);

        Trace trace;
        synchronized (synthesizer) {
            trace = metricsConfig.getSynthesisTimer().record(() ->
                    synthesizer.executeById(flowId, environmentOrDefault(environment), injectFailure, failureStep));
        }
        retain(trace);
        return trace;
    }

    /**
     * Executes every registered flow once without failure injection.
     */
    public List<Trace> executeAll(String environment) {
        List<Trace> traces;
        synchronized (synthesizer) {
            traces = synthesizer.executeAll(environmentOrDefault(environment));
        }
        traces.forEach(this::retain);

        log.info("Executed {} flows", traces.size());
        return traces;
    }

    public int executionCount() {
        synchronized (synthesizer) {
            return synthesizer.executionCount();
        }
    }

    // --- Private helpers ---

    private void retain(Trace trace) {
        traceBuffer.store(trace);
        metricsConfig.getTracesSynthesized().increment();
        if (trace.failed()) {
            metricsConfig.getTracesFailed().increment();
            log.warn("Flow {} failed at step {}: {}", trace.flowId(),
                    trace.error().step(), trace.error().error());
        }
    }

    private String environmentOrDefault(String environment) {
        return environment == null || environment.isBlank()
                ? config.getTrace().getDefaultEnvironment()
                : environment;
    }
}
