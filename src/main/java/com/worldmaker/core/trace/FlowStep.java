package com.worldmaker.core.trace;

/**
 * One hop of a flow: {@code fromServiceId} calls {@code toServiceId}.
 *
 * @param serviceType protocol of the hop; when null the callee's type from the
 *                    service directory applies
 */
public record FlowStep(
        int stepNumber,
        String fromServiceId,
        String toServiceId,
        String serviceType
) {

    public FlowStep(int stepNumber, String fromServiceId, String toServiceId) {
        this(stepNumber, fromServiceId, toServiceId, null);
    }
}
