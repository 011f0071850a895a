package com.worldmaker.core.trace;

import java.util.List;
import java.util.Optional;

/**
 * External store of flows, their steps and the services they touch.
 */
public interface FlowSource {

    Optional<FlowDefinition> findFlow(String flowId);

    /**
     * Steps of a flow, in any order.
     */
    List<FlowStep> findSteps(String flowId);

    Optional<ServiceDescriptor> findService(String serviceId);

    List<FlowDefinition> findAllFlows();
}
