package com.worldmaker.core.trace;

import java.util.Map;

/**
 * Directory entry for a service taking part in a flow.
 */
public record ServiceDescriptor(
        String id,
        String name,
        String serviceType,
        String apiVersion,
        Map<String, Object> metadata
) {

    public ServiceDescriptor {
        metadata = metadata == null ? Map.of() : metadata;
    }
}
