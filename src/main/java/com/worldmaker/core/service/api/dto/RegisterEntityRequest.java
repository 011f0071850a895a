package com.worldmaker.core.service.api.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * DTO for entity registration requests.
 *
 * Services read {@code service_type}, {@code api_version}, {@code platform_id}
 * and {@code metadata} from the fields map.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RegisterEntityRequest {

    /**
     * Entity type, e.g. service, platform.
     */
    @NotBlank(message = "type is required")
    private String type;

    @NotBlank(message = "id is required")
    private String id;

    private String name;

    /**
     * Free-form attributes.
     */
    private Map<String, Object> fields;
}
