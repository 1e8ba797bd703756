package taskline.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Service description served at the root path.
 */
public record ServiceInfoResponse(
        @JsonProperty("name") String name,
        @JsonProperty("description") String description,
        @JsonProperty("version") String version,
        @JsonProperty("endpoints") Map<String, String> endpoints) {
}
