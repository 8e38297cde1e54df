package prism.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import prism.coordinator.model.Configuration;

import java.time.Instant;

/**
 * Trace configuration on the wire, in both directions.
 * POST /api/v1/configs, GET /api/v1/configs/{id}, GET /internal/v1/configs/{id}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ConfigurationDto(
        @JsonProperty("config_id") String configId,
        @JsonProperty("config_name") String configName,
        @JsonProperty("config_text") String configText,
        @JsonProperty("tracing_tool") String tracingTool,
        @JsonProperty("default_duration") Integer defaultDuration,
        @JsonProperty("updated_at") Instant updatedAt) {

    public static ConfigurationDto from(Configuration c) {
        return new ConfigurationDto(c.id(), c.name(), c.text(), c.tool(), c.defaultDuration(), c.updatedAt());
    }

    public Configuration toModel() {
        return new Configuration(configId, configName, configText, tracingTool, defaultDuration, updatedAt);
    }
}
