package prism.coordinator.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * POST /internal/v1/storage/upload
 */
public record UploadResponse(
        @JsonProperty("bucket") String bucket,
        @JsonProperty("object_name") String objectName,
        @JsonProperty("size") long size) {
}
