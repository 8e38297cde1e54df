package prism.coordinator.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Generic response for internal API operations.
 *
 * @param result machine-readable outcome, e.g. {@code claimed} or {@code already_terminal}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OperationResponse(
        @JsonProperty("ok") boolean ok,
        @JsonProperty("result") String result,
        @JsonProperty("count") Integer count) {

    public static OperationResponse success(String result) {
        return new OperationResponse(true, result, null);
    }

    public static OperationResponse unchanged(String result) {
        return new OperationResponse(false, result, null);
    }

    public static OperationResponse counted(int count) {
        return new OperationResponse(true, null, count);
    }
}
