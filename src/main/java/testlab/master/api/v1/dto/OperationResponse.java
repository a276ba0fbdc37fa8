package testlab.master.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Result of a state-changing call that reports an enum outcome
 * (cancel, outcome callbacks).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OperationResponse(
        @JsonProperty("ok") boolean ok,
        @JsonProperty("result") String result,
        @JsonProperty("error") String error) {

    public static OperationResponse success(Enum<?> result) {
        return new OperationResponse(true, result.name(), null);
    }

    public static OperationResponse error(Enum<?> result, String error) {
        return new OperationResponse(false, result.name(), error);
    }
}
