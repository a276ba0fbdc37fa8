package testlab.master.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import testlab.master.multinode.Message;
import testlab.master.multinode.SyncResult;

import java.util.Map;

/**
 * Answer to a barrier, send or receive call. {@code status} is one of OK,
 * TIMEOUT, PEER_FAILED or CANCELED; the other fields are set only on OK.
 *
 * @param payloads barrier result: role to merged payload
 * @param message  send or receive result
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SyncResponse(
        @JsonProperty("status") String status,
        @JsonProperty("payloads") Map<String, Map<String, String>> payloads,
        @JsonProperty("message") Message message) {

    public static SyncResponse fromBarrier(SyncResult<Map<String, Map<String, String>>> result) {
        return new SyncResponse(result.status().name(), result.isOk() ? result.value() : null, null);
    }

    public static SyncResponse fromMessage(SyncResult<Message> result) {
        return new SyncResponse(result.status().name(), null, result.isOk() ? result.value() : null);
    }
}
