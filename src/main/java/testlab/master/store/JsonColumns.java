package testlab.master.store;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import testlab.master.model.DeviceRequirement;

import java.util.Map;

/**
 * Jackson mapping for CLOB columns that hold structured values.
 */
final class JsonColumns {

    private static final ObjectMapper MAPPER = new ObjectMapper().findAndRegisterModules();
    private static final TypeReference<Map<String, String>> STRING_MAP = new TypeReference<>() {
    };

    private JsonColumns() {
    }

    /** Stored form of a job's device request: exactly one of the two fields is set. */
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    record Requirements(
            @JsonProperty("device") DeviceRequirement device,
            @JsonProperty("roles") Map<String, DeviceRequirement> roles) {
    }

    static String writeRequirements(DeviceRequirement device, Map<String, DeviceRequirement> roles) {
        return write(new Requirements(device, roles == null || roles.isEmpty() ? null : roles));
    }

    static Requirements readRequirements(String json) {
        try {
            return MAPPER.readValue(json, Requirements.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt requirements column: " + json, e);
        }
    }

    static String writeStringMap(Map<String, String> map) {
        return write(map == null ? Map.of() : map);
    }

    static Map<String, String> readStringMap(String json) {
        try {
            return MAPPER.readValue(json, STRING_MAP);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt payload column: " + json, e);
        }
    }

    private static String write(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize " + value, e);
        }
    }
}
