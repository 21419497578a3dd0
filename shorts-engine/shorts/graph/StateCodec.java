package shorts.graph;

import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

import shorts.model.PipelineState;

/**
 * JSON form of the pipeline state and of suspension payloads. Output is stable:
 * properties are sorted and map entries ordered by key, so an unchanged state
 * always serializes to the same text.
 */
public class StateCodec {

    private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public StateCodec() {
        this.objectMapper = JsonMapper.builder()
                .propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build();
    }

    public String write(PipelineState state) {
        try {
            return objectMapper.writeValueAsString(state);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to serialize pipeline state", e);
        }
    }

    public PipelineState read(String json) {
        try {
            return objectMapper.readValue(json, PipelineState.class);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to deserialize pipeline state", e);
        }
    }

    /**
     * Deep copy through the JSON form.
     */
    public PipelineState copy(PipelineState state) {
        return read(write(state));
    }

    public String writePayload(Map<String, Object> payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to serialize suspension payload", e);
        }
    }

    /**
     * Reads a payload back into plain maps, lists and scalars, the same shape a
     * front door would hand to a client.
     */
    public Map<String, Object> readPayload(String json) {
        if (json == null || json.isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            return objectMapper.readValue(json, PAYLOAD_TYPE);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to deserialize suspension payload", e);
        }
    }
}
