package org.foxesworld.ecsave.engine.saveload;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Objects;

/**
 * Databind-based codec: public fields / getters out, creator or no-arg constructor in.
 * A JSON {@code null} payload is read as {@code {}}, which is how field-less components
 * may be written.
 */
public final class JacksonComponentCodec<T> implements ComponentCodec<T> {

    private final ObjectMapper mapper;
    private final Class<T> type;

    public JacksonComponentCodec(ObjectMapper mapper, Class<T> type) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.type = Objects.requireNonNull(type, "type");
    }

    @Override
    public JsonNode encode(T component) {
        try {
            return mapper.valueToTree(component);
        } catch (IllegalArgumentException e) {
            throw new EncodingException("Cannot encode " + type.getSimpleName() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public T decode(JsonNode payload) {
        try {
            JsonNode tree = payload == null || payload.isNull() || payload.isMissingNode()
                    ? mapper.createObjectNode()
                    : payload;
            T value = mapper.treeToValue(tree, type);
            if (value == null) {
                throw new EncodingException("Payload for " + type.getSimpleName() + " decoded to null");
            }
            return value;
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new EncodingException("Cannot decode " + type.getSimpleName() + ": " + e.getMessage(), e);
        }
    }
}
