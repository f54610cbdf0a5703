package org.foxesworld.ecsave.engine.saveload;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Turns one component into a structured payload tree and back.
 *
 * @throws EncodingException from either direction when the conversion fails
 */
public interface ComponentCodec<T> {

    JsonNode encode(T component);

    T decode(JsonNode payload);
}
