package org.foxesworld.ecsave.engine.saveload.format;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

public final class ObjectMappers {

    private ObjectMappers() {}

    /**
     * Mapper for component payloads and save files. Field-less marker-style components encode
     * as {@code {}} instead of failing; unknown properties still fail, there is no migration.
     */
    public static ObjectMapper standard() {
        return new ObjectMapper()
                .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
    }
}
