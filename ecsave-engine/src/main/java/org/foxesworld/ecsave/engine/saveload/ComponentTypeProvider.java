package org.foxesworld.ecsave.engine.saveload;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.List;

/**
 * ServiceLoader entry point: a module lists its persistable component types here and
 * names the implementation in {@code META-INF/services}.
 */
public interface ComponentTypeProvider {

    /** unique provider id, used in logs and duplicate detection */
    String id();

    /** @param mapper the registry's mapper, for Jackson-backed codecs */
    List<ComponentType<?>> types(ObjectMapper mapper);
}
