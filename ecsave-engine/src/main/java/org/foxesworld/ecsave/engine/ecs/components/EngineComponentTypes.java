package org.foxesworld.ecsave.engine.ecs.components;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.foxesworld.ecsave.engine.saveload.ComponentType;
import org.foxesworld.ecsave.engine.saveload.ComponentTypeProvider;

import java.util.List;

/**
 * The engine's own persistable components. The marker is not listed: it is implied by the save.
 */
public final class EngineComponentTypes implements ComponentTypeProvider {

    @Override public String id() { return "engine"; }

    @Override
    public List<ComponentType<?>> types(ObjectMapper mapper) {
        return List.of(
                ComponentType.of("Transform", TransformComponent.class, mapper),
                ComponentType.of("Script", ScriptComponent.class, mapper),
                ComponentType.of("Hierarchy", HierarchyComponent.class, mapper)
        );
    }
}
