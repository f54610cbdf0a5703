package org.foxesworld.ecsave.engine.saveload;

import org.foxesworld.ecsave.engine.ecs.components.PersistentComponent;

import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Knows which component type flags an entity for persistence.
 *
 * @param <M> marker component type
 */
public final class MarkerRegistry<M> {

    private final Class<M> type;
    private final Supplier<? extends M> factory;

    public MarkerRegistry(Class<M> type, Supplier<? extends M> factory) {
        this.type = Objects.requireNonNull(type, "type");
        this.factory = Objects.requireNonNull(factory, "factory");
    }

    /** Registry for the engine's own {@link PersistentComponent}. */
    public static MarkerRegistry<PersistentComponent> persistent() {
        return new MarkerRegistry<>(PersistentComponent.class, () -> PersistentComponent.INSTANCE);
    }

    public Class<M> type() {
        return type;
    }

    /**
     * Marked entities in world order. Always read fresh from the world; an empty world
     * yields an empty list. Duplicates are passed through untouched so the translator can
     * reject them.
     */
    public List<Integer> collectMarked(WorldAccess world) {
        Objects.requireNonNull(world, "world");
        return List.copyOf(world.entitiesWith(type));
    }

    public boolean isMarked(WorldAccess world, int entity) {
        return world.hasComponent(entity, type);
    }

    public void mark(WorldAccess world, int entity) {
        M marker = Objects.requireNonNull(factory.get(), "marker factory returned null");
        world.insertComponent(entity, type, marker);
    }
}
