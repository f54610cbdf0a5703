package org.foxesworld.ecsave.engine.saveload;

import java.util.Objects;

/**
 * One component type's slice of a {@link WorldAccess}. Visitors only ever see this view.
 */
public final class TypedStorage<T> {

    private final WorldAccess world;
    private final Class<T> type;

    TypedStorage(WorldAccess world, Class<T> type) {
        this.world = Objects.requireNonNull(world, "world");
        this.type = Objects.requireNonNull(type, "type");
    }

    public boolean exists() { return world.hasStorage(type); }

    public T get(int entity) { return world.getComponent(entity, type); }

    public void insert(int entity, T value) { world.insertComponent(entity, type, value); }
}
