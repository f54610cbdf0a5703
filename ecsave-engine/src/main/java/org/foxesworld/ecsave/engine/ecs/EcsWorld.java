package org.foxesworld.ecsave.engine.ecs;

import org.foxesworld.ecsave.engine.saveload.WorldAccess;

import java.util.List;

public final class EcsWorld implements WorldAccess {

    private final EntityManager entities = new EntityManager();
    private final ComponentStore components = new ComponentStore();

    public EntityManager entities() { return entities; }
    public ComponentStore components() { return components; }

    @Override
    public int createEntity() { return entities.create(); }

    /** Destroys the entity and drops every component it owned. */
    public void destroyEntity(int id) {
        if (entities.destroy(id)) components.removeAll(id);
    }

    @Override
    public boolean hasComponent(int entity, Class<?> type) {
        return components.has(entity, type);
    }

    @Override
    public <T> T getComponent(int entity, Class<T> type) {
        return components.get(entity, type);
    }

    @Override
    public <T> void insertComponent(int entity, Class<T> type, T value) {
        if (!entities.isAlive(entity)) {
            throw new IllegalArgumentException("entity " + entity + " is not alive");
        }
        components.put(entity, type, value);
    }

    @Override
    public List<Integer> entitiesWith(Class<?> type) {
        return components.owners(type);
    }

    @Override
    public boolean hasStorage(Class<?> type) {
        return components.hasStorage(type);
    }

    /** Full reset: every entity and component is dropped. */
    public void reset() {
        entities.reset();
        components.reset();
    }
}
