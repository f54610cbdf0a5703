package org.foxesworld.ecsave.engine.saveload;

import java.util.List;

/**
 * What save/load needs from an ECS world. Entity ids are opaque to the caller;
 * implementations may reuse them after destruction.
 */
public interface WorldAccess {

    int createEntity();

    boolean hasComponent(int entity, Class<?> type);

    /** @return the component, or null when the entity does not own one */
    <T> T getComponent(int entity, Class<T> type);

    /** Adds or replaces the component on a live entity. */
    <T> void insertComponent(int entity, Class<T> type, T value);

    /** Every entity owning the type, in a stable order. */
    List<Integer> entitiesWith(Class<?> type);

    /** False when the world never stored the type at all. */
    default boolean hasStorage(Class<?> type) {
        return !entitiesWith(type).isEmpty();
    }
}
