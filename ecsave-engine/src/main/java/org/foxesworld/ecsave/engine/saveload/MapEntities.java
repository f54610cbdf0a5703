package org.foxesworld.ecsave.engine.saveload;

/**
 * Implemented by components whose fields reference other entities.
 *
 * <p>Every entity-valued field must go through the mapper. A field that is skipped ends up
 * holding a live id in the save, which points at nothing (or at the wrong entity) after load.
 *
 * @param <T> the component type itself
 */
public interface MapEntities<T> {

    /**
     * @return a copy of this component with every entity field passed through {@code mapper};
     *         this instance must not be modified
     */
    T mapEntities(EntityMapper mapper);
}
