package org.foxesworld.ecsave.engine.saveload;

/**
 * Rewrites one entity id. During a save it maps live ids to ordinals, during a load
 * ordinals back to live ids.
 */
@FunctionalInterface
public interface EntityMapper {

    /** @throws UnknownEntityException when the id has no counterpart */
    int map(int entity);

    /** null means "no entity" and stays null. */
    default Integer mapOptional(Integer entity) {
        return entity == null ? null : map(entity);
    }

    /** @return a new array; the input is left untouched */
    default int[] mapAll(int[] entities) {
        if (entities == null) return null;
        int[] out = new int[entities.length];
        for (int i = 0; i < entities.length; i++) {
            out[i] = map(entities[i]);
        }
        return out;
    }
}
