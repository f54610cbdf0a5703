package org.foxesworld.ecsave.engine.saveload;

public final class DuplicateEntityException extends SaveLoadException {

    private final int entity;

    public DuplicateEntityException(int entity) {
        super("Entity " + entity + " appears more than once in the persisted set");
        this.entity = entity;
    }

    public int entity() {
        return entity;
    }
}
