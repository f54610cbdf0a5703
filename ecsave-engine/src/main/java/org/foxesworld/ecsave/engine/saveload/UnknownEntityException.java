package org.foxesworld.ecsave.engine.saveload;

/**
 * A reference points outside the persisted entities: a live id that is not marked
 * (save), or an ordinal that cannot exist (load).
 */
public final class UnknownEntityException extends SaveLoadException {

    private final int id;

    public UnknownEntityException(String message, int id) {
        super(message);
        this.id = id;
    }

    /** The offending live id or ordinal. */
    public int id() {
        return id;
    }
}
