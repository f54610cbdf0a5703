package org.foxesworld.ecsave.engine.saveload;

/**
 * The type list names a component type that was never registered.
 */
public final class UnsupportedTypeException extends SaveLoadException {

    public UnsupportedTypeException(String message) {
        super(message);
    }
}
