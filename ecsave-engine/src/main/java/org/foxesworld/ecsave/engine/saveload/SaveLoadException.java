package org.foxesworld.ecsave.engine.saveload;

/**
 * Base of every save/load failure. All of them abort the running operation.
 */
public class SaveLoadException extends RuntimeException {

    public SaveLoadException(String message) {
        super(message);
    }

    public SaveLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
