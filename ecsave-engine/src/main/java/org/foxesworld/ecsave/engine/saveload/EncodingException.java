package org.foxesworld.ecsave.engine.saveload;

/**
 * The payload encoder or decoder failed. The underlying failure is kept as the cause.
 */
public final class EncodingException extends SaveLoadException {

    public EncodingException(String message) {
        super(message);
    }

    public EncodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
