package dev.mesh2dm.parse;

/**
 * Base class for malformed 2DM content.
 */
public class MeshFormatException extends RuntimeException {

    public MeshFormatException(String message) {
        super(message);
    }

    public MeshFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
