package dev.mesh2dm.parse;

/**
 * Raised when a well-formed integer is not a legal identifier (zero without zero-indexing, or negative).
 */
public class InvalidIdentifierException extends MeshFormatException {

    private final String entity;
    private final long value;

    public InvalidIdentifierException(String entity, long value) {
        super("Invalid " + entity + " ID: " + value);
        this.entity = entity;
        this.value = value;
    }

    public String entity() {
        return entity;
    }

    public long value() {
        return value;
    }
}
