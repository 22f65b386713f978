package dev.mesh2dm.parse;

/**
 * Kind of numeric literal a field was expected to hold.
 */
public enum NumericType {
    INTEGER,
    FLOAT;

    String label() {
        return this == INTEGER ? "integer" : "float";
    }
}
