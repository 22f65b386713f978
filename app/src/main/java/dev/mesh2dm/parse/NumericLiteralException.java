package dev.mesh2dm.parse;

/**
 * Raised when a field is not a valid numeric literal of the expected type.
 */
public class NumericLiteralException extends MeshFormatException {

    private final String field;
    private final NumericType expected;
    private final boolean outOfRange;

    public NumericLiteralException(String field, NumericType expected, boolean outOfRange) {
        super(outOfRange
                ? "Integer literal out of range: '" + field + "'"
                : "Invalid " + expected.label() + " literal: '" + field + "'");
        this.field = field;
        this.expected = expected;
        this.outOfRange = outOfRange;
    }

    public String field() {
        return field;
    }

    public NumericType expected() {
        return expected;
    }

    public boolean outOfRange() {
        return outOfRange;
    }
}
