package dev.mesh2dm.parse;

/**
 * Material value attached to an element. Integer and floating point values keep their type.
 */
public record MaterialId(Number value) {

    public MaterialId {
        if (!(value instanceof Long) && !(value instanceof Double)) {
            throw new IllegalArgumentException("Material IDs must be Long or Double values: " + value);
        }
    }

    public static MaterialId ofInteger(long value) {
        return new MaterialId(value);
    }

    public static MaterialId ofFloat(double value) {
        return new MaterialId(value);
    }

    public boolean isFloat() {
        return value instanceof Double;
    }

    public long longValue() {
        if (isFloat()) {
            throw new IllegalStateException("Material ID " + value + " is not an integer");
        }
        return value.longValue();
    }

    public double doubleValue() {
        return value.doubleValue();
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
