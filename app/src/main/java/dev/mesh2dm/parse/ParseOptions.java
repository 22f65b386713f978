package dev.mesh2dm.parse;

/**
 * Flags shared by the card parsers.
 *
 * @param allowZeroIndex  accept {@code 0} as an identifier in addition to positive values
 * @param allowFloatMatid accept floating point material IDs on element cards
 */
public record ParseOptions(boolean allowZeroIndex, boolean allowFloatMatid) {

    public static ParseOptions defaults() {
        return new ParseOptions(false, true);
    }

    public ParseOptions withZeroIndex(boolean value) {
        return new ParseOptions(value, allowFloatMatid);
    }

    public ParseOptions withFloatMatid(boolean value) {
        return new ParseOptions(allowZeroIndex, value);
    }
}
