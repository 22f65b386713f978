package dev.mesh2dm.write;

/**
 * Output settings for {@link CardFormatter} and {@link MeshWriter}.
 *
 * @param decimals        digits after the decimal point in scientific notation; 16 keeps every double exact
 * @param compact         write the shortest decimal that reads back to the same value instead of scientific notation
 * @param allowFloatMatid keep floating point material IDs; when {@code false} they are dropped
 * @param nodesPerLine    maximum node IDs per {@code NS} line
 */
public record WriterOptions(int decimals, boolean compact, boolean allowFloatMatid, int nodesPerLine) {

    public static final int DEFAULT_DECIMALS = 16;
    public static final int DEFAULT_NODES_PER_LINE = 10;
    static final int MAX_DECIMALS = 17;

    public WriterOptions {
        if (decimals < 0 || decimals > MAX_DECIMALS) {
            throw new IllegalArgumentException("decimals must be between 0 and " + MAX_DECIMALS);
        }
        if (nodesPerLine < 1) {
            throw new IllegalArgumentException("nodesPerLine must be at least 1");
        }
    }

    public static WriterOptions defaults() {
        return new WriterOptions(DEFAULT_DECIMALS, false, true, DEFAULT_NODES_PER_LINE);
    }
}
