package dev.mesh2dm.mesh;

/**
 * Runtime exception for 2DM files that cannot be read, pointing at the offending line where there is one.
 */
public class MeshReadException extends RuntimeException {

    private final String source;
    private final int lineNumber;

    public MeshReadException(String source, int lineNumber, String message) {
        this(source, lineNumber, message, null);
    }

    public MeshReadException(String source, int lineNumber, String message, Throwable cause) {
        super(message + location(source, lineNumber), cause);
        this.source = source;
        this.lineNumber = lineNumber;
    }

    private static String location(String source, int lineNumber) {
        if (lineNumber > 0) {
            return " (" + source + ":" + lineNumber + ")";
        }
        return " (" + source + ")";
    }

    public String source() {
        return source;
    }

    /**
     * 1-based line number, or 0 when the problem concerns the whole file.
     */
    public int lineNumber() {
        return lineNumber;
    }
}
