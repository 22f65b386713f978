package dev.mesh2dm.parse;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Splits a single 2DM line into its data chunks.
 */
public final class LineTokenizer {

    private static final char COMMENT = '#';

    private LineTokenizer() {
    }

    /**
     * Returns the whitespace-separated fields of {@code line}, ignoring anything after the first {@code #}.
     * An empty or comment-only line yields an empty list.
     */
    public static List<String> chunks(String line) {
        Objects.requireNonNull(line, "line");
        int end = line.indexOf(COMMENT);
        if (end < 0) {
            end = line.length();
        }

        List<String> chunks = new ArrayList<>();
        int index = 0;
        while (index < end) {
            while (index < end && isSeparator(line.charAt(index))) {
                index++;
            }
            int start = index;
            while (index < end && !isSeparator(line.charAt(index))) {
                index++;
            }
            if (index > start) {
                chunks.add(line.substring(start, index));
            }
        }
        return chunks.isEmpty() ? Collections.emptyList() : chunks;
    }

    static boolean isSeparator(char ch) {
        return switch (ch) {
            case ' ', '\t', '\n', '\r', '\f', '\u000B' -> true;
            default -> false;
        };
    }
}
