package dev.mesh2dm.parse;

import java.util.List;

/**
 * Parses {@code ND id x y z} cards.
 * <p>
 * Fields after {@code z} are accepted and ignored.
 */
public final class NodeParser {

    static final int REQUIRED_FIELDS = 4;

    private final boolean allowZeroIndex;

    public NodeParser() {
        this(false);
    }

    public NodeParser(boolean allowZeroIndex) {
        this.allowZeroIndex = allowZeroIndex;
    }

    public NodeRecord parse(String line) {
        List<String> chunks = LineTokenizer.chunks(line);
        if (chunks.size() < REQUIRED_FIELDS + 1) {
            throw CardException.insufficientFields(chunks.isEmpty() ? null : chunks.get(0),
                    "Node definitions require at least 4 fields (id, x, y, z)",
                    REQUIRED_FIELDS, chunks.size() - 1);
        }
        String card = chunks.get(0);
        if (!Card.ND.keyword().equals(card)) {
            throw CardException.unrecognized("node", card);
        }
        long id = Identifiers.parse(chunks.get(1), "node", allowZeroIndex);
        double x = NumericLiterals.toFloat(chunks.get(2));
        double y = NumericLiterals.toFloat(chunks.get(3));
        double z = NumericLiterals.toFloat(chunks.get(4));
        return new NodeRecord(id, x, y, z);
    }

    /**
     * Number of chunks past {@code z} on a node line; the parser itself never rejects them.
     */
    public static int unusedFieldCount(String line) {
        return Math.max(0, LineTokenizer.chunks(line).size() - (REQUIRED_FIELDS + 1));
    }
}
