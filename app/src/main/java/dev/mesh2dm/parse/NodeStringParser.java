package dev.mesh2dm.parse;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses {@code NS} cards.
 * <p>
 * A node string may continue over several lines. Each call appends the line's node IDs to the accumulator handed
 * in by the caller; the string is complete once a negative node ID is read. That ID contributes its absolute value,
 * and the single token after it, if present, is the node string's label. Anything after the label is dropped.
 * A line that fails to parse leaves the accumulator unchanged.
 */
public final class NodeStringParser {

    private static final int REQUIRED_FIELDS = 1;

    private final boolean allowZeroIndex;

    public NodeStringParser() {
        this(false);
    }

    public NodeStringParser(boolean allowZeroIndex) {
        this.allowZeroIndex = allowZeroIndex;
    }

    public NodeStringResult parse(String line) {
        return parse(line, null);
    }

    /**
     * @param nodes node IDs collected from previous lines of the same node string, or {@code null} to start a new one
     * @throws IllegalArgumentException if {@code nodes} cannot be appended to
     */
    public NodeStringResult parse(String line, List<Long> nodes) {
        List<Long> accumulator = nodes == null ? new ArrayList<>() : nodes;
        List<String> chunks = LineTokenizer.chunks(line);
        if (chunks.size() < REQUIRED_FIELDS + 1) {
            throw CardException.insufficientFields(chunks.isEmpty() ? null : chunks.get(0),
                    "Node string definitions require at least 1 field (node_id)",
                    REQUIRED_FIELDS, chunks.size() - 1);
        }
        String card = chunks.get(0);
        if (!Card.NS.keyword().equals(card)) {
            throw CardException.unrecognized("node string", card);
        }

        List<Long> parsed = new ArrayList<>(chunks.size() - 1);
        boolean closed = false;
        String label = "";
        for (int index = 1; index < chunks.size(); index++) {
            String field = chunks.get(index);
            long nodeId = NumericLiterals.toInteger(field);
            if (nodeId == 0 && !allowZeroIndex) {
                throw new InvalidIdentifierException("node", nodeId);
            }
            if (nodeId < 0) {
                if (nodeId == Long.MIN_VALUE) {
                    throw new NumericLiteralException(field, NumericType.INTEGER, true);
                }
                parsed.add(-nodeId);
                closed = true;
                if (index + 1 < chunks.size()) {
                    label = chunks.get(index + 1);
                }
                break;
            }
            parsed.add(nodeId);
        }
        append(accumulator, parsed);
        return new NodeStringResult(accumulator, closed, label);
    }

    private static void append(List<Long> accumulator, List<Long> parsed) {
        try {
            accumulator.addAll(parsed);
        } catch (UnsupportedOperationException ex) {
            throw new IllegalArgumentException("Node string accumulator must be a modifiable list", ex);
        }
    }
}
