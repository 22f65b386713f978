package dev.mesh2dm.parse;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of parsing one {@code NS} line.
 *
 * @param nodes  the caller's accumulator with this line's node IDs appended
 * @param closed whether the line contained the terminating (negative) node ID
 * @param label  the token following the terminator, or an empty string
 */
public record NodeStringResult(List<Long> nodes, boolean closed, String label) {

    public NodeStringResult {
        Objects.requireNonNull(nodes, "nodes");
        label = label == null ? "" : label;
    }
}
