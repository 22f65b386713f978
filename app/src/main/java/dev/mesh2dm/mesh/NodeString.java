package dev.mesh2dm.mesh;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A completed node string: an ordered polyline of node IDs with an optional name.
 */
public record NodeString(List<Long> nodes, Optional<String> name) {

    public NodeString {
        nodes = List.copyOf(Objects.requireNonNull(nodes, "nodes"));
        if (nodes.isEmpty()) {
            throw new IllegalArgumentException("Node strings require at least one node");
        }
        name = name == null ? Optional.empty() : name.filter(value -> !value.isEmpty());
    }

    public static NodeString unnamed(List<Long> nodes) {
        return new NodeString(nodes, Optional.empty());
    }

    public static NodeString named(String name, List<Long> nodes) {
        return new NodeString(nodes, Optional.ofNullable(name));
    }
}
