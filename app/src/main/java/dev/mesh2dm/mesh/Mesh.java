package dev.mesh2dm.mesh;

import dev.mesh2dm.parse.ElementRecord;
import dev.mesh2dm.parse.NodeRecord;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;

/**
 * In-memory contents of a 2DM file.
 * <p>
 * Node and element IDs are consecutive, starting at 1 (or 0 for zero-indexed meshes), so lookups by ID are
 * positional.
 */
public record Mesh(
        String name,
        int materialsPerElement,
        boolean zeroIndex,
        List<NodeRecord> nodes,
        List<ElementRecord> elements,
        List<NodeString> nodeStrings,
        Map<String, Integer> skippedCards
) {

    public static final String DEFAULT_NAME = "Unnamed mesh";

    public Mesh {
        name = name == null || name.isBlank() ? DEFAULT_NAME : name;
        if (materialsPerElement < 0) {
            throw new IllegalArgumentException("materialsPerElement must be zero or greater");
        }
        nodes = List.copyOf(Objects.requireNonNull(nodes, "nodes"));
        elements = List.copyOf(Objects.requireNonNull(elements, "elements"));
        nodeStrings = nodeStrings == null ? List.of() : List.copyOf(nodeStrings);
        skippedCards = skippedCards == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(skippedCards));
    }

    public Mesh(String name, int materialsPerElement, boolean zeroIndex,
                List<NodeRecord> nodes, List<ElementRecord> elements, List<NodeString> nodeStrings) {
        this(name, materialsPerElement, zeroIndex, nodes, elements, nodeStrings, Map.of());
    }

    public NodeRecord node(long id) {
        return nodes.get(index(id, nodes.size(), "node"));
    }

    public ElementRecord element(long id) {
        return elements.get(index(id, elements.size(), "element"));
    }

    public Optional<NodeString> nodeString(String name) {
        return nodeStrings.stream()
                .filter(nodeString -> nodeString.name().filter(name::equals).isPresent())
                .findFirst();
    }

    public Extent extent() {
        if (nodes.isEmpty()) {
            return Extent.EMPTY;
        }
        double minX = Double.POSITIVE_INFINITY;
        double maxX = Double.NEGATIVE_INFINITY;
        double minY = Double.POSITIVE_INFINITY;
        double maxY = Double.NEGATIVE_INFINITY;
        for (NodeRecord node : nodes) {
            minX = Math.min(minX, node.x());
            maxX = Math.max(maxX, node.x());
            minY = Math.min(minY, node.y());
            maxY = Math.max(maxY, node.y());
        }
        return new Extent(minX, maxX, minY, maxY);
    }

    private int index(long id, int size, String entity) {
        long first = zeroIndex ? 0 : 1;
        long offset = id - first;
        if (offset < 0 || offset >= size) {
            throw new NoSuchElementException("Invalid " + entity + " ID " + id + ", " + entity
                    + " IDs must be between " + first + " and " + (first + size - 1));
        }
        return (int) offset;
    }
}
