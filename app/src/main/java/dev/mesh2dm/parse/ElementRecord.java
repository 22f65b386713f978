package dev.mesh2dm.parse;

import java.util.List;
import java.util.Objects;

/**
 * A mesh element parsed from one of the element cards.
 */
public record ElementRecord(Card card, long id, List<Long> nodeIds, List<MaterialId> materialIds) {

    public ElementRecord {
        Objects.requireNonNull(card, "card");
        if (!card.isElement()) {
            throw new IllegalArgumentException("Not an element card: " + card);
        }
        nodeIds = List.copyOf(Objects.requireNonNull(nodeIds, "nodeIds"));
        if (nodeIds.size() != card.nodeCount()) {
            throw new IllegalArgumentException(card + " elements require " + card.nodeCount()
                    + " nodes, got " + nodeIds.size());
        }
        materialIds = materialIds == null ? List.of() : List.copyOf(materialIds);
    }

    public int materialCount() {
        return materialIds.size();
    }
}
