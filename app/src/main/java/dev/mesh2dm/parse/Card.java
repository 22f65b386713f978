package dev.mesh2dm.parse;

import java.util.Optional;

/**
 * 2DM card keywords understood by the line parsers.
 */
public enum Card {
    ND(0),
    NS(0),
    E2L(2),
    E3L(3),
    E3T(3),
    E4Q(4),
    E6T(6),
    E8Q(8),
    E9Q(9);

    private final int nodeCount;

    Card(int nodeCount) {
        this.nodeCount = nodeCount;
    }

    /**
     * Number of defining nodes for element cards, zero for {@link #ND} and {@link #NS}.
     */
    public int nodeCount() {
        return nodeCount;
    }

    public boolean isElement() {
        return nodeCount > 0;
    }

    public String keyword() {
        return name();
    }

    /**
     * Looks up a card by its exact, case-sensitive keyword.
     */
    public static Optional<Card> fromKeyword(String keyword) {
        if (keyword == null) {
            return Optional.empty();
        }
        for (Card card : values()) {
            if (card.name().equals(keyword)) {
                return Optional.of(card);
            }
        }
        return Optional.empty();
    }

    public static Optional<Card> element(String keyword) {
        return fromKeyword(keyword).filter(Card::isElement);
    }
}
