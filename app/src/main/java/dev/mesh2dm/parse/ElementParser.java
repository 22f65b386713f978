package dev.mesh2dm.parse;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalLong;

/**
 * Parses element cards ({@code E2L}, {@code E3L}, {@code E3T}, {@code E4Q}, {@code E6T}, {@code E8Q},
 * {@code E9Q}) into an ID, the card's fixed number of node IDs and any trailing material IDs.
 * <p>
 * Material IDs are read as integers first. When float material IDs are allowed a field that is not an integer is
 * read again as a float, which is how BASEMENT 3.x stores element centroid elevations.
 */
public final class ElementParser {

    private static final int GENERIC_REQUIRED_FIELDS = 3;

    private final boolean allowZeroIndex;
    private final boolean allowFloatMatid;

    public ElementParser() {
        this(false, true);
    }

    public ElementParser(boolean allowZeroIndex, boolean allowFloatMatid) {
        this.allowZeroIndex = allowZeroIndex;
        this.allowFloatMatid = allowFloatMatid;
    }

    public ElementRecord parse(String line) {
        List<String> chunks = LineTokenizer.chunks(line);
        if (chunks.size() < GENERIC_REQUIRED_FIELDS + 1) {
            throw CardException.insufficientFields(chunks.isEmpty() ? null : chunks.get(0),
                    "Element definitions require at least 3 fields (id, node_1, node_2)",
                    GENERIC_REQUIRED_FIELDS, chunks.size() - 1);
        }
        String keyword = chunks.get(0);
        Card card = Card.element(keyword)
                .orElseThrow(() -> CardException.unrecognized("element", keyword));

        int nodeCount = card.nodeCount();
        int required = nodeCount + 1;
        if (chunks.size() < required + 1) {
            throw CardException.insufficientFields(keyword,
                    keyword + " element definition requires at least " + required
                            + " fields (id, node_1, ..., node_" + nodeCount + ")",
                    required, chunks.size() - 1);
        }

        long id = Identifiers.parse(chunks.get(1), "element", allowZeroIndex);
        List<Long> nodes = new ArrayList<>(nodeCount);
        for (String field : chunks.subList(2, nodeCount + 2)) {
            nodes.add(Identifiers.parse(field, "node", allowZeroIndex));
        }
        List<MaterialId> materials = new ArrayList<>(chunks.size() - nodeCount - 2);
        for (String field : chunks.subList(nodeCount + 2, chunks.size())) {
            materials.add(parseMaterial(field));
        }
        return new ElementRecord(card, id, nodes, materials);
    }

    private MaterialId parseMaterial(String field) {
        if (!allowFloatMatid) {
            return MaterialId.ofInteger(NumericLiterals.toInteger(field));
        }
        OptionalLong integer = NumericLiterals.tryInteger(field);
        if (integer.isPresent()) {
            return MaterialId.ofInteger(integer.getAsLong());
        }
        double value = NumericLiterals.tryFloat(field)
                .orElseThrow(() -> new NumericLiteralException(field, NumericType.FLOAT, false));
        return MaterialId.ofFloat(value);
    }
}
