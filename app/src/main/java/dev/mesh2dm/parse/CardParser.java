package dev.mesh2dm.parse;

import java.util.List;
import java.util.Objects;

/**
 * Entry point bundling the node, element and node string parsers behind a single set of {@link ParseOptions}.
 * Instances hold no mutable state and can be shared between threads.
 */
public final class CardParser {

    private final ParseOptions options;
    private final NodeParser nodeParser;
    private final ElementParser elementParser;
    private final NodeStringParser nodeStringParser;

    public CardParser() {
        this(ParseOptions.defaults());
    }

    public CardParser(ParseOptions options) {
        this.options = Objects.requireNonNull(options, "options");
        this.nodeParser = new NodeParser(options.allowZeroIndex());
        this.elementParser = new ElementParser(options.allowZeroIndex(), options.allowFloatMatid());
        this.nodeStringParser = new NodeStringParser(options.allowZeroIndex());
    }

    public ParseOptions options() {
        return options;
    }

    public NodeRecord parseNode(String line) {
        return nodeParser.parse(line);
    }

    public ElementRecord parseElement(String line) {
        return elementParser.parse(line);
    }

    public NodeStringResult parseNodeString(String line) {
        return nodeStringParser.parse(line);
    }

    public NodeStringResult parseNodeString(String line, List<Long> nodes) {
        return nodeStringParser.parse(line, nodes);
    }
}
