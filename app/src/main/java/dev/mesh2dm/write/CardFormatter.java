package dev.mesh2dm.write;

import dev.mesh2dm.parse.Card;
import dev.mesh2dm.parse.ElementRecord;
import dev.mesh2dm.parse.LineTokenizer;
import dev.mesh2dm.parse.MaterialId;
import dev.mesh2dm.parse.NodeRecord;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Renders parsed records back into 2DM card syntax.
 * <p>
 * Chunks are returned as lists so callers can align them in columns; {@link #line(List)} joins them with single
 * spaces. Non-negative floats in scientific notation carry a leading space so that signed and unsigned values line
 * up.
 */
public class CardFormatter {

    private final WriterOptions options;

    public CardFormatter() {
        this(WriterOptions.defaults());
    }

    public CardFormatter(WriterOptions options) {
        this.options = Objects.requireNonNull(options, "options");
    }

    public List<String> nodeChunks(NodeRecord node) {
        Objects.requireNonNull(node, "node");
        return List.of(Card.ND.keyword(), Long.toString(node.id()),
                formatFloat(node.x()), formatFloat(node.y()), formatFloat(node.z()));
    }

    public List<String> elementChunks(ElementRecord element) {
        Objects.requireNonNull(element, "element");
        List<String> chunks = new ArrayList<>(2 + element.nodeIds().size() + element.materialCount());
        chunks.add(element.card().keyword());
        chunks.add(Long.toString(element.id()));
        for (Long nodeId : element.nodeIds()) {
            chunks.add(Long.toString(nodeId));
        }
        for (MaterialId material : element.materialIds()) {
            if (material.isFloat()) {
                if (options.allowFloatMatid()) {
                    chunks.add(formatFloat(material.doubleValue()));
                }
            } else {
                chunks.add(Long.toString(material.longValue()));
            }
        }
        return chunks;
    }

    /**
     * Splits a node string over as many {@code NS} lines as {@link WriterOptions#nodesPerLine()} requires. The last
     * node ID is negated to terminate the string and the label, when present, follows it.
     *
     * @throws IllegalArgumentException if the last node is 0 or the label would not read back as one field
     */
    public List<List<String>> nodeStringChunks(List<Long> nodes, String label) {
        if (nodes == null || nodes.isEmpty()) {
            throw new IllegalArgumentException("Node strings require at least one node");
        }
        if (nodes.get(nodes.size() - 1) == 0) {
            throw new IllegalArgumentException("Node strings cannot end on node 0, its terminator -0 reads as 0");
        }
        if (label != null && !isSingleField(label)) {
            throw new IllegalArgumentException("Node string name must be a single field without whitespace or '#': "
                    + label);
        }
        List<List<String>> lines = new ArrayList<>();
        int perLine = options.nodesPerLine();
        for (int start = 0; start < nodes.size(); start += perLine) {
            int end = Math.min(start + perLine, nodes.size());
            List<String> chunks = new ArrayList<>(end - start + 2);
            chunks.add(Card.NS.keyword());
            for (int index = start; index < end; index++) {
                long nodeId = nodes.get(index);
                chunks.add(index == nodes.size() - 1 ? "-" + nodeId : Long.toString(nodeId));
            }
            lines.add(chunks);
        }
        if (label != null && !label.isEmpty()) {
            lines.get(lines.size() - 1).add(label);
        }
        return lines;
    }

    public String formatFloat(double value) {
        if (Double.isNaN(value)) {
            return "nan";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "inf" : "-inf";
        }
        if (options.compact()) {
            return Double.toString(value);
        }
        String formatted = String.format(Locale.ROOT, "%." + options.decimals() + "e", value);
        return formatted.startsWith("-") ? formatted : " " + formatted;
    }

    private static boolean isSingleField(String label) {
        return label.isEmpty() || LineTokenizer.chunks(label).equals(List.of(label));
    }

    public String line(List<String> chunks) {
        return String.join(" ", chunks);
    }
}
