package dev.mesh2dm.mesh;

import dev.mesh2dm.parse.Card;
import dev.mesh2dm.parse.CardException;
import dev.mesh2dm.parse.CardParser;
import dev.mesh2dm.parse.ElementRecord;
import dev.mesh2dm.parse.LineTokenizer;
import dev.mesh2dm.parse.MeshFormatException;
import dev.mesh2dm.parse.NodeParser;
import dev.mesh2dm.parse.NodeRecord;
import dev.mesh2dm.parse.NodeStringResult;
import dev.mesh2dm.parse.NumericLiterals;
import dev.mesh2dm.parse.ParseOptions;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Reads a complete 2DM file into a {@link Mesh}.
 * <p>
 * Every line is handed to {@link CardParser}; the reader adds the file-level rules on top: the {@code MESH2D} tag
 * must come first, node and element IDs must be consecutive and node strings must be terminated. Element node
 * references are not checked against the nodes of the file.
 */
public class MeshReader {

    static final String MDC_SOURCE = "mesh.source";

    private static final Logger LOGGER = LoggerFactory.getLogger(MeshReader.class);

    private static final String MESH2D = "MESH2D";
    private static final String MESHNAME = "MESHNAME";
    private static final String GM = "GM";
    private static final String NUM_MATERIALS_PER_ELEM = "NUM_MATERIALS_PER_ELEM";

    private final CardParser cardParser;

    public MeshReader() {
        this(ParseOptions.defaults());
    }

    public MeshReader(ParseOptions options) {
        this.cardParser = new CardParser(options);
    }

    public Mesh read(Path path) {
        Objects.requireNonNull(path, "path");
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(path.toString(), reader);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read mesh: " + path, ex);
        }
    }

    public Mesh read(String source, Reader input) {
        Objects.requireNonNull(input, "input");
        BufferedReader reader = input instanceof BufferedReader buffered ? buffered : new BufferedReader(input);
        MDC.put(MDC_SOURCE, source);
        try {
            State state = new State(source);
            String line;
            while ((line = reader.readLine()) != null) {
                state.lineNumber++;
                state.accept(line);
            }
            return state.finish();
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read mesh: " + source, ex);
        } finally {
            MDC.remove(MDC_SOURCE);
        }
    }

    private final class State {

        private final String source;
        private final boolean zeroIndex = cardParser.options().allowZeroIndex();
        private final List<NodeRecord> nodes = new ArrayList<>();
        private final List<ElementRecord> elements = new ArrayList<>();
        private final List<NodeString> nodeStrings = new ArrayList<>();
        private final Map<String, Integer> skippedCards = new LinkedHashMap<>();
        private int lineNumber;
        private boolean headerFound;
        private String name;
        private int materialsPerElement;
        private List<Long> pendingNodeString;

        private State(String source) {
            this.source = source;
        }

        void accept(String line) {
            List<String> chunks = LineTokenizer.chunks(line);
            if (chunks.isEmpty()) {
                return;
            }
            String keyword = chunks.get(0);
            if (!headerFound) {
                if (!MESH2D.equals(keyword)) {
                    throw new MeshReadException(source, lineNumber, "File is not a 2DM mesh file");
                }
                headerFound = true;
                return;
            }
            if (pendingNodeString != null && !Card.NS.keyword().equals(keyword)) {
                throw new MeshReadException(source, lineNumber,
                        "Node string not terminated before " + keyword + " card");
            }
            try {
                dispatch(keyword, chunks, line);
            } catch (MeshFormatException ex) {
                throw new MeshReadException(source, lineNumber, ex.getMessage(), ex);
            }
        }

        private void dispatch(String keyword, List<String> chunks, String line) {
            switch (keyword) {
                case MESH2D -> LOGGER.debug("Ignoring repeated {} tag at line {}", MESH2D, lineNumber);
                case MESHNAME, GM -> name = parseName(keyword, chunks, line);
                case NUM_MATERIALS_PER_ELEM -> materialsPerElement = parseMaterialCount(keyword, chunks);
                case "ND" -> addNode(line);
                case "NS" -> addNodeStringLine(line);
                default -> {
                    if (Card.element(keyword).isPresent()) {
                        addElement(line);
                    } else {
                        skippedCards.merge(keyword, 1, Integer::sum);
                        LOGGER.debug("Skipping unsupported card {} at line {}", keyword, lineNumber);
                    }
                }
            }
        }

        private void addNode(String line) {
            NodeRecord node = cardParser.parseNode(line);
            int unused = NodeParser.unusedFieldCount(line);
            if (unused > 0) {
                LOGGER.debug("Ignoring {} unused field(s) on node {} at line {}", unused, node.id(), lineNumber);
            }
            checkSequence("Node", node.id(), nodes.isEmpty() ? null : nodes.get(nodes.size() - 1).id());
            nodes.add(node);
        }

        private void addElement(String line) {
            ElementRecord element = cardParser.parseElement(line);
            checkSequence("Element", element.id(),
                    elements.isEmpty() ? null : elements.get(elements.size() - 1).id());
            elements.add(element);
        }

        private void addNodeStringLine(String line) {
            NodeStringResult result = cardParser.parseNodeString(line, pendingNodeString);
            if (!result.closed()) {
                pendingNodeString = result.nodes();
                return;
            }
            nodeStrings.add(NodeString.named(stripQuotes(result.label()), result.nodes()));
            pendingNodeString = null;
        }

        private void checkSequence(String entity, long id, Long previous) {
            if (previous == null) {
                long first = zeroIndex ? 0 : 1;
                if (id != first) {
                    throw new MeshFormatException(entity + " IDs must start at " + first + ", got " + id);
                }
            } else if (previous + 1 != id) {
                throw new MeshFormatException(entity + " IDs have holes");
            }
        }

        private String parseName(String keyword, List<String> chunks, String line) {
            String content = line.substring(0, line.indexOf('#') < 0 ? line.length() : line.indexOf('#'));
            int open = content.indexOf('"');
            if (open >= 0) {
                int close = content.indexOf('"', open + 1);
                return close < 0 ? content.substring(open + 1) : content.substring(open + 1, close);
            }
            if (chunks.size() < 2) {
                throw new CardException(keyword, keyword + " requires a mesh name, got 0 fields", 1, 0);
            }
            return chunks.get(1);
        }

        private int parseMaterialCount(String keyword, List<String> chunks) {
            if (chunks.size() < 2) {
                throw new CardException(keyword, keyword + " requires a material count, got 0 fields", 1, 0);
            }
            long count = NumericLiterals.toInteger(chunks.get(1));
            if (count < 0 || count > Integer.MAX_VALUE) {
                throw new MeshFormatException("Invalid material count: " + count);
            }
            return (int) count;
        }

        Mesh finish() {
            if (!headerFound) {
                throw new MeshReadException(source, 0, "MESH2D tag not found");
            }
            if (pendingNodeString != null) {
                throw new MeshReadException(source, lineNumber, "Node string not terminated at end of file");
            }
            LOGGER.debug("Read {} nodes, {} elements and {} node strings",
                    nodes.size(), elements.size(), nodeStrings.size());
            return new Mesh(name, materialsPerElement, zeroIndex, nodes, elements, nodeStrings, skippedCards);
        }

        private String stripQuotes(String label) {
            String stripped = label;
            while (stripped.startsWith("\"")) {
                stripped = stripped.substring(1);
            }
            while (stripped.endsWith("\"")) {
                stripped = stripped.substring(0, stripped.length() - 1);
            }
            return stripped;
        }
    }
}
