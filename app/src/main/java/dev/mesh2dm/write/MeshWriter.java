package dev.mesh2dm.write;

import dev.mesh2dm.mesh.Mesh;
import dev.mesh2dm.mesh.NodeString;
import dev.mesh2dm.parse.ElementRecord;
import dev.mesh2dm.parse.NodeRecord;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes a {@link Mesh} as a 2DM file: header cards first, then nodes, elements and node strings.
 */
public class MeshWriter {

    private static final Logger LOGGER = LoggerFactory.getLogger(MeshWriter.class);

    private final WriterOptions options;
    private final CardFormatter formatter;

    public MeshWriter() {
        this(WriterOptions.defaults());
    }

    public MeshWriter(WriterOptions options) {
        this.options = Objects.requireNonNull(options, "options");
        this.formatter = new CardFormatter(options);
    }

    public void write(Path target, Mesh mesh) {
        write(target, mesh, "");
    }

    public void write(Path target, Mesh mesh, String signature) {
        if (target == null || mesh == null) {
            throw new IllegalArgumentException("target and mesh must be provided");
        }
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (BufferedWriter writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING)) {
                write(writer, mesh, signature);
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write mesh: " + target, ex);
        }
    }

    /**
     * Writes the mesh to {@code writer} without closing it.
     *
     * @param signature optional text written as comment lines after the {@code MESH2D} tag; may span lines
     */
    public void write(Writer writer, Mesh mesh, String signature) throws IOException {
        Objects.requireNonNull(writer, "writer");
        Objects.requireNonNull(mesh, "mesh");
        writeLine(writer, "MESH2D");
        if (signature != null && !signature.isBlank()) {
            for (String line : signature.split("\\R")) {
                writeLine(writer, "# " + line);
            }
        }
        if (!Mesh.DEFAULT_NAME.equals(mesh.name())) {
            writeLine(writer, "MESHNAME \"" + mesh.name() + "\"");
        }
        writeLine(writer, "NUM_MATERIALS_PER_ELEM " + materialsPerElement(mesh));
        for (NodeRecord node : mesh.nodes()) {
            writeLine(writer, formatter.line(formatter.nodeChunks(node)));
        }
        for (ElementRecord element : mesh.elements()) {
            writeLine(writer, formatter.line(formatter.elementChunks(element)));
        }
        for (NodeString nodeString : mesh.nodeStrings()) {
            for (List<String> chunks : formatter.nodeStringChunks(nodeString.nodes(), nodeString.name().orElse(""))) {
                writeLine(writer, formatter.line(chunks));
            }
        }
        writer.flush();
        LOGGER.debug("Wrote {} nodes, {} elements and {} node strings for mesh '{}'",
                mesh.nodes().size(), mesh.elements().size(), mesh.nodeStrings().size(), mesh.name());
    }

    private int materialsPerElement(Mesh mesh) {
        if (mesh.materialsPerElement() > 0 || mesh.elements().isEmpty()) {
            return mesh.materialsPerElement();
        }
        ElementRecord first = mesh.elements().get(0);
        if (options.allowFloatMatid()) {
            return first.materialCount();
        }
        return (int) first.materialIds().stream().filter(material -> !material.isFloat()).count();
    }

    private static void writeLine(Writer writer, String line) throws IOException {
        writer.write(line);
        writer.write('\n');
    }
}
