package dev.mesh2dm.mesh;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

import dev.mesh2dm.parse.Card;
import dev.mesh2dm.parse.CardException;
import dev.mesh2dm.parse.InvalidIdentifierException;
import dev.mesh2dm.parse.MaterialId;
import dev.mesh2dm.parse.NodeRecord;
import dev.mesh2dm.parse.NumericLiteralException;
import dev.mesh2dm.parse.ParseOptions;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MeshReaderTest {

    @TempDir
    Path tempDir;

    private final MeshReader reader = new MeshReader();

    @Test
    void readsCompleteMesh() throws URISyntaxException {
        Mesh mesh = reader.read(fixture("basic.2dm"));

        assertThat(mesh.name()).isEqualTo("Basic mesh");
        assertThat(mesh.materialsPerElement()).isEqualTo(1);
        assertThat(mesh.nodes()).hasSize(5);
        assertThat(mesh.node(5)).isEqualTo(new NodeRecord(5, 5.0, -5.0, 0.0));
        assertThat(mesh.elements()).hasSize(4);
        assertThat(mesh.element(3).card()).isEqualTo(Card.E3T);
        assertThat(mesh.element(3).nodeIds()).containsExactly(3L, 4L, 5L);
        assertThat(mesh.element(3).materialIds()).containsExactly(MaterialId.ofInteger(2));
        assertThat(mesh.nodeStrings()).containsExactly(
                new NodeString(List.of(1L, 2L, 3L, 4L, 5L), Optional.of("north_bank")),
                NodeString.unnamed(List.of(2L, 1L)));
        assertThat(mesh.skippedCards()).isEqualTo(Map.of("BEDISP", 1));
        assertThat(mesh.extent()).isEqualTo(new Extent(-5.0, 5.0, -5.0, 5.0));
    }

    @Test
    void readsZeroIndexedMeshWhenEnabled() throws URISyntaxException {
        Mesh mesh = new MeshReader(ParseOptions.defaults().withZeroIndex(true)).read(fixture("zero-indexed.2dm"));

        assertThat(mesh.name()).isEqualTo(Mesh.DEFAULT_NAME);
        assertThat(mesh.node(0).id()).isZero();
        assertThat(mesh.element(0).materialIds()).containsExactly(MaterialId.ofFloat(1.5));
    }

    @Test
    void zeroIdsFailWithoutZeroIndexMode() throws URISyntaxException {
        MeshReadException ex = catchThrowableOfType(() -> reader.read(fixture("zero-indexed.2dm")),
                MeshReadException.class);

        assertThat(ex.lineNumber()).isEqualTo(2);
        assertThat(ex.getCause()).isInstanceOf(InvalidIdentifierException.class);
        assertThat(ex).hasMessageContaining("Invalid node ID: 0").hasMessageContaining("zero-indexed.2dm:2");
    }

    @Test
    void requiresMesh2dTagFirst() {
        MeshReadException ex = catchThrowableOfType(() -> read("ND 1 0 0 0\nMESH2D\n"), MeshReadException.class);

        assertThat(ex.lineNumber()).isEqualTo(1);
        assertThat(ex).hasMessageStartingWith("File is not a 2DM mesh file");
    }

    @Test
    void reportsMissingMesh2dTag() {
        MeshReadException ex = catchThrowableOfType(() -> read("# empty\n\n"), MeshReadException.class);

        assertThat(ex.lineNumber()).isZero();
        assertThat(ex).hasMessage("MESH2D tag not found (test.2dm)");
    }

    @Test
    void acceptsEmptyMesh() {
        Mesh mesh = read("MESH2D\n");

        assertThat(mesh.nodes()).isEmpty();
        assertThat(mesh.extent().isEmpty()).isTrue();
    }

    @Test
    void rejectsHolesInNodeIds() {
        MeshReadException ex = catchThrowableOfType(
                () -> read("MESH2D\nND 1 0 0 0\nND 3 1 0 0\n"), MeshReadException.class);

        assertThat(ex.lineNumber()).isEqualTo(3);
        assertThat(ex).hasMessageStartingWith("Node IDs have holes");
    }

    @Test
    void rejectsElementIdsNotStartingAtOne() {
        MeshReadException ex = catchThrowableOfType(
                () -> read("MESH2D\nE2L 2 1 2\n"), MeshReadException.class);

        assertThat(ex).hasMessageStartingWith("Element IDs must start at 1, got 2");
    }

    @Test
    void doesNotCheckElementNodeReferences() {
        Mesh mesh = read("MESH2D\nND 1 0 0 0\nE2L 1 1 99\n");

        assertThat(mesh.element(1).nodeIds()).containsExactly(1L, 99L);
    }

    @Test
    void wrapsCardErrorsWithLineNumber() {
        MeshReadException ex = catchThrowableOfType(
                () -> read("MESH2D\n\nE4Q 1 1 2 3\n"), MeshReadException.class);

        assertThat(ex.lineNumber()).isEqualTo(3);
        assertThat(ex.getCause()).isInstanceOf(CardException.class);
    }

    @Test
    void floatMaterialsCanBeRejected() {
        MeshReader strict = new MeshReader(ParseOptions.defaults().withFloatMatid(false));

        MeshReadException ex = catchThrowableOfType(
                () -> strict.read("test.2dm", new StringReader("MESH2D\nND 1 0 0 0\nE2L 1 1 1 0.5\n")),
                MeshReadException.class);

        assertThat(ex.getCause()).isInstanceOf(NumericLiteralException.class);
    }

    @Test
    void rejectsUnterminatedNodeString() {
        MeshReadException atEnd = catchThrowableOfType(() -> read("MESH2D\nNS 1 2 3\n"), MeshReadException.class);
        MeshReadException interrupted = catchThrowableOfType(
                () -> read("MESH2D\nNS 1 2\nND 1 0 0 0\n"), MeshReadException.class);

        assertThat(atEnd).hasMessageStartingWith("Node string not terminated at end of file");
        assertThat(interrupted.lineNumber()).isEqualTo(3);
    }

    @Test
    void readsUnquotedMeshName() {
        assertThat(read("MESH2D\nGM channel # name card\n").name()).isEqualTo("channel");
    }

    @Test
    void stripsQuotesFromNodeStringLabels() {
        Mesh mesh = read("MESH2D\nNS 1 -2 \"weir\"\n");

        assertThat(mesh.nodeString("weir")).contains(NodeString.named("weir", List.of(1L, 2L)));
    }

    @Test
    void rejectsMalformedMaterialCount() {
        MeshReadException ex = catchThrowableOfType(
                () -> read("MESH2D\nNUM_MATERIALS_PER_ELEM many\n"), MeshReadException.class);

        assertThat(ex.getCause()).isInstanceOf(NumericLiteralException.class);
    }

    @Test
    void missingFileSurfacesAsUncheckedIoException() {
        assertThat(catchThrowableOfType(() -> reader.read(tempDir.resolve("missing.2dm")), UncheckedIOException.class))
                .hasMessageContaining("missing.2dm");
    }

    private Mesh read(String content) {
        return reader.read("test.2dm", new StringReader(content));
    }

    private static Path fixture(String name) throws URISyntaxException {
        return Path.of(MeshReaderTest.class.getResource("/meshes/" + name).toURI());
    }
}
