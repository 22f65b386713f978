package dev.mesh2dm.write;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.mesh2dm.parse.Card;
import dev.mesh2dm.parse.CardParser;
import dev.mesh2dm.parse.ElementRecord;
import dev.mesh2dm.parse.MaterialId;
import dev.mesh2dm.parse.NodeRecord;
import dev.mesh2dm.parse.NodeStringResult;
import java.util.List;
import org.junit.jupiter.api.Test;

class CardFormatterTest {

    private final CardFormatter formatter = new CardFormatter(new WriterOptions(8, false, true, 10));
    private final CardFormatter lossless = new CardFormatter();
    private final CardFormatter compact = new CardFormatter(new WriterOptions(8, true, true, 10));
    private final CardParser parser = new CardParser();

    @Test
    void formatsNodeCoordinatesInScientificNotation() {
        assertThat(formatter.nodeChunks(new NodeRecord(1, 12.0, 34.0, 56.0)))
                .containsExactly("ND", "1", " 1.20000000e+01", " 3.40000000e+01", " 5.60000000e+01");
    }

    @Test
    void honoursDecimalsAndCompactMode() {
        CardFormatter twoDecimals = new CardFormatter(new WriterOptions(2, false, true, 10));

        assertThat(twoDecimals.nodeChunks(new NodeRecord(10, -12, 20.0, 2.5)))
                .containsExactly("ND", "10", "-1.20e+01", " 2.00e+01", " 2.50e+00");
        assertThat(compact.nodeChunks(new NodeRecord(5, 1.23, 2.0, 4.5)))
                .containsExactly("ND", "5", "1.23", "2.0", "4.5");
    }

    @Test
    void writesNonFiniteValuesAsWords() {
        assertThat(formatter.formatFloat(Double.NaN)).isEqualTo("nan");
        assertThat(formatter.formatFloat(Double.POSITIVE_INFINITY)).isEqualTo("inf");
        assertThat(formatter.formatFloat(Double.NEGATIVE_INFINITY)).isEqualTo("-inf");
    }

    @Test
    void formatsElementMaterials() {
        ElementRecord element = new ElementRecord(Card.E2L, 1, List.of(233L, 3L),
                List.of(MaterialId.ofFloat(1.0), MaterialId.ofInteger(-2), MaterialId.ofInteger(5)));

        assertThat(formatter.elementChunks(element))
                .containsExactly("E2L", "1", "233", "3", " 1.00000000e+00", "-2", "5");
    }

    @Test
    void dropsFloatMaterialsWhenDisallowed() {
        CardFormatter integersOnly = new CardFormatter(new WriterOptions(8, false, false, 10));
        ElementRecord element = new ElementRecord(Card.E2L, 1, List.of(2L, 3L),
                List.of(MaterialId.ofFloat(1.0), MaterialId.ofInteger(-2)));

        assertThat(integersOnly.elementChunks(element)).containsExactly("E2L", "1", "2", "3", "-2");
    }

    @Test
    void foldsLongNodeStringsAndNegatesLastNode() {
        CardFormatter threePerLine = new CardFormatter(new WriterOptions(8, false, true, 3));

        List<List<String>> lines = threePerLine.nodeStringChunks(List.of(1L, 2L, 3L, 4L, 5L), "outlet");

        assertThat(lines).containsExactly(
                List.of("NS", "1", "2", "3"),
                List.of("NS", "4", "-5", "outlet"));
    }

    @Test
    void rejectsEmptyNodeString() {
        assertThatThrownBy(() -> formatter.nodeStringChunks(List.of(), "")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void defaultsToSeventeenSignificantDigits() {
        assertThat(lossless.formatFloat(0.1)).isEqualTo(" 1.0000000000000000e-01");
        assertThat(lossless.formatFloat(-2650123.456)).isEqualTo("-2.6501234560000000e+06");
    }

    @Test
    void rejectsNodeStringEndingOnNodeZero() {
        assertThatThrownBy(() -> formatter.nodeStringChunks(List.of(1L, 0L), ""))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("node 0");
        assertThat(formatter.nodeStringChunks(List.of(0L, 1L), "")).containsExactly(List.of("NS", "0", "-1"));
    }

    @Test
    void rejectsNamesThatWouldNotReadBackAsOneField() {
        assertThatThrownBy(() -> formatter.nodeStringChunks(List.of(1L, 2L), "north bank"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("north bank");
        assertThatThrownBy(() -> formatter.nodeStringChunks(List.of(1L, 2L), "weir#2"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> formatter.nodeStringChunks(List.of(1L, 2L), "weir\t"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void defaultFormatterRoundTripsArbitraryCoordinates() {
        NodeRecord node = new NodeRecord(1, 0.1234567891, 2650123.456, -1.0 / 3.0);

        assertThat(parser.parseNode(lossless.line(lossless.nodeChunks(node)))).isEqualTo(node);
    }

    @Test
    void nodeRoundTripsThroughParser() {
        NodeRecord node = new NodeRecord(42, -0.1, 123456.789, 1.0e-7);

        assertThat(parser.parseNode(compact.line(compact.nodeChunks(node)))).isEqualTo(node);
        NodeRecord exact = new NodeRecord(7, 0.5, -2.25, 1024.0);
        assertThat(parser.parseNode(formatter.line(formatter.nodeChunks(exact)))).isEqualTo(exact);
    }

    @Test
    void elementRoundTripsThroughParser() {
        ElementRecord element = new ElementRecord(Card.E6T, 3, List.of(1L, 2L, 3L, 4L, 5L, 6L),
                List.of(MaterialId.ofInteger(2), MaterialId.ofFloat(101.25), MaterialId.ofFloat(412.0001)));

        assertThat(parser.parseElement(compact.line(compact.elementChunks(element)))).isEqualTo(element);
        assertThat(parser.parseElement(lossless.line(lossless.elementChunks(element)))).isEqualTo(element);
    }

    @Test
    void nodeStringRoundTripsThroughParser() {
        List<Long> nodes = List.of(3L, 1L, 4L, 1L, 5L, 9L, 2L, 6L, 5L, 3L, 5L, 8L);
        NodeStringResult result = null;
        List<Long> accumulator = null;
        for (List<String> chunks : formatter.nodeStringChunks(nodes, "weir")) {
            result = parser.parseNodeString(formatter.line(chunks), accumulator);
            accumulator = result.nodes();
        }

        assertThat(result).isNotNull();
        assertThat(result.closed()).isTrue();
        assertThat(result.nodes()).isEqualTo(nodes);
        assertThat(result.label()).isEqualTo("weir");
    }
}
