package io.mvfm.core.document;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.mvfm.core.engine.ProgramEngine;
import io.mvfm.core.error.GraphDocumentException;
import io.mvfm.core.model.NodeEntry;
import io.mvfm.core.model.NormalizedGraph;
import io.mvfm.core.model.Payload;
import io.mvfm.core.model.TypeTag;
import io.mvfm.core.plugins.NumPlugin;
import io.mvfm.core.plugins.Prelude;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("GraphDocumentCodec")
class GraphDocumentCodecTest {

    private final ProgramEngine engine = ProgramEngine.create(Prelude.PLUGINS, Map.of());

    /** Exercises every payload variant: literal, record, access by name and index, tuple, alias. */
    private static NormalizedGraph sampleGraph() {
        Map<String, NodeEntry> adjacency = new LinkedHashMap<>();
        adjacency.put("a", NodeEntry.literal("num/literal", 3.0));
        adjacency.put("b", NodeEntry.literal("str/literal", "x"));
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("n", "a");
        fields.put("s", "b");
        adjacency.put("c", NodeEntry.record(fields));
        adjacency.put("d", NodeEntry.access("c", "n"));
        adjacency.put("e", NodeEntry.tuple(List.of("d", "a")));
        adjacency.put("f", NodeEntry.access("e", 0));
        adjacency.put("@main", NodeEntry.alias("f"));
        return new NormalizedGraph("f", adjacency, "g", TypeTag.NUMBER);
    }

    @Nested
    @DisplayName("Round trip")
    class RoundTrip {

        @Test
        @DisplayName("JSON preserves every entry and node order")
        void json() {
            NormalizedGraph graph = sampleGraph();

            NormalizedGraph decoded = GraphDocumentCodec.decodeJson(GraphDocumentCodec.encodeJson(graph));

            assertThat(decoded).isEqualTo(graph);
            assertThat(decoded.adjacency().keySet()).containsExactly("a", "b", "c", "d", "e", "f", "@main");
            assertThat(decoded.aliases()).containsEntry("main", "f");
            assertThat(decoded.resolveAlias("main")).contains("f");
        }

        @Test
        @DisplayName("YAML preserves every entry")
        void yaml() {
            NormalizedGraph graph = sampleGraph();

            String yaml = GraphDocumentCodec.encodeYaml(graph);

            assertThat(yaml).contains("nodes:").contains("@main");
            assertThat(GraphDocumentCodec.decodeYaml(yaml)).isEqualTo(graph);
        }

        @Test
        @DisplayName("pretty JSON decodes to the same graph")
        void prettyJson() {
            NormalizedGraph graph = sampleGraph();

            String json = GraphDocumentCodec.encodePrettyJson(graph);

            assertThat(json).contains("\n");
            assertThat(GraphDocumentCodec.decodeJson(json)).isEqualTo(graph);
        }

        @Test
        @DisplayName("a decoded program evaluates like the original")
        void decodedProgramEvaluates() {
            NormalizedGraph compiled = engine.compile(NumPlugin.mul(NumPlugin.add(3, 4), 5));

            NormalizedGraph decoded = GraphDocumentCodec.decodeJson(GraphDocumentCodec.encodeJson(compiled));

            assertThat(decoded.rootId()).isEqualTo("e");
            assertThat(decoded.nextId()).isEqualTo("f");
            assertThat(decoded.outputType()).isEqualTo(TypeTag.NUMBER);
            assertThat(engine.evaluate(decoded)).isEqualTo(35.0);
            assertThat(engine.evaluate(sampleGraph())).isEqualTo(3.0);
        }

        @Test
        @DisplayName("integer literals read back as doubles, nested data included")
        void numbersReadBackAsDoubles() {
            String json = "{\"root\":\"a\",\"nextId\":\"b\",\"nodes\":{"
                    + "\"a\":{\"kind\":\"core/input\",\"children\":[],\"value\":[1,{\"k\":2,\"t\":true}]}}}";

            NormalizedGraph graph = GraphDocumentCodec.decodeJson(json);

            Payload payload = graph.root().payload();
            assertThat(payload).isInstanceOf(Payload.Literal.class);
            assertThat(((Payload.Literal) payload).value()).isEqualTo(List.of(1.0, Map.of("k", 2.0, "t", true)));
        }
    }

    @Nested
    @DisplayName("Decoding")
    class Decoding {

        @Test
        @DisplayName("outputType defaults to any")
        void outputTypeDefaults() {
            String json = "{\"root\":\"a\",\"nextId\":\"b\",\"nodes\":{\"a\":{\"kind\":\"num/literal\",\"value\":1}}}";

            NormalizedGraph graph = GraphDocumentCodec.decodeJson(json);

            assertThat(graph.outputType()).isEqualTo(TypeTag.ANY);
            assertThat(graph.root().children()).isEmpty();
        }

        @Test
        @DisplayName("unknown outputType is rejected")
        void unknownOutputType() {
            String json = "{\"root\":\"a\",\"nextId\":\"b\",\"outputType\":\"matrix\","
                    + "\"nodes\":{\"a\":{\"kind\":\"num/literal\",\"value\":1}}}";

            assertThatThrownBy(() -> GraphDocumentCodec.decodeJson(json))
                    .isInstanceOf(GraphDocumentException.class)
                    .hasMessage("Unknown type tag: 'matrix'");
        }

        @Test
        @DisplayName("missing root or nodes")
        void missingRequiredFields() {
            assertThatThrownBy(() -> GraphDocumentCodec.decodeJson("{\"nextId\":\"b\",\"nodes\":{}}"))
                    .isInstanceOf(GraphDocumentException.class)
                    .hasMessage("Missing or invalid required field: 'root'");
            assertThatThrownBy(() -> GraphDocumentCodec.decodeJson("{\"root\":\"a\",\"nextId\":\"b\"}"))
                    .isInstanceOf(GraphDocumentException.class)
                    .hasMessage("Missing or invalid required field: 'nodes'");
        }

        @Test
        @DisplayName("node without a kind")
        void nodeWithoutKind() {
            String json = "{\"root\":\"a\",\"nextId\":\"b\",\"nodes\":{\"a\":{\"children\":[]}}}";

            assertThatThrownBy(() -> GraphDocumentCodec.decodeJson(json))
                    .isInstanceOf(GraphDocumentException.class)
                    .hasMessage("Missing or invalid required field: 'kind' in node 'a'");
        }

        @Test
        @DisplayName("non-array children")
        void childrenNotArray() {
            String json = "{\"root\":\"a\",\"nextId\":\"b\",\"nodes\":{\"a\":{\"kind\":\"k\",\"children\":\"b\"}}}";

            assertThatThrownBy(() -> GraphDocumentCodec.decodeJson(json))
                    .isInstanceOf(GraphDocumentException.class)
                    .hasMessage("Node 'a': 'children' must be an array");
        }

        @Test
        @DisplayName("dangling child references fail the integrity check")
        void danglingChild() {
            String json = "{\"root\":\"c\",\"nextId\":\"d\","
                    + "\"nodes\":{\"c\":{\"kind\":\"num/neg\",\"children\":[\"b\"]}}}";

            assertThatThrownBy(() -> GraphDocumentCodec.decodeJson(json))
                    .isInstanceOf(GraphDocumentException.class)
                    .hasMessage("decode: node \"c\" references missing child \"b\"")
                    .satisfies(e -> assertThat(((GraphDocumentException) e).nodeId()).isEqualTo("c"));
        }

        @Test
        @DisplayName("root must be present in the node table")
        void rootNotInNodes() {
            String json = "{\"root\":\"q\",\"nextId\":\"b\",\"nodes\":{\"a\":{\"kind\":\"num/literal\",\"value\":1}}}";

            assertThatThrownBy(() -> GraphDocumentCodec.decodeJson(json))
                    .isInstanceOf(GraphDocumentException.class)
                    .hasMessage("decode: root \"q\" not in adjacency");
        }

        @Test
        @DisplayName("nextId must come after every node id")
        void staleCursor() {
            String json = "{\"root\":\"c\",\"nextId\":\"a\",\"nodes\":{"
                    + "\"a\":{\"kind\":\"num/literal\",\"value\":3},"
                    + "\"b\":{\"kind\":\"num/literal\",\"value\":4},"
                    + "\"c\":{\"kind\":\"num/add\",\"children\":[\"a\",\"b\"]}}}";

            assertThatThrownBy(() -> GraphDocumentCodec.decodeJson(json))
                    .isInstanceOf(GraphDocumentException.class)
                    .hasMessage("nextId 'a' is not past existing node 'a'");
        }

        @Test
        @DisplayName("alias entries need exactly one child under an @ key")
        void malformedAlias() {
            String childless = "{\"root\":\"a\",\"nextId\":\"b\",\"nodes\":{"
                    + "\"a\":{\"kind\":\"num/literal\",\"value\":1},"
                    + "\"@x\":{\"kind\":\"@alias\",\"children\":[]}}}";
            String misplaced = "{\"root\":\"a\",\"nextId\":\"b\",\"nodes\":{"
                    + "\"a\":{\"kind\":\"num/literal\",\"value\":1},"
                    + "\"@x\":{\"kind\":\"num/literal\",\"value\":2}}}";

            assertThatThrownBy(() -> GraphDocumentCodec.decodeJson(childless))
                    .isInstanceOf(GraphDocumentException.class)
                    .hasMessage("decode: alias \"@x\" must have exactly one child, has 0");
            assertThatThrownBy(() -> GraphDocumentCodec.decodeJson(misplaced))
                    .isInstanceOf(GraphDocumentException.class)
                    .hasMessage("decode: key \"@x\" must hold an @alias entry");
        }

        @Test
        @DisplayName("malformed text")
        void malformed() {
            assertThatThrownBy(() -> GraphDocumentCodec.decodeJson("{not json"))
                    .isInstanceOf(GraphDocumentException.class)
                    .hasMessageStartingWith("Failed to parse JSON graph document");
            assertThatThrownBy(() -> GraphDocumentCodec.decodeJson("[]"))
                    .isInstanceOf(GraphDocumentException.class)
                    .hasMessage("Graph document must be an object");
        }

        @Test
        @DisplayName("access keys must be strings or integers")
        void badAccessKey() {
            String json = "{\"root\":\"b\",\"nextId\":\"c\",\"nodes\":{"
                    + "\"a\":{\"kind\":\"num/literal\",\"value\":1},"
                    + "\"b\":{\"kind\":\"core/access\",\"children\":[\"a\"],\"key\":true}}}";

            assertThatThrownBy(() -> GraphDocumentCodec.decodeJson(json))
                    .isInstanceOf(GraphDocumentException.class)
                    .hasMessage("Node 'b': access key must be a string or integer");
        }
    }
}
