package io.mvfm.core.engine;

import static io.mvfm.core.plugins.NumPlugin.add;
import static io.mvfm.core.plugins.NumPlugin.mul;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.mvfm.core.error.TypeMismatchException;
import io.mvfm.core.error.UnknownKindException;
import io.mvfm.core.error.UnliftableValueException;
import io.mvfm.core.error.UnmappedTraitException;
import io.mvfm.core.model.ExpressionValue;
import io.mvfm.core.model.NodeEntry;
import io.mvfm.core.model.NormalizedGraph;
import io.mvfm.core.model.Payload;
import io.mvfm.core.model.TypeTag;
import io.mvfm.core.plugins.CorePlugin;
import io.mvfm.core.plugins.NumPlugin;
import io.mvfm.core.plugins.Prelude;
import io.mvfm.core.plugins.StrPlugin;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("Elaborator")
class ElaboratorTest {

    private final Elaborator elaborator = new Elaborator(PluginRegistry.compose(Prelude.PLUGINS));

    @Nested
    @DisplayName("Identifiers and layout")
    class Layout {

        @Test
        @DisplayName("mul(add(3, 4), 5) yields five entries in post-order")
        void postOrderIdentifiers() {
            NormalizedGraph graph = elaborator.elaborate(mul(add(3, 4), 5));

            assertThat(graph.adjacency()).containsExactly(
                    Map.entry("a", NodeEntry.literal("num/literal", 3)),
                    Map.entry("b", NodeEntry.literal("num/literal", 4)),
                    Map.entry("c", NodeEntry.of("num/add", "a", "b")),
                    Map.entry("d", NodeEntry.literal("num/literal", 5)),
                    Map.entry("e", NodeEntry.of("num/mul", "c", "d")));
            assertThat(graph.rootId()).isEqualTo("e");
            assertThat(graph.nextId()).isEqualTo("f");
            assertThat(graph.outputType()).isEqualTo(TypeTag.NUMBER);
        }

        @Test
        @DisplayName("elaborating twice gives identical graphs")
        void deterministic() {
            var expr = mul(add(3, 4), StrPlugin.len(StrPlugin.concat("ab", "c")));

            assertThat(elaborator.elaborate(expr)).isEqualTo(elaborator.elaborate(expr));
        }

        @Test
        @DisplayName("a bare scalar becomes a single literal")
        void bareScalar() {
            NormalizedGraph graph = elaborator.elaborate("hello");

            assertThat(graph.adjacency()).containsExactly(Map.entry("a", NodeEntry.literal("str/literal", "hello")));
            assertThat(graph.outputType()).isEqualTo(TypeTag.STRING);
            assertThat(graph.nextId()).isEqualTo("b");
        }

        @Test
        @DisplayName("plain lists and maps become tuple and record nodes")
        void plainComposites() {
            Map<String, Object> fields = new LinkedHashMap<>();
            fields.put("xs", List.of(1, 2));
            fields.put("name", "n");

            NormalizedGraph graph = elaborator.elaborate(fields);

            assertThat(graph.entry("c")).contains(NodeEntry.tuple(List.of("a", "b")));
            assertThat(graph.root().payload())
                    .isEqualTo(new Payload.RecordLayout(Map.of("xs", "c", "name", "d")));
            assertThat(graph.root().children()).containsExactly("c", "d");
            assertThat(graph.outputType()).isEqualTo(TypeTag.RECORD);
        }

        @Test
        @DisplayName("property access records its key")
        void accessNode() {
            NormalizedGraph graph = elaborator.elaborate(CorePlugin.tuple(1, 2).at(1));

            assertThat(graph.root()).isEqualTo(NodeEntry.access("c", 1));
            assertThat(graph.outputType()).isEqualTo(TypeTag.ANY);
        }

        @Test
        @DisplayName("core/tuple over a single list wraps that list")
        void tupleOfList() {
            NormalizedGraph graph = elaborator.elaborate(CorePlugin.tuple(List.of(1, 2)));

            assertThat(graph.root()).isEqualTo(NodeEntry.tuple(List.of("a", "b")));
        }

        @Test
        @DisplayName("a 10,000-deep expression elaborates without overflowing the stack")
        void deepNesting() {
            Object expr = 0;
            for (int i = 0; i < 10_000; i++) {
                expr = add(expr, 1);
            }

            NormalizedGraph graph = elaborator.elaborate(expr);

            assertThat(graph.size()).isEqualTo(20_001);
            assertThat(graph.root().kind()).isEqualTo("num/add");
        }
    }

    @Nested
    @DisplayName("Trait resolution")
    class Traits {

        @Test
        @DisplayName("eq on numbers resolves to num/eq")
        void numericEquality() {
            NormalizedGraph graph = elaborator.elaborate(Prelude.eq(1, 2));

            assertThat(graph.root()).isEqualTo(NodeEntry.of("num/eq", "a", "b"));
            assertThat(graph.outputType()).isEqualTo(TypeTag.BOOLEAN);
        }

        @Test
        @DisplayName("dispatch uses the type of the first operand after elaboration")
        void dispatchOnElaboratedOperand() {
            NormalizedGraph graph = elaborator.elaborate(Prelude.show(StrPlugin.upper("x")));

            assertThat(graph.root().kind()).isEqualTo("str/show");
        }

        @Test
        @DisplayName("later operands must match the first operand's type")
        void operandsMustAgree() {
            assertThatThrownBy(() -> elaborator.elaborate(Prelude.eq(1, "x")))
                    .isInstanceOf(TypeMismatchException.class)
                    .hasMessageContaining("expected number for arg 1, got string");
        }

        @Test
        @DisplayName("a type with no instance is an unmapped trait")
        void unmappedTrait() {
            assertThatThrownBy(() -> elaborator.elaborate(Prelude.eq(List.of(1), List.of(2))))
                    .isInstanceOf(UnmappedTraitException.class)
                    .hasMessage("No trait \"eq\" instance for type \"tuple\"");
        }

        @Test
        @DisplayName("a trait needs at least one operand")
        void traitWithoutOperands() {
            assertThatThrownBy(() -> elaborator.elaborate(ExpressionValue.of("eq")))
                    .isInstanceOf(TypeMismatchException.class)
                    .hasMessage("Trait \"eq\" requires at least one operand");
        }
    }

    @Nested
    @DisplayName("Structural errors")
    class Errors {

        @Test
        @DisplayName("unknown kinds are rejected")
        void unknownKind() {
            assertThatThrownBy(() -> elaborator.elaborate(ExpressionValue.of("num/pow", 2, 8)))
                    .isInstanceOf(UnknownKindException.class)
                    .hasMessage("Unknown kind \"num/pow\"")
                    .satisfies(e -> assertThat(((UnknownKindException) e).kind()).isEqualTo("num/pow"));
        }

        @Test
        @DisplayName("argument types are checked against the kind specification")
        void typeMismatch() {
            assertThatThrownBy(() -> elaborator.elaborate(add("x", 1)))
                    .isInstanceOf(TypeMismatchException.class)
                    .hasMessage("num/add: expected number for arg 0, got string (value: x)");
        }

        @Test
        @DisplayName("composite results are checked too")
        void nestedTypeMismatch() {
            assertThatThrownBy(() -> elaborator.elaborate(add(StrPlugin.upper("x"), 1)))
                    .isInstanceOf(TypeMismatchException.class)
                    .hasMessage("num/add: expected number for arg 0, got string");
        }

        @Test
        @DisplayName("scalars with no lift mapping are unliftable")
        void unliftableScalar() {
            var numbersOnly = new Elaborator(PluginRegistry.compose(CorePlugin.INSTANCE, NumPlugin.INSTANCE));

            assertThatThrownBy(() -> numbersOnly.elaborate(CorePlugin.cond(true, 1, 2)))
                    .isInstanceOf(UnliftableValueException.class)
                    .hasMessage("Cannot lift value of type \"boolean\"");
        }

        @Test
        @DisplayName("values with no type tag are unliftable")
        void untaggedValue() {
            assertThatThrownBy(() -> elaborator.elaborate(add(new Object(), 1)))
                    .isInstanceOf(UnliftableValueException.class)
                    .hasMessage("Cannot lift value of type \"Object\"");
        }

        @Test
        @DisplayName("core/record takes exactly one map")
        void recordNeedsMap() {
            assertThatThrownBy(() -> elaborator.elaborate(ExpressionValue.of("core/record", 1)))
                    .isInstanceOf(TypeMismatchException.class)
                    .hasMessage("core/record: expected a single map argument");
        }
    }
}
