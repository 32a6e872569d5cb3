package io.mvfm.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("NodeEntry and Payload")
class NodeEntryTest {

    @Nested
    @DisplayName("Factories")
    class Factories {

        @Test
        @DisplayName("literal carries its value and has no children")
        void literalEntry() {
            var entry = NodeEntry.literal("num/literal", 3);
            assertThat(entry.isLeaf()).isTrue();
            assertThat(entry.literalValue()).isEqualTo(3);
            assertThat(entry.payload()).isEqualTo(new Payload.Literal(3));
        }

        @Test
        @DisplayName("record children follow field order")
        void recordChildrenFollowFields() {
            Map<String, String> fields = new LinkedHashMap<>();
            fields.put("y", "b");
            fields.put("x", "a");
            var entry = NodeEntry.record(fields);
            assertThat(entry.kind()).isEqualTo(ExpressionValue.RECORD);
            assertThat(entry.children()).containsExactly("b", "a");
            assertThat(((Payload.RecordLayout) entry.payload()).fields()).containsExactly(
                    Map.entry("y", "b"), Map.entry("x", "a"));
        }

        @Test
        @DisplayName("alias points at its target")
        void aliasEntry() {
            var alias = NodeEntry.alias("c");
            assertThat(alias.isAlias()).isTrue();
            assertThat(alias.children()).containsExactly("c");
        }

        @Test
        @DisplayName("access keys must be strings or integers")
        void accessKeyType() {
            assertThat(NodeEntry.access("a", "name").payload()).isEqualTo(new Payload.AccessKey("name"));
            assertThatThrownBy(() -> NodeEntry.access("a", 1.5)).isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("children are copied defensively")
        void childrenAreCopied() {
            List<String> children = new ArrayList<>(List.of("a", "b"));
            var entry = NodeEntry.of("num/add", children);
            children.add("c");
            assertThat(entry.children()).containsExactly("a", "b");
        }
    }

    @Nested
    @DisplayName("rewire")
    class Rewire {

        @Test
        @DisplayName("replaces child references")
        void rewiresChildren() {
            var entry = NodeEntry.of("num/add", "a", "a");
            assertThat(entry.rewire("a", "x").children()).containsExactly("x", "x");
        }

        @Test
        @DisplayName("updates tuple and record layouts")
        void rewiresLayouts() {
            var tuple = NodeEntry.tuple(List.of("a", "b")).rewire("b", "z");
            assertThat(tuple.children()).containsExactly("a", "z");
            assertThat(tuple.payload()).isEqualTo(new Payload.TupleLayout(List.of("a", "z")));

            var record = NodeEntry.record(Map.of("k", "a")).rewire("a", "q");
            assertThat(record.payload().embeddedIds()).containsExactly("q");
        }

        @Test
        @DisplayName("returns the same instance when nothing references the id")
        void unchangedWhenAbsent() {
            var entry = NodeEntry.of("num/neg", "a");
            assertThat(entry.rewire("b", "c")).isSameAs(entry);
        }
    }
}
