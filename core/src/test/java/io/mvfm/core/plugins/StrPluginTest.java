package io.mvfm.core.plugins;

import static io.mvfm.core.plugins.StrPlugin.append;
import static io.mvfm.core.plugins.StrPlugin.concat;
import static io.mvfm.core.plugins.StrPlugin.endsWith;
import static io.mvfm.core.plugins.StrPlugin.includes;
import static io.mvfm.core.plugins.StrPlugin.join;
import static io.mvfm.core.plugins.StrPlugin.len;
import static io.mvfm.core.plugins.StrPlugin.lower;
import static io.mvfm.core.plugins.StrPlugin.replace;
import static io.mvfm.core.plugins.StrPlugin.slice;
import static io.mvfm.core.plugins.StrPlugin.split;
import static io.mvfm.core.plugins.StrPlugin.startsWith;
import static io.mvfm.core.plugins.StrPlugin.trim;
import static io.mvfm.core.plugins.StrPlugin.upper;
import static org.assertj.core.api.Assertions.assertThat;

import io.mvfm.core.engine.ProgramEngine;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("StrPlugin")
class StrPluginTest {

    private final ProgramEngine engine = ProgramEngine.create(Prelude.PLUGINS, Map.of());

    @Nested
    @DisplayName("Handlers")
    class Handlers {

        @Test
        @DisplayName("concat joins any number of parts")
        void concatenation() {
            assertThat(engine.run(concat("a", "b", "c"))).isEqualTo("abc");
            assertThat(engine.run(concat())).isEqualTo("");
        }

        @Test
        @DisplayName("case and whitespace")
        void caseAndTrim() {
            assertThat(engine.run(upper("abc"))).isEqualTo("ABC");
            assertThat(engine.run(lower("ABC"))).isEqualTo("abc");
            assertThat(engine.run(trim("  x "))).isEqualTo("x");
        }

        @Test
        @DisplayName("slice with and without an end")
        void slicing() {
            assertThat(engine.run(slice("hello", 1))).isEqualTo("ello");
            assertThat(engine.run(slice("hello", 1, 3))).isEqualTo("el");
            assertThat(engine.run(slice("hello", NumPlugin.neg(3)))).isEqualTo("llo");
        }

        @Test
        @DisplayName("substring tests")
        void searching() {
            assertThat(engine.run(includes("hello", "ell"))).isEqualTo(true);
            assertThat(engine.run(startsWith("hello", "he"))).isEqualTo(true);
            assertThat(engine.run(endsWith("hello", "he"))).isEqualTo(false);
        }

        @Test
        @DisplayName("split and join round a separator")
        void splitJoin() {
            assertThat(engine.run(split("a-b-c", "-"))).isEqualTo(List.of("a", "b", "c"));
            assertThat(engine.run(join(split("a-b-c", "-"), "+"))).isEqualTo("a+b+c");
            assertThat(engine.run(join(List.of(1, 2.5), ", "))).isEqualTo("1, 2.5");
        }

        @Test
        @DisplayName("replace substitutes the first occurrence only")
        void replaceFirst() {
            assertThat(engine.run(replace("aXbX", "X", "-"))).isEqualTo("a-bX");
        }

        @Test
        @DisplayName("len counts UTF-16 units")
        void length() {
            assertThat(engine.run(len("héllo"))).isEqualTo(5.0);
        }

        @Test
        @DisplayName("traits: append, eq, show")
        void traits() {
            assertThat(engine.run(append("ab", "cd"))).isEqualTo("abcd");
            assertThat(engine.run(Prelude.eq("a", "a"))).isEqualTo(true);
            assertThat(engine.run(Prelude.neq("a", "a"))).isEqualTo(false);
            assertThat(engine.run(Prelude.show("x"))).isEqualTo("x");
        }
    }

    @Nested
    @DisplayName("Text helpers")
    class Helpers {

        @Test
        @DisplayName("sliceText counts negative offsets from the end and clamps")
        void sliceText() {
            assertThat(StrPlugin.sliceText("hello", -3, 5)).isEqualTo("llo");
            assertThat(StrPlugin.sliceText("hello", 2, 100)).isEqualTo("llo");
            assertThat(StrPlugin.sliceText("hello", 3, 1)).isEmpty();
            assertThat(StrPlugin.sliceText("hello", -100, 2)).isEqualTo("he");
        }

        @Test
        @DisplayName("splitText keeps empty fields")
        void splitText() {
            assertThat(StrPlugin.splitText("a,,b", ",")).containsExactly("a", "", "b");
            assertThat(StrPlugin.splitText("abc", "")).containsExactly("a", "b", "c");
            assertThat(StrPlugin.splitText("abc", "-")).containsExactly("abc");
            assertThat(StrPlugin.splitText("", ",")).containsExactly("");
        }

        @Test
        @DisplayName("replaceFirst leaves text without the target untouched")
        void replaceFirstHelper() {
            assertThat(StrPlugin.replaceFirst("abc", "x", "y")).isEqualTo("abc");
        }
    }
}
