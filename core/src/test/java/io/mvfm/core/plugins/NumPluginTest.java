package io.mvfm.core.plugins;

import static io.mvfm.core.plugins.NumPlugin.abs;
import static io.mvfm.core.plugins.NumPlugin.add;
import static io.mvfm.core.plugins.NumPlugin.ceil;
import static io.mvfm.core.plugins.NumPlugin.div;
import static io.mvfm.core.plugins.NumPlugin.floor;
import static io.mvfm.core.plugins.NumPlugin.max;
import static io.mvfm.core.plugins.NumPlugin.min;
import static io.mvfm.core.plugins.NumPlugin.mod;
import static io.mvfm.core.plugins.NumPlugin.neg;
import static io.mvfm.core.plugins.NumPlugin.one;
import static io.mvfm.core.plugins.NumPlugin.round;
import static io.mvfm.core.plugins.NumPlugin.sub;
import static io.mvfm.core.plugins.NumPlugin.zero;
import static org.assertj.core.api.Assertions.assertThat;

import io.mvfm.core.engine.ProgramEngine;
import io.mvfm.core.model.ExpressionValue;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("NumPlugin")
class NumPluginTest {

    private final ProgramEngine engine = ProgramEngine.create(NumPlugin.INSTANCE);

    @Test
    @DisplayName("arithmetic yields doubles")
    void arithmetic() {
        assertThat(engine.run(add(1, 2))).isEqualTo(3.0);
        assertThat(engine.run(sub(1, 2))).isEqualTo(-1.0);
        assertThat(engine.run(div(7, 2))).isEqualTo(3.5);
        assertThat(engine.run(mod(7, 3))).isEqualTo(1.0);
        assertThat(engine.run(div(1, 0))).isEqualTo(Double.POSITIVE_INFINITY);
    }

    @Test
    @DisplayName("unary operations")
    void unary() {
        assertThat(engine.run(neg(4))).isEqualTo(-4.0);
        assertThat(engine.run(abs(-4.5))).isEqualTo(4.5);
        assertThat(engine.run(floor(2.7))).isEqualTo(2.0);
        assertThat(engine.run(ceil(2.1))).isEqualTo(3.0);
        assertThat(engine.run(min(2, 9))).isEqualTo(2.0);
        assertThat(engine.run(max(2, 9))).isEqualTo(9.0);
    }

    @Test
    @DisplayName("round sends halves towards positive infinity")
    void rounding() {
        assertThat(engine.run(round(2.5))).isEqualTo(3.0);
        assertThat(engine.run(round(-2.5))).isEqualTo(-2.0);
        assertThat(engine.run(round(2.4))).isEqualTo(2.0);
    }

    @Test
    @DisplayName("constants")
    void constants() {
        assertThat(engine.run(zero())).isEqualTo(0.0);
        assertThat(engine.run(one())).isEqualTo(1.0);
        assertThat(engine.run(ExpressionValue.of("num/top"))).isEqualTo(NumPlugin.TOP);
        assertThat(engine.run(ExpressionValue.of("num/bottom"))).isEqualTo(-NumPlugin.TOP);
    }

    @Test
    @DisplayName("show prints integral values without a fraction")
    void show() {
        assertThat(engine.run(Prelude.show(3))).isEqualTo("3");
        assertThat(engine.run(Prelude.show(2.5))).isEqualTo("2.5");
        assertThat(engine.run(Prelude.show(neg(0.5)))).isEqualTo("-0.5");
    }

    @Test
    @DisplayName("eq and neq")
    void equality() {
        assertThat(engine.run(Prelude.eq(2, 2.0))).isEqualTo(true);
        assertThat(engine.run(Prelude.neq(2, 3))).isEqualTo(true);
    }
}
