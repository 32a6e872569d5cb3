package io.mvfm.core.plugins;

import static io.mvfm.core.model.TypeTag.BOOLEAN;
import static io.mvfm.core.model.TypeTag.NUMBER;
import static io.mvfm.core.model.TypeTag.STRING;
import static io.mvfm.core.plugins.Values.binary;
import static io.mvfm.core.plugins.Values.num;
import static io.mvfm.core.plugins.Values.unary;

import io.mvfm.core.model.ExpressionValue;
import io.mvfm.core.model.KindSpec;
import io.mvfm.core.model.TraitDef;
import io.mvfm.core.model.TypeTag;
import io.mvfm.core.spi.Handler;
import io.mvfm.core.spi.Plugin;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Numeric literals and arithmetic. Every numeric result is a {@link Double}; literals of other
 * {@link Number} types are widened when read.
 */
public final class NumPlugin implements Plugin {

    public static final String NAME = "num";

    public static final String LITERAL = "num/literal";

    /** Largest integer a double represents exactly. */
    public static final double TOP = 9007199254740991d;

    public static final NumPlugin INSTANCE = new NumPlugin();

    private static final Map<String, KindSpec> KINDS;

    private static final Map<String, TraitDef> TRAITS = Map.of(
            "eq", TraitDef.of(BOOLEAN, NUMBER, "num/eq"),
            "neq", TraitDef.of(BOOLEAN, NUMBER, "num/neq"),
            "show", TraitDef.of(STRING, NUMBER, "num/show"));

    static {
        Map<String, KindSpec> kinds = new LinkedHashMap<>();
        kinds.put(LITERAL, KindSpec.of(NUMBER));
        for (String op : new String[] {"add", "sub", "mul", "div", "mod", "min", "max"}) {
            kinds.put("num/" + op, KindSpec.of(NUMBER, NUMBER, NUMBER));
        }
        for (String op : new String[] {"neg", "abs", "floor", "ceil", "round"}) {
            kinds.put("num/" + op, KindSpec.of(NUMBER, NUMBER));
        }
        kinds.put("num/show", KindSpec.of(STRING, NUMBER));
        kinds.put("num/compare", KindSpec.of(NUMBER, NUMBER, NUMBER));
        kinds.put("num/eq", KindSpec.of(BOOLEAN, NUMBER, NUMBER));
        kinds.put("num/neq", KindSpec.of(BOOLEAN, NUMBER, NUMBER));
        for (String constant : new String[] {"zero", "one", "top", "bottom"}) {
            kinds.put("num/" + constant, KindSpec.of(NUMBER));
        }
        KINDS = Collections.unmodifiableMap(kinds);
    }

    private NumPlugin() {}

    // ── Constructors ──

    public static ExpressionValue add(Object a, Object b) {
        return ExpressionValue.of("num/add", a, b);
    }

    public static ExpressionValue sub(Object a, Object b) {
        return ExpressionValue.of("num/sub", a, b);
    }

    public static ExpressionValue mul(Object a, Object b) {
        return ExpressionValue.of("num/mul", a, b);
    }

    public static ExpressionValue div(Object a, Object b) {
        return ExpressionValue.of("num/div", a, b);
    }

    public static ExpressionValue mod(Object a, Object b) {
        return ExpressionValue.of("num/mod", a, b);
    }

    public static ExpressionValue min(Object a, Object b) {
        return ExpressionValue.of("num/min", a, b);
    }

    public static ExpressionValue max(Object a, Object b) {
        return ExpressionValue.of("num/max", a, b);
    }

    public static ExpressionValue neg(Object a) {
        return ExpressionValue.of("num/neg", a);
    }

    public static ExpressionValue abs(Object a) {
        return ExpressionValue.of("num/abs", a);
    }

    public static ExpressionValue floor(Object a) {
        return ExpressionValue.of("num/floor", a);
    }

    public static ExpressionValue ceil(Object a) {
        return ExpressionValue.of("num/ceil", a);
    }

    public static ExpressionValue round(Object a) {
        return ExpressionValue.of("num/round", a);
    }

    public static ExpressionValue zero() {
        return ExpressionValue.of("num/zero");
    }

    public static ExpressionValue one() {
        return ExpressionValue.of("num/one");
    }

    // ── Plugin ──

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Map<String, KindSpec> kinds() {
        return KINDS;
    }

    @Override
    public Map<String, TraitDef> traits() {
        return TRAITS;
    }

    @Override
    public Map<TypeTag, String> lifts() {
        return Map.of(NUMBER, LITERAL);
    }

    @Override
    public Optional<Map<String, Handler>> createDefaultHandlers() {
        Map<String, Handler> h = new LinkedHashMap<>();
        h.put(LITERAL, Values.literal(value -> num(value)));
        h.put("num/add", binary((a, b) -> num(a) + num(b)));
        h.put("num/sub", binary((a, b) -> num(a) - num(b)));
        h.put("num/mul", binary((a, b) -> num(a) * num(b)));
        h.put("num/div", binary((a, b) -> num(a) / num(b)));
        h.put("num/mod", binary((a, b) -> num(a) % num(b)));
        h.put("num/min", binary((a, b) -> Math.min(num(a), num(b))));
        h.put("num/max", binary((a, b) -> Math.max(num(a), num(b))));
        h.put("num/neg", unary(a -> -num(a)));
        h.put("num/abs", unary(a -> Math.abs(num(a))));
        h.put("num/floor", unary(a -> Math.floor(num(a))));
        h.put("num/ceil", unary(a -> Math.ceil(num(a))));
        // half-way values round towards positive infinity
        h.put("num/round", unary(a -> Math.floor(num(a) + 0.5)));
        h.put("num/show", unary(a -> Values.show(num(a))));
        h.put("num/compare", binary((a, b) -> Values.compare(num(a), num(b))));
        h.put("num/eq", binary((a, b) -> num(a) == num(b)));
        h.put("num/neq", binary((a, b) -> num(a) != num(b)));
        h.put("num/zero", Values.constant(0d));
        h.put("num/one", Values.constant(1d));
        h.put("num/top", Values.constant(TOP));
        h.put("num/bottom", Values.constant(-TOP));
        return Optional.of(h);
    }
}
