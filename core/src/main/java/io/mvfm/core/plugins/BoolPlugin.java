package io.mvfm.core.plugins;

import static io.mvfm.core.model.TypeTag.BOOLEAN;
import static io.mvfm.core.model.TypeTag.STRING;
import static io.mvfm.core.plugins.Values.binary;
import static io.mvfm.core.plugins.Values.bool;
import static io.mvfm.core.plugins.Values.unary;

import io.mvfm.core.model.ExpressionValue;
import io.mvfm.core.model.KindSpec;
import io.mvfm.core.model.TraitDef;
import io.mvfm.core.model.TypeTag;
import io.mvfm.core.spi.Handler;
import io.mvfm.core.spi.Plugin;
import io.mvfm.core.spi.Step;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Boolean literals and connectives. {@code bool/and}, {@code bool/or} and {@code bool/implies}
 * evaluate their second operand only when the first does not decide the result.
 */
public final class BoolPlugin implements Plugin {

    public static final String NAME = "bool";

    public static final String LITERAL = "bool/literal";

    public static final BoolPlugin INSTANCE = new BoolPlugin();

    private static final Map<String, KindSpec> KINDS;

    private static final Map<String, TraitDef> TRAITS = Map.of(
            "eq", TraitDef.of(BOOLEAN, BOOLEAN, "bool/eq"),
            "neq", TraitDef.of(BOOLEAN, BOOLEAN, "bool/neq"),
            "show", TraitDef.of(STRING, BOOLEAN, "bool/show"));

    static {
        Map<String, KindSpec> kinds = new LinkedHashMap<>();
        kinds.put(LITERAL, KindSpec.of(BOOLEAN));
        for (String op : new String[] {"eq", "neq", "and", "or", "implies"}) {
            kinds.put("bool/" + op, KindSpec.of(BOOLEAN, BOOLEAN, BOOLEAN));
        }
        kinds.put("bool/not", KindSpec.of(BOOLEAN, BOOLEAN));
        kinds.put("bool/show", KindSpec.of(STRING, BOOLEAN));
        kinds.put("bool/tt", KindSpec.of(BOOLEAN));
        kinds.put("bool/ff", KindSpec.of(BOOLEAN));
        KINDS = Collections.unmodifiableMap(kinds);
    }

    private BoolPlugin() {}

    public static ExpressionValue and(Object a, Object b) {
        return ExpressionValue.of("bool/and", a, b);
    }

    public static ExpressionValue or(Object a, Object b) {
        return ExpressionValue.of("bool/or", a, b);
    }

    public static ExpressionValue not(Object a) {
        return ExpressionValue.of("bool/not", a);
    }

    public static ExpressionValue implies(Object a, Object b) {
        return ExpressionValue.of("bool/implies", a, b);
    }

    public static ExpressionValue tt() {
        return ExpressionValue.of("bool/tt");
    }

    public static ExpressionValue ff() {
        return ExpressionValue.of("bool/ff");
    }

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
        return Map.of(BOOLEAN, LITERAL);
    }

    @Override
    public Optional<Map<String, Handler>> createDefaultHandlers() {
        Map<String, Handler> h = new LinkedHashMap<>();
        h.put(LITERAL, Values.literal(value -> bool(value)));
        h.put("bool/eq", binary((a, b) -> bool(a) == bool(b)));
        h.put("bool/neq", binary((a, b) -> bool(a) != bool(b)));
        h.put("bool/and", node -> Step.child(0, a -> bool(a)
                ? Step.child(1, b -> Step.done(bool(b)))
                : Step.done(false)));
        h.put("bool/or", node -> Step.child(0, a -> bool(a)
                ? Step.done(true)
                : Step.child(1, b -> Step.done(bool(b)))));
        h.put("bool/implies", node -> Step.child(0, a -> bool(a)
                ? Step.child(1, b -> Step.done(bool(b)))
                : Step.done(true)));
        h.put("bool/not", unary(a -> !bool(a)));
        h.put("bool/show", unary(a -> String.valueOf(bool(a))));
        h.put("bool/tt", Values.constant(true));
        h.put("bool/ff", Values.constant(false));
        return Optional.of(h);
    }
}
