package io.mvfm.core.plugins;

import io.mvfm.core.spi.Handler;
import io.mvfm.core.spi.Step;
import java.util.List;
import java.util.Map;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Value coercions and handler shapes shared by the standard plugins. Coercion failures throw
 * {@link IllegalArgumentException}, which the fold reports as a handler failure of the node.
 */
final class Values {

    private Values() {}

    // ── Coercions ──

    static double num(Object value) {
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        throw new IllegalArgumentException("expected number, got " + describe(value));
    }

    static String str(Object value) {
        if (value instanceof CharSequence s) {
            return s.toString();
        }
        throw new IllegalArgumentException("expected string, got " + describe(value));
    }

    static boolean bool(Object value) {
        if (value instanceof Boolean b) {
            return b;
        }
        throw new IllegalArgumentException("expected boolean, got " + describe(value));
    }

    static List<?> list(Object value) {
        if (value instanceof List<?> l) {
            return l;
        }
        throw new IllegalArgumentException("expected tuple, got " + describe(value));
    }

    /** Renders a value as text; integral numbers print without a fractional part. */
    static String show(Object value) {
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (d == Math.rint(d) && !Double.isInfinite(d) && Math.abs(d) < 1e15) {
                return Long.toString((long) d);
            }
            return Double.toString(d);
        }
        return String.valueOf(value);
    }

    /** Orders two numbers as -1, 0 or 1; NaN compares equal to everything. */
    static Double compare(double a, double b) {
        return a < b ? -1d : a > b ? 1d : 0d;
    }

    /** Sign of a comparison as a number: -1, 0 or 1. */
    static Double sign(int comparison) {
        return (double) Integer.signum(comparison);
    }

    private static String describe(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof Map<?, ?>) {
            return "record";
        }
        return value.getClass().getSimpleName() + " (" + value + ")";
    }

    // ── Handler shapes ──

    /** Completes with the node's literal payload, converted by {@code convert}. */
    static Handler literal(Function<Object, Object> convert) {
        return node -> Step.done(convert.apply(node.literal()));
    }

    /** Completes with a fixed value. */
    static Handler constant(Object value) {
        return node -> Step.done(value);
    }

    /** Reads child 0 and completes with {@code fn} of it. */
    static Handler unary(Function<Object, Object> fn) {
        return node -> Step.child(0, a -> Step.done(fn.apply(a)));
    }

    /** Reads children 0 and 1, in order, and completes with {@code fn} of them. */
    static Handler binary(BiFunction<Object, Object, Object> fn) {
        return node -> Step.child(0, a -> Step.child(1, b -> Step.done(fn.apply(a, b))));
    }
}
