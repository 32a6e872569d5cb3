package io.mvfm.core.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * An unresolved, tagged value produced while a program is being authored: a kind tag and an
 * ordered argument list. Arguments may be nested expression values, scalars ({@link Number},
 * {@link String}, {@link Boolean}), plain composites ({@link List}, {@link Map} with string keys)
 * or deferred property accesses built with {@link #get(String)} and {@link #at(int)}.
 *
 * <p>Expression values are ephemeral: they are consumed by elaboration and never appear in a
 * normalized graph.
 */
public record ExpressionValue(String kind, List<Object> args) {

    /** Kind tag of deferred property/index access. */
    public static final String ACCESS = "core/access";

    /** Kind tag emitted for plain lists. */
    public static final String TUPLE = "core/tuple";

    /** Kind tag emitted for plain maps. */
    public static final String RECORD = "core/record";

    public ExpressionValue {
        Objects.requireNonNull(kind, "kind must not be null");
        if (kind.isEmpty()) {
            throw new IllegalArgumentException("kind must not be empty");
        }
        Objects.requireNonNull(args, "args must not be null");
        for (int i = 0; i < args.size(); i++) {
            if (args.get(i) == null) {
                throw new IllegalArgumentException(kind + ": argument " + i + " must not be null");
            }
        }
        args = List.copyOf(args);
    }

    /** Creates an expression value of the given kind. */
    public static ExpressionValue of(String kind, Object... args) {
        return new ExpressionValue(kind, Arrays.asList(args));
    }

    /** Creates an expression value from a list of arguments. */
    public static ExpressionValue of(String kind, List<?> args) {
        return new ExpressionValue(kind, new ArrayList<>(args));
    }

    /**
     * Deferred access to a field or index of {@code parent}'s result.
     *
     * @param key a {@link String} field name or an {@link Integer} index
     */
    public static ExpressionValue access(ExpressionValue parent, Object key) {
        Objects.requireNonNull(parent, "parent must not be null");
        if (!(key instanceof String) && !(key instanceof Integer)) {
            throw new IllegalArgumentException("access key must be a String or Integer, got: " + key);
        }
        return of(ACCESS, parent, key);
    }

    /** Deferred access to field {@code field} of this value's result. */
    public ExpressionValue get(String field) {
        return access(this, field);
    }

    /** Deferred access to element {@code index} of this value's result. */
    public ExpressionValue at(int index) {
        return access(this, index);
    }

    /** Returns {@code true} if this is a deferred access. */
    public boolean isAccess() {
        return ACCESS.equals(kind);
    }

    /** Number of arguments. */
    public int arity() {
        return args.size();
    }

    @Override
    public String toString() {
        return kind + args;
    }
}
