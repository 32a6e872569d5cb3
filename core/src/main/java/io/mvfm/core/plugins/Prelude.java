package io.mvfm.core.plugins;

import io.mvfm.core.model.ExpressionValue;
import io.mvfm.core.spi.Plugin;
import java.util.List;

/** The standard plugin set and the constructors of the traits several plugins share. */
public final class Prelude {

    /** {@code core}, {@code num}, {@code str}, {@code bool}, {@code ord}, in that order. */
    public static final List<Plugin> PLUGINS = List.of(
            CorePlugin.INSTANCE, NumPlugin.INSTANCE, StrPlugin.INSTANCE, BoolPlugin.INSTANCE, OrdPlugin.INSTANCE);

    private Prelude() {}

    public static ExpressionValue eq(Object a, Object b) {
        return ExpressionValue.of("eq", a, b);
    }

    public static ExpressionValue neq(Object a, Object b) {
        return ExpressionValue.of("neq", a, b);
    }

    public static ExpressionValue show(Object a) {
        return ExpressionValue.of("show", a);
    }
}
