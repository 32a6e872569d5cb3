package io.mvfm.core.plugins;

import static io.mvfm.core.model.TypeTag.ANY;
import static io.mvfm.core.model.TypeTag.BOOLEAN;

import io.mvfm.core.model.ExpressionValue;
import io.mvfm.core.model.KindSpec;
import io.mvfm.core.model.Payload;
import io.mvfm.core.model.TypeTag;
import io.mvfm.core.spi.EvalNode;
import io.mvfm.core.spi.Handler;
import io.mvfm.core.spi.Plugin;
import io.mvfm.core.spi.Step;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Control flow and structural kinds every program relies on: {@code core/cond},
 * {@code core/begin}, {@code core/input} and the handlers for the tuple, record and access nodes
 * the elaborator emits for plain composites.
 */
public final class CorePlugin implements Plugin {

    public static final String NAME = "core";

    public static final String COND = "core/cond";
    public static final String BEGIN = "core/begin";
    public static final String INPUT = "core/input";

    public static final CorePlugin INSTANCE = new CorePlugin();

    private static final Map<String, KindSpec> KINDS;

    static {
        Map<String, KindSpec> kinds = new LinkedHashMap<>();
        kinds.put(COND, KindSpec.of(ANY, BOOLEAN, ANY, ANY));
        kinds.put(BEGIN, KindSpec.of(ANY));
        kinds.put(INPUT, KindSpec.of(ANY));
        kinds.put(ExpressionValue.TUPLE, KindSpec.of(TypeTag.TUPLE));
        kinds.put(ExpressionValue.RECORD, KindSpec.of(TypeTag.RECORD));
        kinds.put(ExpressionValue.ACCESS, KindSpec.of(ANY));
        KINDS = Collections.unmodifiableMap(kinds);
    }

    private CorePlugin() {}

    // ── Constructors ──

    /** {@code predicate ? then : otherwise}; only the taken branch is evaluated. */
    public static ExpressionValue cond(Object predicate, Object then, Object otherwise) {
        return ExpressionValue.of(COND, predicate, then, otherwise);
    }

    /** Evaluates every argument in order; the value is the last one. */
    public static ExpressionValue begin(Object... steps) {
        return ExpressionValue.of(BEGIN, steps);
    }

    /** A placeholder for data supplied later with {@code GraphRewrites.injectInput}. */
    public static ExpressionValue input() {
        return ExpressionValue.of(INPUT);
    }

    public static ExpressionValue tuple(Object... elements) {
        return ExpressionValue.of(ExpressionValue.TUPLE, Arrays.asList(elements));
    }

    public static ExpressionValue record(Map<String, ?> fields) {
        return ExpressionValue.of(ExpressionValue.RECORD, fields);
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
    public Optional<Map<String, Handler>> createDefaultHandlers() {
        Map<String, Handler> handlers = new LinkedHashMap<>();
        handlers.put(COND, node -> Step.child(0, p -> Step.child(Values.bool(p) ? 1 : 2, Step::done)));
        handlers.put(BEGIN, CorePlugin::evalBegin);
        handlers.put(INPUT, node -> Step.done(node.literal()));
        handlers.put(ExpressionValue.TUPLE, CorePlugin::evalTuple);
        handlers.put(ExpressionValue.RECORD, CorePlugin::evalRecord);
        handlers.put(ExpressionValue.ACCESS, CorePlugin::evalAccess);
        return Optional.of(handlers);
    }

    // ── Handlers ──

    private static Step evalBegin(EvalNode node) {
        Object[] last = new Object[1];
        return Step.eachChild(0, node.childCount(), value -> last[0] = value, () -> Step.done(last[0]));
    }

    private static Step evalTuple(EvalNode node) {
        List<Object> values = new ArrayList<>(node.childCount());
        return Step.eachChild(0, node.childCount(), values::add, () -> Step.done(values));
    }

    private static Step evalRecord(EvalNode node) {
        if (!(node.payload() instanceof Payload.RecordLayout layout)) {
            throw new IllegalStateException("core/record node '" + node.id() + "' has no field layout");
        }
        Map<String, Object> values = new LinkedHashMap<>();
        return readFields(layout.fields().entrySet().iterator(), values);
    }

    private static Step readFields(Iterator<Map.Entry<String, String>> fields, Map<String, Object> values) {
        if (!fields.hasNext()) {
            return Step.done(values);
        }
        Map.Entry<String, String> field = fields.next();
        return Step.node(field.getValue(), value -> {
            values.put(field.getKey(), value);
            return readFields(fields, values);
        });
    }

    private static Step evalAccess(EvalNode node) {
        if (!(node.payload() instanceof Payload.AccessKey accessKey)) {
            throw new IllegalStateException("core/access node '" + node.id() + "' has no key");
        }
        Object key = accessKey.key();
        return Step.child(0, parent -> {
            if (key instanceof Integer index) {
                List<?> list = Values.list(parent);
                if (index < 0 || index >= list.size()) {
                    throw new IllegalArgumentException(
                            "core/access: index " + index + " out of range for tuple of " + list.size());
                }
                return Step.done(list.get(index));
            }
            if (!(parent instanceof Map<?, ?> map)) {
                throw new IllegalArgumentException("core/access: cannot read field '" + key + "' of " + parent);
            }
            if (!map.containsKey(key)) {
                throw new IllegalArgumentException("core/access: no field '" + key + "'");
            }
            return Step.done(map.get(key));
        });
    }
}
