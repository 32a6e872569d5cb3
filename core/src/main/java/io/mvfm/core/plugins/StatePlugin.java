package io.mvfm.core.plugins;

import static io.mvfm.core.model.TypeTag.ANY;
import static io.mvfm.core.model.TypeTag.STRING;
import static io.mvfm.core.plugins.Values.str;

import io.mvfm.core.model.ExpressionValue;
import io.mvfm.core.model.KindSpec;
import io.mvfm.core.spi.Handler;
import io.mvfm.core.spi.Plugin;
import io.mvfm.core.spi.Step;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Named mutable cells. A cell is created by {@code st/let}, read by {@code st/get}, replaced by
 * {@code st/set} and extended by {@code st/push} when it holds a tuple. Cell names are string
 * operands, so programs using this plugin also need the {@code str} lift.
 *
 * <p>Each handler composition gets an empty store. {@code st/get} must be registered as a volatile
 * kind for reads after a write to see the new value (it is by default).
 */
public final class StatePlugin implements Plugin {

    public static final String NAME = "st";

    public static final String LET = "st/let";
    public static final String GET = "st/get";
    public static final String SET = "st/set";
    public static final String PUSH = "st/push";

    public static final StatePlugin INSTANCE = new StatePlugin();

    private static final Map<String, KindSpec> KINDS;

    static {
        Map<String, KindSpec> kinds = new LinkedHashMap<>();
        kinds.put(LET, KindSpec.of(ANY, ANY, STRING));
        kinds.put(GET, KindSpec.of(ANY, STRING));
        kinds.put(SET, KindSpec.of(ANY, STRING, ANY));
        kinds.put(PUSH, KindSpec.of(ANY, STRING, ANY));
        KINDS = Collections.unmodifiableMap(kinds);
    }

    private StatePlugin() {}

    /** Creates cell {@code name} holding {@code initial}. */
    public static ExpressionValue let(Object initial, String name) {
        return ExpressionValue.of(LET, initial, name);
    }

    public static ExpressionValue get(String name) {
        return ExpressionValue.of(GET, name);
    }

    public static ExpressionValue set(String name, Object value) {
        return ExpressionValue.of(SET, name, value);
    }

    public static ExpressionValue push(String name, Object value) {
        return ExpressionValue.of(PUSH, name, value);
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
    public Optional<Map<String, Handler>> createDefaultHandlers() {
        Map<String, Object> cells = new HashMap<>();
        Map<String, Handler> h = new LinkedHashMap<>();
        h.put(LET, node -> Step.child(0, initial -> Step.child(1, name -> {
            cells.put(str(name), initial);
            return Step.done(null);
        })));
        h.put(GET, node -> Step.child(0, name -> {
            String ref = str(name);
            requireCell(cells, GET, ref);
            return Step.done(cells.get(ref));
        }));
        h.put(SET, node -> Step.child(0, name -> Step.child(1, value -> {
            String ref = str(name);
            requireCell(cells, SET, ref);
            cells.put(ref, value);
            return Step.done(null);
        })));
        h.put(PUSH, node -> Step.child(0, name -> Step.child(1, value -> {
            String ref = str(name);
            requireCell(cells, PUSH, ref);
            if (!(cells.get(ref) instanceof List<?> current)) {
                throw new IllegalArgumentException(PUSH + ": ref \"" + ref + "\" is not an array");
            }
            List<Object> next = new ArrayList<>(current);
            next.add(value);
            cells.put(ref, next);
            return Step.done(null);
        })));
        return Optional.of(h);
    }

    private static void requireCell(Map<String, Object> cells, String kind, String ref) {
        if (!cells.containsKey(ref)) {
            throw new IllegalArgumentException(kind + ": unknown ref \"" + ref + "\"");
        }
    }
}
