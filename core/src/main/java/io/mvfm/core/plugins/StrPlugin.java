package io.mvfm.core.plugins;

import static io.mvfm.core.model.TypeTag.BOOLEAN;
import static io.mvfm.core.model.TypeTag.NUMBER;
import static io.mvfm.core.model.TypeTag.STRING;
import static io.mvfm.core.model.TypeTag.TUPLE;
import static io.mvfm.core.plugins.Values.binary;
import static io.mvfm.core.plugins.Values.num;
import static io.mvfm.core.plugins.Values.str;
import static io.mvfm.core.plugins.Values.unary;

import io.mvfm.core.model.ExpressionValue;
import io.mvfm.core.model.KindSpec;
import io.mvfm.core.model.TraitDef;
import io.mvfm.core.model.TypeTag;
import io.mvfm.core.spi.EvalNode;
import io.mvfm.core.spi.Handler;
import io.mvfm.core.spi.Plugin;
import io.mvfm.core.spi.Step;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.StringJoiner;

/** String literals and text operations. Lengths and indices are numbers (UTF-16 units). */
public final class StrPlugin implements Plugin {

    public static final String NAME = "str";

    public static final String LITERAL = "str/literal";

    public static final StrPlugin INSTANCE = new StrPlugin();

    private static final Map<String, KindSpec> KINDS;

    private static final Map<String, TraitDef> TRAITS = Map.of(
            "eq", TraitDef.of(BOOLEAN, STRING, "str/eq"),
            "neq", TraitDef.of(BOOLEAN, STRING, "str/neq"),
            "show", TraitDef.of(STRING, STRING, "str/show"),
            "append", TraitDef.of(STRING, STRING, "str/append"));

    static {
        Map<String, KindSpec> kinds = new LinkedHashMap<>();
        kinds.put(LITERAL, KindSpec.of(STRING));
        kinds.put("str/concat", KindSpec.of(STRING));
        kinds.put("str/upper", KindSpec.of(STRING, STRING));
        kinds.put("str/lower", KindSpec.of(STRING, STRING));
        kinds.put("str/trim", KindSpec.of(STRING, STRING));
        kinds.put("str/slice", KindSpec.of(STRING, STRING, NUMBER, NUMBER));
        kinds.put("str/includes", KindSpec.of(BOOLEAN, STRING, STRING));
        kinds.put("str/startsWith", KindSpec.of(BOOLEAN, STRING, STRING));
        kinds.put("str/endsWith", KindSpec.of(BOOLEAN, STRING, STRING));
        kinds.put("str/split", KindSpec.of(TUPLE, STRING, STRING));
        kinds.put("str/join", KindSpec.of(STRING, TUPLE, STRING));
        kinds.put("str/replace", KindSpec.of(STRING, STRING, STRING, STRING));
        kinds.put("str/len", KindSpec.of(NUMBER, STRING));
        kinds.put("str/show", KindSpec.of(STRING, STRING));
        kinds.put("str/append", KindSpec.of(STRING, STRING, STRING));
        kinds.put("str/mempty", KindSpec.of(STRING));
        kinds.put("str/eq", KindSpec.of(BOOLEAN, STRING, STRING));
        kinds.put("str/neq", KindSpec.of(BOOLEAN, STRING, STRING));
        KINDS = Collections.unmodifiableMap(kinds);
    }

    private StrPlugin() {}

    // ── Constructors ──

    public static ExpressionValue concat(Object... parts) {
        return ExpressionValue.of("str/concat", parts);
    }

    public static ExpressionValue upper(Object s) {
        return ExpressionValue.of("str/upper", s);
    }

    public static ExpressionValue lower(Object s) {
        return ExpressionValue.of("str/lower", s);
    }

    public static ExpressionValue trim(Object s) {
        return ExpressionValue.of("str/trim", s);
    }

    public static ExpressionValue slice(Object s, Object start) {
        return ExpressionValue.of("str/slice", s, start);
    }

    public static ExpressionValue slice(Object s, Object start, Object end) {
        return ExpressionValue.of("str/slice", s, start, end);
    }

    public static ExpressionValue includes(Object s, Object part) {
        return ExpressionValue.of("str/includes", s, part);
    }

    public static ExpressionValue startsWith(Object s, Object prefix) {
        return ExpressionValue.of("str/startsWith", s, prefix);
    }

    public static ExpressionValue endsWith(Object s, Object suffix) {
        return ExpressionValue.of("str/endsWith", s, suffix);
    }

    public static ExpressionValue split(Object s, Object separator) {
        return ExpressionValue.of("str/split", s, separator);
    }

    public static ExpressionValue join(Object parts, Object separator) {
        return ExpressionValue.of("str/join", parts, separator);
    }

    public static ExpressionValue replace(Object s, Object target, Object replacement) {
        return ExpressionValue.of("str/replace", s, target, replacement);
    }

    public static ExpressionValue len(Object s) {
        return ExpressionValue.of("str/len", s);
    }

    /** The {@code append} trait. */
    public static ExpressionValue append(Object a, Object b) {
        return ExpressionValue.of("append", a, b);
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
        return Map.of(STRING, LITERAL);
    }

    @Override
    public Optional<Map<String, Handler>> createDefaultHandlers() {
        Map<String, Handler> h = new LinkedHashMap<>();
        h.put(LITERAL, Values.literal(Values::str));
        h.put("str/concat", StrPlugin::evalConcat);
        h.put("str/upper", unary(s -> str(s).toUpperCase()));
        h.put("str/lower", unary(s -> str(s).toLowerCase()));
        h.put("str/trim", unary(s -> str(s).trim()));
        h.put("str/slice", StrPlugin::evalSlice);
        h.put("str/includes", binary((s, part) -> str(s).contains(str(part))));
        h.put("str/startsWith", binary((s, prefix) -> str(s).startsWith(str(prefix))));
        h.put("str/endsWith", binary((s, suffix) -> str(s).endsWith(str(suffix))));
        h.put("str/split", binary((s, sep) -> splitText(str(s), str(sep))));
        h.put("str/join", binary((parts, sep) -> joinParts(Values.list(parts), str(sep))));
        h.put("str/replace", node -> Step.child(0, s -> Step.child(1, target -> Step.child(2, replacement ->
                Step.done(replaceFirst(str(s), str(target), str(replacement)))))));
        h.put("str/len", unary(s -> (double) str(s).length()));
        h.put("str/show", unary(Values::str));
        h.put("str/append", binary((a, b) -> str(a) + str(b)));
        h.put("str/mempty", Values.constant(""));
        h.put("str/eq", binary((a, b) -> str(a).equals(str(b))));
        h.put("str/neq", binary((a, b) -> !str(a).equals(str(b))));
        return Optional.of(h);
    }

    // ── Handlers ──

    private static Step evalConcat(EvalNode node) {
        StringBuilder out = new StringBuilder();
        return Step.eachChild(0, node.childCount(), part -> out.append(str(part)), () -> Step.done(out.toString()));
    }

    private static Step evalSlice(EvalNode node) {
        return Step.child(0, s -> Step.child(1, start -> {
            String text = str(s);
            if (node.childCount() < 3) {
                return Step.done(sliceText(text, num(start), text.length()));
            }
            return Step.child(2, end -> Step.done(sliceText(text, num(start), num(end))));
        }));
    }

    /** Substring with negative offsets counted from the end and out-of-range offsets clamped. */
    static String sliceText(String text, double start, double end) {
        int length = text.length();
        int from = clamp(start, length);
        int to = clamp(end, length);
        return from >= to ? "" : text.substring(from, to);
    }

    private static int clamp(double offset, int length) {
        double adjusted = offset < 0 ? length + Math.ceil(offset) : Math.floor(offset);
        if (Double.isNaN(adjusted) || adjusted < 0) {
            return 0;
        }
        return (int) Math.min(adjusted, length);
    }

    /**
     * Splits on a literal separator, keeping empty fields; an empty separator splits characters.
     */
    static List<Object> splitText(String text, String separator) {
        List<Object> parts = new ArrayList<>();
        if (separator.isEmpty()) {
            for (int i = 0; i < text.length(); i++) {
                parts.add(String.valueOf(text.charAt(i)));
            }
            return parts;
        }
        int from = 0;
        int at;
        while ((at = text.indexOf(separator, from)) >= 0) {
            parts.add(text.substring(from, at));
            from = at + separator.length();
        }
        parts.add(text.substring(from));
        return parts;
    }

    private static String joinParts(List<?> parts, String separator) {
        StringJoiner joiner = new StringJoiner(separator);
        for (Object part : parts) {
            joiner.add(part == null ? "" : Values.show(part));
        }
        return joiner.toString();
    }

    static String replaceFirst(String text, String target, String replacement) {
        int at = text.indexOf(target);
        if (at < 0) {
            return text;
        }
        return text.substring(0, at) + replacement + text.substring(at + target.length());
    }
}
