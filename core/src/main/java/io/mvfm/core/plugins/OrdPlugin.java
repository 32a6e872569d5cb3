package io.mvfm.core.plugins;

import static io.mvfm.core.model.TypeTag.BOOLEAN;
import static io.mvfm.core.model.TypeTag.NUMBER;
import static io.mvfm.core.model.TypeTag.STRING;
import static io.mvfm.core.plugins.Values.binary;
import static io.mvfm.core.plugins.Values.num;
import static io.mvfm.core.plugins.Values.str;

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
 * Ordering traits ({@code lt}, {@code gt}, {@code lte}, {@code gte}, {@code compare}) for numbers
 * and strings. Declares no lifts; numbers and strings come from their own plugins. Strings compare
 * by UTF-16 code unit.
 */
public final class OrdPlugin implements Plugin {

    public static final String NAME = "ord";

    public static final OrdPlugin INSTANCE = new OrdPlugin();

    private static final String[] RELATIONS = {"lt", "gt", "lte", "gte"};

    private static final Map<String, KindSpec> KINDS;

    private static final Map<String, TraitDef> TRAITS;

    static {
        Map<String, KindSpec> kinds = new LinkedHashMap<>();
        Map<String, TraitDef> traits = new LinkedHashMap<>();
        for (String relation : RELATIONS) {
            kinds.put("num/" + relation, KindSpec.of(BOOLEAN, NUMBER, NUMBER));
            kinds.put("str/" + relation, KindSpec.of(BOOLEAN, STRING, STRING));
            traits.put(relation, new TraitDef(BOOLEAN, Map.of(NUMBER, "num/" + relation, STRING, "str/" + relation)));
        }
        kinds.put("num/compare", KindSpec.of(NUMBER, NUMBER, NUMBER));
        kinds.put("str/compare", KindSpec.of(NUMBER, STRING, STRING));
        traits.put("compare", new TraitDef(NUMBER, Map.of(NUMBER, "num/compare", STRING, "str/compare")));
        KINDS = Collections.unmodifiableMap(kinds);
        TRAITS = Collections.unmodifiableMap(traits);
    }

    private OrdPlugin() {}

    public static ExpressionValue lt(Object a, Object b) {
        return ExpressionValue.of("lt", a, b);
    }

    public static ExpressionValue gt(Object a, Object b) {
        return ExpressionValue.of("gt", a, b);
    }

    public static ExpressionValue lte(Object a, Object b) {
        return ExpressionValue.of("lte", a, b);
    }

    public static ExpressionValue gte(Object a, Object b) {
        return ExpressionValue.of("gte", a, b);
    }

    public static ExpressionValue compare(Object a, Object b) {
        return ExpressionValue.of("compare", a, b);
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
        return Map.of();
    }

    @Override
    public Optional<Map<String, Handler>> createDefaultHandlers() {
        Map<String, Handler> h = new LinkedHashMap<>();
        h.put("num/lt", binary((a, b) -> num(a) < num(b)));
        h.put("num/gt", binary((a, b) -> num(a) > num(b)));
        h.put("num/lte", binary((a, b) -> num(a) <= num(b)));
        h.put("num/gte", binary((a, b) -> num(a) >= num(b)));
        h.put("str/lt", binary((a, b) -> str(a).compareTo(str(b)) < 0));
        h.put("str/gt", binary((a, b) -> str(a).compareTo(str(b)) > 0));
        h.put("str/lte", binary((a, b) -> str(a).compareTo(str(b)) <= 0));
        h.put("str/gte", binary((a, b) -> str(a).compareTo(str(b)) >= 0));
        h.put("num/compare", binary((a, b) -> Values.compare(num(a), num(b))));
        h.put("str/compare", binary((a, b) -> Values.sign(str(a).compareTo(str(b)))));
        return Optional.of(h);
    }
}
