package io.mvfm.core.plugins;

import io.mvfm.core.model.KindSpec;
import io.mvfm.core.model.TraitDef;
import io.mvfm.core.model.TypeTag;
import io.mvfm.core.spi.Handler;
import io.mvfm.core.spi.Plugin;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * A plugin assembled from plain tables, for ad-hoc extensions and for wrappers around external
 * services that ship no default handlers (callers supply them as overrides).
 *
 * <pre>{@code
 * Plugin http = SimplePlugin.builder("http")
 *         .kind("http/get", KindSpec.of(TypeTag.RECORD, TypeTag.STRING))
 *         .build();
 * }</pre>
 *
 * @param name            plugin name
 * @param kinds           kind specifications
 * @param traits          trait definitions
 * @param lifts           lift mappings
 * @param nodeKinds       kinds this plugin's handlers cover
 * @param handlerFactory  creates default handlers, or {@code null} for none
 */
public record SimplePlugin(
        String name,
        Map<String, KindSpec> kinds,
        Map<String, TraitDef> traits,
        Map<TypeTag, String> lifts,
        List<String> nodeKinds,
        Supplier<Map<String, Handler>> handlerFactory)
        implements Plugin {

    public SimplePlugin {
        Objects.requireNonNull(name, "name must not be null");
        kinds = Collections.unmodifiableMap(new LinkedHashMap<>(kinds));
        traits = Collections.unmodifiableMap(new LinkedHashMap<>(traits));
        lifts = lifts.isEmpty() ? Map.of() : Collections.unmodifiableMap(new EnumMap<>(lifts));
        nodeKinds = List.copyOf(nodeKinds);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    @Override
    public Optional<Map<String, Handler>> createDefaultHandlers() {
        return handlerFactory == null ? Optional.empty() : Optional.of(handlerFactory.get());
    }

    /** Builder for {@link SimplePlugin}. Node kinds default to the declared kinds. */
    public static final class Builder {

        private final String name;
        private final Map<String, KindSpec> kinds = new LinkedHashMap<>();
        private final Map<String, TraitDef> traits = new LinkedHashMap<>();
        private final Map<TypeTag, String> lifts = new EnumMap<>(TypeTag.class);
        private final List<String> extraNodeKinds = new ArrayList<>();
        private Supplier<Map<String, Handler>> handlerFactory;

        Builder(String name) {
            this.name = Objects.requireNonNull(name, "name must not be null");
        }

        public Builder kind(String kind, KindSpec spec) {
            kinds.put(
                    Objects.requireNonNull(kind, "kind must not be null"),
                    Objects.requireNonNull(spec, "spec must not be null"));
            return this;
        }

        public Builder trait(String trait, TraitDef def) {
            traits.put(
                    Objects.requireNonNull(trait, "trait must not be null"),
                    Objects.requireNonNull(def, "def must not be null"));
            return this;
        }

        public Builder lift(TypeTag type, String literalKind) {
            lifts.put(
                    Objects.requireNonNull(type, "type must not be null"),
                    Objects.requireNonNull(literalKind, "literalKind must not be null"));
            return this;
        }

        /** Declares a kind handled by this plugin that has no kind specification. */
        public Builder nodeKind(String kind) {
            extraNodeKinds.add(Objects.requireNonNull(kind, "kind must not be null"));
            return this;
        }

        /**
         * Sets the default handler factory. The supplier is called once per handler composition.
         */
        public Builder handlers(Supplier<Map<String, Handler>> factory) {
            this.handlerFactory = Objects.requireNonNull(factory, "factory must not be null");
            return this;
        }

        public SimplePlugin build() {
            List<String> nodeKinds = new ArrayList<>(kinds.keySet());
            for (String kind : extraNodeKinds) {
                if (!nodeKinds.contains(kind)) {
                    nodeKinds.add(kind);
                }
            }
            return new SimplePlugin(name, kinds, traits, lifts, nodeKinds, handlerFactory);
        }
    }
}
