package io.mvfm.core.engine;

import io.mvfm.core.model.ExpressionValue;
import io.mvfm.core.model.KindSpec;
import io.mvfm.core.model.TypeTag;
import io.mvfm.core.spi.Handler;
import io.mvfm.core.spi.Plugin;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Immutable tables derived from an ordered list of plugins: the lift map, the trait table and the
 * kind-specification table. Derived once and shared by every elaboration.
 *
 * <p>Merging is last-write-wins: when two plugins declare the same kind, the same trait/type pair
 * or the same lift, the later plugin in the list replaces the earlier declaration. Each replacement
 * is logged at DEBUG.
 *
 * <p>Thread-safe: all fields are final and collections are unmodifiable.
 */
public final class PluginRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(PluginRegistry.class);

    /**
     * Kinds the elaborator emits for plain composites and deferred access, with or without a
     * plugin.
     */
    public static final Set<String> INTRINSIC_KINDS =
            Set.of(ExpressionValue.ACCESS, ExpressionValue.TUPLE, ExpressionValue.RECORD);

    private final List<Plugin> plugins;
    private final Map<TypeTag, String> liftMap;
    private final Map<String, Map<TypeTag, String>> traitMap;
    private final Map<String, TypeTag> traitOutputs;
    private final Map<String, KindSpec> kindSpecs;

    private PluginRegistry(
            List<Plugin> plugins,
            Map<TypeTag, String> liftMap,
            Map<String, Map<TypeTag, String>> traitMap,
            Map<String, TypeTag> traitOutputs,
            Map<String, KindSpec> kindSpecs) {
        this.plugins = List.copyOf(plugins);
        this.liftMap = Collections.unmodifiableMap(liftMap);
        this.traitMap = Collections.unmodifiableMap(traitMap);
        this.traitOutputs = Collections.unmodifiableMap(traitOutputs);
        this.kindSpecs = Collections.unmodifiableMap(kindSpecs);
    }

    /**
     * Composes the given plugins, in order.
     *
     * @param plugins the plugins; later entries win on conflicts
     * @return the composed registry
     * @throws NullPointerException if the list or any plugin is null
     */
    public static PluginRegistry compose(List<? extends Plugin> plugins) {
        Objects.requireNonNull(plugins, "plugins must not be null");
        Map<TypeTag, String> lifts = new EnumMap<>(TypeTag.class);
        Map<String, Map<TypeTag, String>> traits = new LinkedHashMap<>();
        Map<String, TypeTag> traitOutputs = new HashMap<>();
        Map<String, KindSpec> kinds = new LinkedHashMap<>();
        Map<String, String> kindOwners = new HashMap<>();

        for (Plugin plugin : plugins) {
            Objects.requireNonNull(plugin, "plugin must not be null");
            String name = plugin.name();
            plugin.lifts().forEach((type, kind) -> {
                String previous = lifts.put(type, kind);
                if (previous != null && !previous.equals(kind)) {
                    LOG.debug("Lift for '{}' from plugin '{}' overrides '{}'", type, name, previous);
                }
            });
            plugin.traits().forEach((trait, def) -> {
                Map<TypeTag, String> mapping = traits.computeIfAbsent(trait, t -> new EnumMap<>(TypeTag.class));
                def.mapping().forEach((type, kind) -> {
                    String previous = mapping.put(type, kind);
                    if (previous != null && !previous.equals(kind)) {
                        LOG.debug("Trait '{}' for '{}' from plugin '{}' overrides '{}'", trait, type, name, previous);
                    }
                });
                traitOutputs.put(trait, def.output());
            });
            plugin.kinds().forEach((kind, spec) -> {
                String previousOwner = kindOwners.put(kind, name);
                if (kinds.put(kind, spec) != null) {
                    LOG.debug("Kind '{}' from plugin '{}' overrides plugin '{}'", kind, name, previousOwner);
                }
            });
        }

        Map<String, Map<TypeTag, String>> frozenTraits = new LinkedHashMap<>();
        traits.forEach((trait, mapping) -> frozenTraits.put(trait, Collections.unmodifiableMap(mapping)));
        LOG.debug(
                "Composed {} plugins: {} kinds, {} traits, {} lifts",
                plugins.size(),
                kinds.size(),
                frozenTraits.size(),
                lifts.size());
        return new PluginRegistry(new ArrayList<>(plugins), lifts, frozenTraits, traitOutputs, kinds);
    }

    /** Composes the given plugins, in order. */
    public static PluginRegistry compose(Plugin... plugins) {
        return compose(Arrays.asList(plugins));
    }

    // ── Lookups ──

    /** The literal kind for scalars of {@code type}. */
    public Optional<String> liftKind(TypeTag type) {
        return Optional.ofNullable(liftMap.get(type));
    }

    /** Returns {@code true} if {@code name} is a trait of some composed plugin. */
    public boolean isTrait(String name) {
        return traitMap.containsKey(name);
    }

    /** The merged type-to-kind mapping of trait {@code name}, or an empty map. */
    public Map<TypeTag, String> trait(String name) {
        return traitMap.getOrDefault(name, Map.of());
    }

    /** Declared output of trait {@code name}; {@link TypeTag#ANY} if unknown. */
    public TypeTag traitOutput(String name) {
        return traitOutputs.getOrDefault(name, TypeTag.ANY);
    }

    /** The specification of {@code kind}, as declared by the last plugin that declares it. */
    public Optional<KindSpec> kindSpec(String kind) {
        return Optional.ofNullable(kindSpecs.get(kind));
    }

    /**
     * The specification of {@code kind}, throwing if no plugin declares it.
     *
     * @throws IllegalArgumentException if the kind is unknown
     */
    public KindSpec requireKindSpec(String kind) {
        return kindSpec(kind)
                .orElseThrow(() -> new IllegalArgumentException("No plugin declares kind: '" + kind + "'"));
    }

    /** Returns {@code true} if the kind is declared by a plugin or is intrinsic. */
    public boolean knowsKind(String kind) {
        return kindSpecs.containsKey(kind) || INTRINSIC_KINDS.contains(kind);
    }

    /** Output type of {@code kind}; {@link TypeTag#ANY} for unknown kinds and access nodes. */
    public TypeTag outputOf(String kind) {
        KindSpec spec = kindSpecs.get(kind);
        if (spec != null) {
            return spec.output();
        }
        if (ExpressionValue.TUPLE.equals(kind)) return TypeTag.TUPLE;
        if (ExpressionValue.RECORD.equals(kind)) return TypeTag.RECORD;
        return TypeTag.ANY;
    }

    /** All kind specifications, in declaration order. */
    public Map<String, KindSpec> kindSpecs() {
        return kindSpecs;
    }

    /** All lift mappings. */
    public Map<TypeTag, String> liftMap() {
        return liftMap;
    }

    /** The composed plugins, in composition order. */
    public List<Plugin> plugins() {
        return plugins;
    }

    // ── Handlers ──

    /** Builds the handler map from every plugin's defaults. */
    public Map<String, Handler> handlers() {
        return Interpreters.defaults(plugins, Map.of());
    }

    /**
     * Builds the handler map, using {@code overrides} in place of a plugin's defaults where
     * present.
     *
     * @param overrides handler maps keyed by plugin name
     */
    public Map<String, Handler> handlers(Map<String, Map<String, Handler>> overrides) {
        return Interpreters.defaults(plugins, overrides);
    }
}
