package io.mvfm.core.spi;

import io.mvfm.core.model.KindSpec;
import io.mvfm.core.model.TraitDef;
import io.mvfm.core.model.TypeTag;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A capability module: the node kinds it defines, the traits it implements, the scalar types it
 * lifts, and optionally a factory for default handlers. Constructor functions live as static
 * factory methods on the implementing class and return
 * {@link io.mvfm.core.model.ExpressionValue}s.
 *
 * <p>Plugins that need an external collaborator (a network client, an SDK) declare their kinds and
 * no default handlers; callers then supply handlers as an override under the plugin's
 * {@link #name()}.
 */
public interface Plugin {

    /** Unique plugin name, also the override key. */
    String name();

    /** Kind specifications declared by this plugin. */
    Map<String, KindSpec> kinds();

    /** Traits implemented by this plugin, by trait name. */
    default Map<String, TraitDef> traits() {
        return Map.of();
    }

    /** Lift mappings: scalar type to literal kind. */
    default Map<TypeTag, String> lifts() {
        return Map.of();
    }

    /** Every kind this plugin's handlers and specifications reference. */
    default List<String> nodeKinds() {
        return List.copyOf(kinds().keySet());
    }

    /**
     * Creates this plugin's default handlers. Called once per handler composition, so handlers may
     * share per-composition state.
     *
     * @return the handlers by kind, or empty if the plugin has no defaults
     */
    default Optional<Map<String, Handler>> createDefaultHandlers() {
        return Optional.empty();
    }
}
