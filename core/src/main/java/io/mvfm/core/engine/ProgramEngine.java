package io.mvfm.core.engine;

import io.mvfm.core.model.NormalizedGraph;
import io.mvfm.core.plugins.CorePlugin;
import io.mvfm.core.spi.Handler;
import io.mvfm.core.spi.Plugin;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Front door: composes plugins once, then elaborates and folds programs against them.
 *
 * <p>Handler maps are rebuilt for every evaluation, so stateful plugins ({@code st}, {@code error})
 * start each fold with fresh state. Construction composes them once up front, so a plugin with
 * neither default handlers nor an override fails before any program runs.
 *
 * <p>Thread-safe: the registry is immutable and each evaluation owns its handler map.
 */
public final class ProgramEngine {

    private static final Logger LOG = LoggerFactory.getLogger(ProgramEngine.class);

    /** MDC key holding the root id of the graph being folded. */
    public static final String MDC_ROOT = "mvfm.root";

    private final PluginRegistry registry;
    private final Elaborator elaborator;
    private final FoldEngine foldEngine;
    private final Map<String, Map<String, Handler>> overrides;

    /**
     * Creates an engine.
     *
     * @param registry  composed plugins
     * @param options   fold options
     * @param overrides handler overrides keyed by plugin name
     * @throws io.mvfm.core.error.PluginConfigurationException if a plugin has no handlers
     */
    public ProgramEngine(PluginRegistry registry, FoldOptions options, Map<String, Map<String, Handler>> overrides) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.elaborator = new Elaborator(registry);
        this.foldEngine = new FoldEngine(options);
        this.overrides = Map.copyOf(Objects.requireNonNull(overrides, "overrides must not be null"));
        registry.handlers(this.overrides);
    }

    /**
     * Creates an engine over the core plugin followed by {@code plugins}, with default fold options
     * and no overrides.
     */
    public static ProgramEngine create(Plugin... plugins) {
        return create(Arrays.asList(plugins), Map.of());
    }

    /** Creates an engine over the core plugin followed by {@code plugins}. */
    public static ProgramEngine create(List<? extends Plugin> plugins, Map<String, Map<String, Handler>> overrides) {
        List<Plugin> all = new ArrayList<>();
        boolean hasCore = plugins.stream().anyMatch(p -> CorePlugin.NAME.equals(p.name()));
        if (!hasCore) {
            all.add(CorePlugin.INSTANCE);
        }
        all.addAll(plugins);
        return new ProgramEngine(PluginRegistry.compose(all), FoldOptions.DEFAULT, overrides);
    }

    public PluginRegistry registry() {
        return registry;
    }

    /** Elaborates {@code expr} into a normalized graph. */
    public NormalizedGraph compile(Object expr) {
        return elaborator.elaborate(expr);
    }

    /** Folds {@code graph} with freshly composed handlers. */
    public Object evaluate(NormalizedGraph graph) {
        return evaluate(graph, overrides);
    }

    /**
     * Folds {@code graph}, using {@code evalOverrides} in place of the engine's overrides.
     *
     * @param graph         the graph to evaluate
     * @param evalOverrides handler overrides keyed by plugin name
     */
    public Object evaluate(NormalizedGraph graph, Map<String, Map<String, Handler>> evalOverrides) {
        Objects.requireNonNull(graph, "graph must not be null");
        Map<String, Handler> handlers = registry.handlers(evalOverrides);
        MDC.put(MDC_ROOT, graph.rootId());
        try {
            long start = System.nanoTime();
            Object result = foldEngine.fold(graph, handlers);
            LOG.debug(
                    "Evaluated graph of {} nodes in {}us",
                    graph.size(),
                    (System.nanoTime() - start) / 1_000);
            return result;
        } finally {
            MDC.remove(MDC_ROOT);
        }
    }

    /** Elaborates and folds {@code expr}. */
    public Object run(Object expr) {
        return evaluate(compile(expr));
    }
}
