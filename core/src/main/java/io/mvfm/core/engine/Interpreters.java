package io.mvfm.core.engine;

import io.mvfm.core.error.PluginConfigurationException;
import io.mvfm.core.spi.Handler;
import io.mvfm.core.spi.Plugin;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Composes handler maps from plugins. */
public final class Interpreters {

    private static final Logger LOG = LoggerFactory.getLogger(Interpreters.class);

    private Interpreters() {}

    /**
     * Builds a handler map. For each plugin, in order: an override registered under the plugin's
     * name is used if present; otherwise the plugin's default handlers; a plugin with neither is
     * skipped only when it declares no node kinds. Later plugins replace earlier handlers for the
     * same kind.
     *
     * @param plugins   the plugins, in composition order
     * @param overrides handler maps keyed by plugin name
     * @return an unmodifiable handler map keyed by kind
     * @throws PluginConfigurationException if a plugin declaring node kinds has no handlers
     */
    public static Map<String, Handler> defaults(
            List<? extends Plugin> plugins, Map<String, Map<String, Handler>> overrides) {
        Objects.requireNonNull(plugins, "plugins must not be null");
        Objects.requireNonNull(overrides, "overrides must not be null");
        Map<String, Handler> composed = new HashMap<>();
        for (Plugin plugin : plugins) {
            Map<String, Handler> override = overrides.get(plugin.name());
            if (override != null) {
                LOG.debug("Using override handlers for plugin '{}' ({} kinds)", plugin.name(), override.size());
                composed.putAll(override);
                continue;
            }
            Optional<Map<String, Handler>> defaults = plugin.createDefaultHandlers();
            if (defaults.isPresent()) {
                composed.putAll(defaults.get());
            } else if (!plugin.nodeKinds().isEmpty()) {
                throw new PluginConfigurationException(
                        "Plugin \"" + plugin.name() + "\" has no default handlers and no override", null, null);
            }
        }
        return Collections.unmodifiableMap(composed);
    }
}
