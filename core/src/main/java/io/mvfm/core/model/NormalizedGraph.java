package io.mvfm.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Canonical program graph: a root identifier, the adjacency map from identifier to
 * {@link NodeEntry}, and the id cursor ({@link #nextId()}, the next identifier a pass would mint).
 *
 * <p>The adjacency map is an unmodifiable, insertion-ordered copy, so two graphs built by the same
 * sequence of operations compare equal and iterate identically. Entries keyed {@code @name} are
 * aliases.
 *
 * <p>Immutable and thread-safe.
 */
public record NormalizedGraph(String rootId, Map<String, NodeEntry> adjacency, String nextId, TypeTag outputType) {

    public NormalizedGraph {
        Objects.requireNonNull(rootId, "rootId must not be null");
        Objects.requireNonNull(adjacency, "adjacency must not be null");
        Objects.requireNonNull(nextId, "nextId must not be null");
        Objects.requireNonNull(outputType, "outputType must not be null");
        adjacency = Collections.unmodifiableMap(new LinkedHashMap<>(adjacency));
    }

    /** Creates a graph whose output type is not known. */
    public NormalizedGraph(String rootId, Map<String, NodeEntry> adjacency, String nextId) {
        this(rootId, adjacency, nextId, TypeTag.ANY);
    }

    /** Looks up an entry by identifier. */
    public Optional<NodeEntry> entry(String id) {
        return Optional.ofNullable(adjacency.get(id));
    }

    /**
     * Looks up an entry, throwing if absent.
     *
     * @throws IllegalArgumentException if no entry exists for {@code id}
     */
    public NodeEntry requireEntry(String id) {
        return entry(id).orElseThrow(() -> new IllegalArgumentException("No node with id: '" + id + "'"));
    }

    /** The root entry. */
    public NodeEntry root() {
        return requireEntry(rootId);
    }

    /** Number of entries, aliases included. */
    public int size() {
        return adjacency.size();
    }

    /** Alias entries keyed by name (without the {@code @} prefix), in definition order. */
    public Map<String, String> aliases() {
        Map<String, String> result = new LinkedHashMap<>();
        adjacency.forEach((key, entry) -> {
            if (key.startsWith("@")) {
                result.put(key.substring(1), entry.children().get(0));
            }
        });
        return Collections.unmodifiableMap(result);
    }

    /** Resolves alias {@code name} to its target identifier. */
    public Optional<String> resolveAlias(String name) {
        NodeEntry alias = adjacency.get("@" + name);
        return alias == null ? Optional.empty() : Optional.of(alias.children().get(0));
    }

    public NormalizedGraph withRoot(String newRootId, TypeTag newOutputType) {
        return new NormalizedGraph(newRootId, adjacency, nextId, newOutputType);
    }
}
