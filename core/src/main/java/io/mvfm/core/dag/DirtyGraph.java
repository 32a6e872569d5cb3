package io.mvfm.core.dag;

import io.mvfm.core.error.GraphIntegrityException;
import io.mvfm.core.model.NodeEntry;
import io.mvfm.core.model.NodeIds;
import io.mvfm.core.model.NormalizedGraph;
import io.mvfm.core.model.TypeTag;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * An uncommitted graph under edit. Kept apart from {@link NormalizedGraph} so that partially
 * rewired state cannot be folded by accident: the only way back is {@link #commit()}, which checks
 * integrity.
 *
 * <p>Every operation returns a new instance over a fresh copy of the adjacency map; the source
 * graph and earlier instances are never modified.
 */
public final class DirtyGraph {

    private final String rootId;
    private final Map<String, NodeEntry> adjacency;
    private final String nextId;
    private final TypeTag outputType;

    private DirtyGraph(String rootId, Map<String, NodeEntry> adjacency, String nextId, TypeTag outputType) {
        this.rootId = rootId;
        this.adjacency = adjacency;
        this.nextId = nextId;
        this.outputType = outputType;
    }

    /** Opens {@code graph} for editing. */
    public static DirtyGraph of(NormalizedGraph graph) {
        Objects.requireNonNull(graph, "graph must not be null");
        return new DirtyGraph(
                graph.rootId(), new LinkedHashMap<>(graph.adjacency()), graph.nextId(), graph.outputType());
    }

    /**
     * Result of {@link #allocateId()}: the minted identifier and the graph with the advanced
     * cursor.
     */
    public record Allocation(String id, DirtyGraph graph) {}

    // ── Accessors ──

    public String rootId() {
        return rootId;
    }

    public String nextId() {
        return nextId;
    }

    public TypeTag outputType() {
        return outputType;
    }

    /** Unmodifiable view of the current entries. */
    public Map<String, NodeEntry> adjacency() {
        return Collections.unmodifiableMap(adjacency);
    }

    public Optional<NodeEntry> entry(String id) {
        return Optional.ofNullable(adjacency.get(id));
    }

    public boolean contains(String id) {
        return adjacency.containsKey(id);
    }

    // ── Edits ──

    /**
     * Adds a new entry.
     *
     * @throws IllegalArgumentException if {@code id} is already present
     */
    public DirtyGraph addEntry(String id, NodeEntry entry) {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(entry, "entry must not be null");
        if (adjacency.containsKey(id)) {
            throw new IllegalArgumentException("addEntry: node '" + id + "' already exists");
        }
        Map<String, NodeEntry> next = copy();
        next.put(id, entry);
        return with(next);
    }

    /**
     * Removes an entry; a no-op if absent. References to it are left for {@link #commit()} to
     * catch.
     */
    public DirtyGraph removeEntry(String id) {
        Objects.requireNonNull(id, "id must not be null");
        Map<String, NodeEntry> next = copy();
        next.remove(id);
        return with(next);
    }

    /**
     * Replaces the entry under an existing identifier.
     *
     * @throws IllegalArgumentException if {@code id} is absent
     */
    public DirtyGraph swapEntry(String id, NodeEntry entry) {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(entry, "entry must not be null");
        if (!adjacency.containsKey(id)) {
            throw new IllegalArgumentException("swapEntry: no node '" + id + "'");
        }
        Map<String, NodeEntry> next = copy();
        next.put(id, entry);
        return with(next);
    }

    /**
     * Replaces every reference to {@code oldId} with {@code newId}, in child lists, record and
     * tuple
     * layouts and alias targets. The root is not changed; use {@link #setRoot(String)}.
     */
    public DirtyGraph rewire(String oldId, String newId) {
        Objects.requireNonNull(oldId, "oldId must not be null");
        Objects.requireNonNull(newId, "newId must not be null");
        Map<String, NodeEntry> next = new LinkedHashMap<>();
        adjacency.forEach((id, entry) -> next.put(id, entry.rewire(oldId, newId)));
        return with(next);
    }

    public DirtyGraph setRoot(String newRootId) {
        Objects.requireNonNull(newRootId, "newRootId must not be null");
        return new DirtyGraph(newRootId, copy(), nextId, outputType);
    }

    public DirtyGraph withOutputType(TypeTag newOutputType) {
        Objects.requireNonNull(newOutputType, "newOutputType must not be null");
        return new DirtyGraph(rootId, copy(), nextId, newOutputType);
    }

    public DirtyGraph withNextId(String newNextId) {
        Objects.requireNonNull(newNextId, "newNextId must not be null");
        return new DirtyGraph(rootId, copy(), newNextId, outputType);
    }

    /** Mints the cursor's identifier and advances the cursor. */
    public Allocation allocateId() {
        return new Allocation(nextId, withNextId(NodeIds.increment(nextId)));
    }

    /** Drops every entry, aliases included, that the root does not reach. */
    public DirtyGraph gc() {
        return with(Reachability.liveAdjacency(adjacency, rootId));
    }

    /** Like {@link #gc()}, but keeps every alias and the entries its target reaches. */
    public DirtyGraph gcPreservingAliases() {
        return with(Reachability.liveAdjacencyPreservingAliases(adjacency, rootId));
    }

    /**
     * Validates and freezes the edits.
     *
     * @return the committed graph
     * @throws GraphIntegrityException if the root is missing or an entry references a missing node
     */
    public NormalizedGraph commit() {
        validate(rootId, adjacency, "commit");
        return new NormalizedGraph(rootId, adjacency, nextId, outputType);
    }

    /**
     * Checks that the root exists, that every child and layout reference resolves, and that alias
     * entries are well formed: an {@code @}-prefixed key holds an alias entry with exactly one
     * child, and an alias entry sits only under such a key.
     *
     * @param operation prefix for error messages, e.g. {@code "commit"}
     * @throws GraphIntegrityException on the first broken reference or malformed alias
     */
    public static void validate(String rootId, Map<String, NodeEntry> adjacency, String operation) {
        if (!adjacency.containsKey(rootId)) {
            throw new GraphIntegrityException(operation + ": root \"" + rootId + "\" not in adjacency", rootId, null);
        }
        adjacency.forEach((id, entry) -> {
            checkAliasShape(id, entry, operation);
            for (String child : entry.children()) {
                if (!adjacency.containsKey(child)) {
                    throw new GraphIntegrityException(
                            operation + ": node \"" + id + "\" references missing child \"" + child + "\"",
                            id,
                            entry.kind());
                }
            }
            for (String embedded : entry.payload().embeddedIds()) {
                if (!adjacency.containsKey(embedded)) {
                    throw new GraphIntegrityException(
                            operation + ": node \"" + id + "\" layout references missing node \"" + embedded + "\"",
                            id,
                            entry.kind());
                }
            }
        });
    }

    private static void checkAliasShape(String id, NodeEntry entry, String operation) {
        boolean aliasKey = id.startsWith("@");
        if (aliasKey && !entry.isAlias()) {
            throw new GraphIntegrityException(
                    operation + ": key \"" + id + "\" must hold an " + NodeEntry.ALIAS_KIND + " entry",
                    id,
                    entry.kind());
        }
        if (!aliasKey && entry.isAlias()) {
            throw new GraphIntegrityException(
                    operation + ": alias entry \"" + id + "\" must be keyed by an @-prefixed name", id, entry.kind());
        }
        if (aliasKey && entry.children().size() != 1) {
            throw new GraphIntegrityException(
                    operation + ": alias \"" + id + "\" must have exactly one child, has "
                            + entry.children().size(),
                    id,
                    entry.kind());
        }
    }

    private Map<String, NodeEntry> copy() {
        return new LinkedHashMap<>(adjacency);
    }

    private DirtyGraph with(Map<String, NodeEntry> next) {
        return new DirtyGraph(rootId, next, nextId, outputType);
    }

    @Override
    public String toString() {
        return "DirtyGraph[root=" + rootId + ", size=" + adjacency.size() + ", nextId=" + nextId + "]";
    }
}
