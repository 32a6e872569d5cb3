package io.mvfm.core.dag;

import io.mvfm.core.engine.PluginRegistry;
import io.mvfm.core.error.GraphIntegrityException;
import io.mvfm.core.model.NodeEntry;
import io.mvfm.core.model.NodeIds;
import io.mvfm.core.model.NormalizedGraph;
import io.mvfm.core.model.Payload;
import io.mvfm.core.model.TypeTag;
import io.mvfm.core.plugins.CorePlugin;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Predicate-driven queries and structural rewrites over committed graphs. Every operation takes a
 * {@link NormalizedGraph} and returns a new, integrity-checked one; inputs are never modified.
 *
 * <p>Predicates never select alias entries: aliases are names, not nodes. Rewrites that move
 * references leave alias targets alone unless stated otherwise.
 */
public final class GraphRewrites {

    private static final Logger LOG = LoggerFactory.getLogger(GraphRewrites.class);

    private GraphRewrites() {}

    // ── Queries ──

    /**
     * Identifiers of the non-alias entries matching {@code predicate}, in identifier order
     * (shorter first, then alphabetical).
     */
    public static SortedSet<String> selectWhere(NormalizedGraph graph, NodePredicate predicate) {
        Objects.requireNonNull(graph, "graph must not be null");
        Objects.requireNonNull(predicate, "predicate must not be null");
        SortedSet<String> matched = new TreeSet<>(NodeIds::compare);
        graph.adjacency().forEach((id, entry) -> {
            if (!entry.isAlias() && predicate.test(id, entry, graph.adjacency())) {
                matched.add(id);
            }
        });
        return Collections.unmodifiableSortedSet(matched);
    }

    // ── Content rewrites ──

    /**
     * Replaces every matching entry with {@code transform} of it. If the root is replaced the
     * output type becomes {@link TypeTag#ANY}; use the registry overload to recompute it.
     */
    public static NormalizedGraph mapWhere(
            NormalizedGraph graph, NodePredicate predicate, UnaryOperator<NodeEntry> transform) {
        return mapWhere(graph, predicate, transform, null);
    }

    /**
     * Replaces every matching entry with {@code transform} of it. If the root is replaced the
     * output type is recomputed from the new root kind's declaration in {@code registry}.
     *
     * @throws GraphIntegrityException if a transformed entry references a missing node
     */
    public static NormalizedGraph mapWhere(
            NormalizedGraph graph,
            NodePredicate predicate,
            UnaryOperator<NodeEntry> transform,
            PluginRegistry registry) {
        Objects.requireNonNull(transform, "transform must not be null");
        Set<String> matched = selectWhere(graph, predicate);
        Map<String, NodeEntry> next = new LinkedHashMap<>();
        graph.adjacency().forEach((id, entry) -> next.put(
                id,
                matched.contains(id)
                        ? Objects.requireNonNull(transform.apply(entry), "transform returned null")
                        : entry));
        TypeTag outputType = graph.outputType();
        if (matched.contains(graph.rootId())) {
            String rootKind = next.get(graph.rootId()).kind();
            outputType = registry == null ? TypeTag.ANY : registry.outputOf(rootKind);
        }
        LOG.debug("mapWhere replaced {} of {} entries", matched.size(), graph.size());
        return checked(graph.rootId(), next, graph.nextId(), outputType, "mapWhere");
    }

    /** Changes the kind of every matching entry, keeping children and payload. */
    public static NormalizedGraph replaceWhere(NormalizedGraph graph, NodePredicate predicate, String newKind) {
        Objects.requireNonNull(newKind, "newKind must not be null");
        return mapWhere(graph, predicate, entry -> entry.withKind(newKind));
    }

    /**
     * Swaps the content of one node.
     *
     * @throws IllegalArgumentException if {@code id} is absent
     * @throws GraphIntegrityException  if {@code entry} references a missing node
     */
    public static NormalizedGraph replace(NormalizedGraph graph, String id, NodeEntry entry) {
        DirtyGraph dirty = DirtyGraph.of(graph).swapEntry(id, entry);
        if (id.equals(graph.rootId())) {
            dirty = dirty.withOutputType(TypeTag.ANY);
        }
        return dirty.commit();
    }

    /** Replaces the payload of every {@code core/input} entry with {@code data}. */
    public static NormalizedGraph injectInput(NormalizedGraph graph, Object data) {
        NormalizedGraph injected = mapWhere(
                graph, NodePredicate.byKind(CorePlugin.INPUT), entry -> entry.withPayload(new Payload.Literal(data)));
        return injected.withRoot(graph.rootId(), graph.outputType());
    }

    // ── Structural rewrites ──

    /**
     * Removes every matching entry and splices its children, in order, into each parent's child
     * list in its place. Children that are themselves removed are spliced through recursively.
     * A removed root is replaced by its first surviving child; an alias whose target is removed
     * follows the same rule, and is dropped if nothing survives.
     *
     * @throws GraphIntegrityException if the root is removed and has no surviving child, or a
     *     record field would map to other than exactly one node
     */
    public static NormalizedGraph spliceWhere(NormalizedGraph graph, NodePredicate predicate) {
        Set<String> matched = selectWhere(graph, predicate);
        if (matched.isEmpty()) {
            return graph;
        }
        Map<String, NodeEntry> adjacency = graph.adjacency();
        Map<String, NodeEntry> next = new LinkedHashMap<>();
        adjacency.forEach((id, entry) -> {
            if (matched.contains(id)) {
                return;
            }
            List<String> children = spliceThrough(entry.children(), adjacency, matched);
            if (entry.isAlias()) {
                if (!children.isEmpty()) {
                    next.put(id, NodeEntry.alias(children.get(0)));
                }
                return;
            }
            next.put(id, new NodeEntry(entry.kind(), children, splicePayload(id, entry, adjacency, matched, children)));
        });

        String rootId = graph.rootId();
        TypeTag outputType = graph.outputType();
        if (matched.contains(rootId)) {
            List<String> promoted = spliceThrough(List.of(rootId), adjacency, matched);
            if (promoted.isEmpty()) {
                throw new GraphIntegrityException(
                        "spliceWhere: root \"" + rootId + "\" is removed and has no child to promote",
                        rootId,
                        adjacency.get(rootId).kind());
            }
            rootId = promoted.get(0);
            outputType = TypeTag.ANY;
        }
        LOG.debug("spliceWhere removed {} entries, root '{}'", matched.size(), rootId);
        return checked(rootId, next, graph.nextId(), outputType, "spliceWhere");
    }

    /**
     * Inserts a new {@code wrapperKind} node above {@code targetId}: every parent of the target
     * now points at the wrapper, whose single child is the target. The wrapper takes the cursor's
     * identifier. Aliases keep pointing at the target. If the target was the root, the wrapper
     * becomes the root.
     *
     * @throws IllegalArgumentException if {@code targetId} is absent or the cursor's identifier is
     *     already taken
     */
    public static NormalizedGraph wrap(NormalizedGraph graph, String targetId, String wrapperKind) {
        Objects.requireNonNull(wrapperKind, "wrapperKind must not be null");
        requireNode(graph, targetId, "wrap");
        String wrapperId = graph.nextId();
        if (graph.adjacency().containsKey(wrapperId)) {
            throw new IllegalArgumentException("wrap: identifier '" + wrapperId + "' is already in use");
        }
        Map<String, NodeEntry> next = new LinkedHashMap<>();
        graph.adjacency().forEach((id, entry) ->
                next.put(id, entry.isAlias() ? entry : entry.rewire(targetId, wrapperId)));
        next.put(wrapperId, NodeEntry.of(wrapperKind, targetId));
        boolean wrapsRoot = targetId.equals(graph.rootId());
        return checked(
                wrapsRoot ? wrapperId : graph.rootId(),
                next,
                NodeIds.increment(wrapperId),
                wrapsRoot ? TypeTag.ANY : graph.outputType(),
                "wrap");
    }

    /**
     * Binds {@code @name} to {@code targetId}, replacing any earlier binding. Consumes no
     * identifier.
     *
     * @throws IllegalArgumentException if {@code targetId} is absent or is itself an alias
     */
    public static NormalizedGraph name(NormalizedGraph graph, String name, String targetId) {
        Objects.requireNonNull(name, "name must not be null");
        NodeEntry target = requireNode(graph, targetId, "name");
        if (target.isAlias()) {
            throw new IllegalArgumentException("name: target '" + targetId + "' is an alias");
        }
        Map<String, NodeEntry> next = new LinkedHashMap<>(graph.adjacency());
        next.put("@" + name, NodeEntry.alias(targetId));
        return new NormalizedGraph(graph.rootId(), next, graph.nextId(), graph.outputType());
    }

    /**
     * Replaces the subgraph at {@code targetId} with a copy of {@code replacement}. The copy's
     * entries get fresh identifiers from the cursor, in the replacement's order; every reference
     * to the target (aliases included) then points at the copy's root, and the sweep drops what
     * is no longer reachable while keeping aliases.
     *
     * @throws IllegalArgumentException if {@code targetId} is absent
     */
    public static NormalizedGraph graft(NormalizedGraph graph, String targetId, NormalizedGraph replacement) {
        Objects.requireNonNull(replacement, "replacement must not be null");
        requireNode(graph, targetId, "graft");

        Map<String, String> fresh = new LinkedHashMap<>();
        String cursor = graph.nextId();
        for (Map.Entry<String, NodeEntry> e : replacement.adjacency().entrySet()) {
            if (!e.getValue().isAlias()) {
                fresh.put(e.getKey(), cursor);
                cursor = NodeIds.increment(cursor);
            }
        }
        String copiedRoot = fresh.get(replacement.rootId());
        if (copiedRoot == null) {
            throw new GraphIntegrityException(
                    "graft: replacement root \"" + replacement.rootId() + "\" not in adjacency",
                    replacement.rootId(),
                    null);
        }

        DirtyGraph dirty = DirtyGraph.of(graph).rewire(targetId, copiedRoot);
        for (Map.Entry<String, NodeEntry> e : replacement.adjacency().entrySet()) {
            if (!e.getValue().isAlias()) {
                dirty = dirty.addEntry(fresh.get(e.getKey()), remap(e.getValue(), fresh));
            }
        }
        dirty = dirty.withNextId(cursor);
        if (targetId.equals(graph.rootId())) {
            dirty = dirty.setRoot(copiedRoot).withOutputType(replacement.outputType());
        }
        LOG.debug("graft replaced '{}' with {} entries rooted at '{}'", targetId, fresh.size(), copiedRoot);
        return dirty.gcPreservingAliases().commit();
    }

    // ── Helpers ──

    private static NodeEntry requireNode(NormalizedGraph graph, String id, String operation) {
        Objects.requireNonNull(id, "id must not be null");
        NodeEntry entry = graph.adjacency().get(id);
        if (entry == null) {
            throw new IllegalArgumentException(operation + ": no node '" + id + "'");
        }
        return entry;
    }

    private static NormalizedGraph checked(
            String rootId, Map<String, NodeEntry> adjacency, String nextId, TypeTag outputType, String operation) {
        DirtyGraph.validate(rootId, adjacency, operation);
        return new NormalizedGraph(rootId, adjacency, nextId, outputType);
    }

    /** Expands removed identifiers into their surviving descendants, preserving order. */
    private static List<String> spliceThrough(List<String> ids, Map<String, NodeEntry> adjacency, Set<String> removed) {
        List<String> result = new ArrayList<>();
        Deque<String> pending = new ArrayDeque<>();
        for (int i = ids.size() - 1; i >= 0; i--) {
            pending.push(ids.get(i));
        }
        while (!pending.isEmpty()) {
            String id = pending.pop();
            if (!removed.contains(id)) {
                result.add(id);
                continue;
            }
            NodeEntry entry = adjacency.get(id);
            if (entry == null) {
                continue;
            }
            List<String> children = entry.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                pending.push(children.get(i));
            }
        }
        return result;
    }

    private static Payload splicePayload(
            String id, NodeEntry entry, Map<String, NodeEntry> adjacency, Set<String> removed, List<String> children) {
        Payload payload = entry.payload();
        if (payload instanceof Payload.TupleLayout) {
            return new Payload.TupleLayout(children);
        }
        if (payload instanceof Payload.RecordLayout layout) {
            Map<String, String> fields = new LinkedHashMap<>();
            layout.fields().forEach((field, target) -> {
                List<String> resolved = spliceThrough(List.of(target), adjacency, removed);
                if (resolved.size() != 1) {
                    throw new GraphIntegrityException(
                            "spliceWhere: field '" + field + "' of record \"" + id + "\" would map to "
                                    + resolved.size() + " nodes",
                            id,
                            entry.kind());
                }
                fields.put(field, resolved.get(0));
            });
            return new Payload.RecordLayout(fields);
        }
        return payload;
    }

    /** Rewrites every reference in {@code entry} through {@code mapping} in one pass. */
    private static NodeEntry remap(NodeEntry entry, Map<String, String> mapping) {
        List<String> children = new ArrayList<>(entry.children().size());
        for (String child : entry.children()) {
            children.add(mapping.getOrDefault(child, child));
        }
        Payload payload = entry.payload();
        if (payload instanceof Payload.TupleLayout tuple) {
            List<String> elements = new ArrayList<>();
            for (String element : tuple.elements()) {
                elements.add(mapping.getOrDefault(element, element));
            }
            payload = new Payload.TupleLayout(elements);
        } else if (payload instanceof Payload.RecordLayout record) {
            Map<String, String> fields = new LinkedHashMap<>();
            record.fields().forEach((field, target) -> fields.put(field, mapping.getOrDefault(target, target)));
            payload = new Payload.RecordLayout(fields);
        }
        return new NodeEntry(entry.kind(), children, payload);
    }
}
