package io.mvfm.core.dag;

import io.mvfm.core.model.NodeEntry;
import io.mvfm.core.model.NormalizedGraph;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Reachability sweeps over an adjacency map. Traversal follows child edges only, uses an explicit
 * stack, and skips identifiers that have no entry.
 */
public final class Reachability {

    private Reachability() {}

    /**
     * Collects the identifiers reachable from {@code rootId}, in depth-first pre-order (children
     * left to right).
     *
     * @param adjacency the adjacency map
     * @param rootId    the start identifier; included even if it has no entry
     * @return the reachable identifiers
     */
    public static Set<String> collectReachable(Map<String, NodeEntry> adjacency, String rootId) {
        Objects.requireNonNull(adjacency, "adjacency must not be null");
        Objects.requireNonNull(rootId, "rootId must not be null");
        return collectReachable(adjacency, List.of(rootId));
    }

    static Set<String> collectReachable(Map<String, NodeEntry> adjacency, List<String> roots) {
        Set<String> visited = new LinkedHashSet<>();
        Deque<String> pending = new ArrayDeque<>();
        for (int i = roots.size() - 1; i >= 0; i--) {
            pending.push(roots.get(i));
        }
        while (!pending.isEmpty()) {
            String id = pending.pop();
            if (!visited.add(id)) {
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
        return visited;
    }

    /**
     * Entries reachable from the root, in the graph's original order. Aliases are dropped unless
     * the root itself reaches them.
     */
    public static Map<String, NodeEntry> liveAdjacency(NormalizedGraph graph) {
        Objects.requireNonNull(graph, "graph must not be null");
        return liveAdjacency(graph.adjacency(), graph.rootId());
    }

    static Map<String, NodeEntry> liveAdjacency(Map<String, NodeEntry> adjacency, String rootId) {
        return retain(adjacency, collectReachable(adjacency, List.of(rootId)));
    }

    /**
     * Entries reachable from the root, plus every alias and the subgraph its target roots, so each
     * {@code @name} still resolves to its original entry after the root moves.
     *
     * <p>The target's own inputs are kept as well, not only the target entry. An unreachable
     * target therefore stays evaluable and the result always passes {@link DirtyGraph#commit()},
     * at the cost of retaining nodes a strict "root plus aliases" sweep would drop.
     */
    public static Map<String, NodeEntry> liveAdjacencyPreservingAliases(NormalizedGraph graph) {
        Objects.requireNonNull(graph, "graph must not be null");
        return liveAdjacencyPreservingAliases(graph.adjacency(), graph.rootId());
    }

    static Map<String, NodeEntry> liveAdjacencyPreservingAliases(Map<String, NodeEntry> adjacency, String rootId) {
        List<String> roots = new ArrayList<>();
        roots.add(rootId);
        adjacency.forEach((id, entry) -> {
            if (entry.isAlias()) {
                roots.add(id);
            }
        });
        return retain(adjacency, collectReachable(adjacency, roots));
    }

    private static Map<String, NodeEntry> retain(Map<String, NodeEntry> adjacency, Set<String> live) {
        Map<String, NodeEntry> result = new LinkedHashMap<>();
        adjacency.forEach((id, entry) -> {
            if (live.contains(id)) {
                result.put(id, entry);
            }
        });
        return result;
    }
}
