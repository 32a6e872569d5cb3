package io.mvfm.core.dag;

import io.mvfm.core.model.NodeEntry;
import java.util.Map;
import java.util.Objects;

/**
 * A structural match on graph entries, used by {@link GraphRewrites} to select nodes.
 *
 * <p>Implementations are a sealed hierarchy of value records, so predicates compare equal by
 * structure and print readably. Combine them with {@link #and}, {@link #or} and {@link #negate()}.
 *
 * <p>Thread-safe and immutable.
 */
public sealed interface NodePredicate {

    /**
     * Returns {@code true} if the entry matches.
     *
     * @param id        the entry's identifier
     * @param entry     the entry
     * @param adjacency the whole graph, for predicates that look beyond the entry
     */
    boolean test(String id, NodeEntry entry, Map<String, NodeEntry> adjacency);

    default NodePredicate and(NodePredicate other) {
        return new And(this, other);
    }

    default NodePredicate or(NodePredicate other) {
        return new Or(this, other);
    }

    default NodePredicate negate() {
        return new Not(this);
    }

    // ── Factories ──

    static NodePredicate byKind(String kind) {
        return new Kind(kind);
    }

    static NodePredicate byKindPrefix(String prefix) {
        return new KindPrefix(prefix);
    }

    static NodePredicate isLeaf() {
        return Leaf.INSTANCE;
    }

    static NodePredicate hasChildCount(int count) {
        return new ChildCount(count);
    }

    static NodePredicate not(NodePredicate inner) {
        return new Not(inner);
    }

    static NodePredicate and(NodePredicate left, NodePredicate right) {
        return new And(left, right);
    }

    static NodePredicate or(NodePredicate left, NodePredicate right) {
        return new Or(left, right);
    }

    /** Matches the current target of alias {@code @name}. */
    static NodePredicate byName(String name) {
        return new Named(name);
    }

    // ── Implementations ──

    /** Exact kind match. */
    record Kind(String kind) implements NodePredicate {
        public Kind {
            Objects.requireNonNull(kind, "kind must not be null");
        }

        @Override
        public boolean test(String id, NodeEntry entry, Map<String, NodeEntry> adjacency) {
            return entry.kind().equals(kind);
        }
    }

    /** Kind starts with {@code prefix}, e.g. {@code "num/"}. */
    record KindPrefix(String prefix) implements NodePredicate {
        public KindPrefix {
            Objects.requireNonNull(prefix, "prefix must not be null");
        }

        @Override
        public boolean test(String id, NodeEntry entry, Map<String, NodeEntry> adjacency) {
            return entry.kind().startsWith(prefix);
        }
    }

    /** No children. */
    enum Leaf implements NodePredicate {
        INSTANCE;

        @Override
        public boolean test(String id, NodeEntry entry, Map<String, NodeEntry> adjacency) {
            return entry.isLeaf();
        }
    }

    /** Exactly {@code count} children. */
    record ChildCount(int count) implements NodePredicate {
        public ChildCount {
            if (count < 0) {
                throw new IllegalArgumentException("Child count must not be negative, got: " + count);
            }
        }

        @Override
        public boolean test(String id, NodeEntry entry, Map<String, NodeEntry> adjacency) {
            return entry.children().size() == count;
        }
    }

    record Not(NodePredicate inner) implements NodePredicate {
        public Not {
            Objects.requireNonNull(inner, "inner predicate must not be null");
        }

        @Override
        public boolean test(String id, NodeEntry entry, Map<String, NodeEntry> adjacency) {
            return !inner.test(id, entry, adjacency);
        }
    }

    record And(NodePredicate left, NodePredicate right) implements NodePredicate {
        public And {
            Objects.requireNonNull(left, "left predicate must not be null");
            Objects.requireNonNull(right, "right predicate must not be null");
        }

        @Override
        public boolean test(String id, NodeEntry entry, Map<String, NodeEntry> adjacency) {
            return left.test(id, entry, adjacency) && right.test(id, entry, adjacency);
        }
    }

    record Or(NodePredicate left, NodePredicate right) implements NodePredicate {
        public Or {
            Objects.requireNonNull(left, "left predicate must not be null");
            Objects.requireNonNull(right, "right predicate must not be null");
        }

        @Override
        public boolean test(String id, NodeEntry entry, Map<String, NodeEntry> adjacency) {
            return left.test(id, entry, adjacency) || right.test(id, entry, adjacency);
        }
    }

    /** Matches the entry alias {@code @name} currently points at. */
    record Named(String name) implements NodePredicate {
        public Named {
            Objects.requireNonNull(name, "name must not be null");
        }

        @Override
        public boolean test(String id, NodeEntry entry, Map<String, NodeEntry> adjacency) {
            NodeEntry alias = adjacency.get("@" + name);
            return alias != null && alias.isAlias() && alias.children().get(0).equals(id);
        }
    }
}
