package io.mvfm.core.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One row of a normalized graph: a kind tag, the ordered identifiers of its children and a
 * {@link Payload}. Entries are immutable; the {@code with*} methods return modified copies.
 *
 * @param kind     node kind, e.g. {@code "num/add"}, or {@code "@alias"} for alias entries
 * @param children child identifiers in positional order
 * @param payload  auxiliary data, {@link Payload#none()} for operation nodes
 */
public record NodeEntry(String kind, List<String> children, Payload payload) {

    /** Kind of alias entries. */
    public static final String ALIAS_KIND = "@alias";

    public NodeEntry {
        Objects.requireNonNull(kind, "kind must not be null");
        children = List.copyOf(Objects.requireNonNull(children, "children must not be null"));
        Objects.requireNonNull(payload, "payload must not be null");
    }

    // ── Factory methods ──

    /** An operation node with no payload. */
    public static NodeEntry of(String kind, List<String> children) {
        return new NodeEntry(kind, children, Payload.none());
    }

    /** An operation node with no payload. */
    public static NodeEntry of(String kind, String... children) {
        return new NodeEntry(kind, List.of(children), Payload.none());
    }

    /** A leaf carrying a literal value. */
    public static NodeEntry literal(String kind, Object value) {
        return new NodeEntry(kind, List.of(), new Payload.Literal(value));
    }

    /** A {@code core/access} node reading {@code key} from {@code parentId}. */
    public static NodeEntry access(String parentId, Object key) {
        return new NodeEntry(ExpressionValue.ACCESS, List.of(parentId), new Payload.AccessKey(key));
    }

    /** A {@code core/tuple} node; the elements are also its children. */
    public static NodeEntry tuple(List<String> elements) {
        return new NodeEntry(ExpressionValue.TUPLE, elements, new Payload.TupleLayout(elements));
    }

    /** A {@code core/record} node; field targets, in field order, are also its children. */
    public static NodeEntry record(Map<String, String> fields) {
        Map<String, String> ordered = new LinkedHashMap<>(fields);
        return new NodeEntry(
                ExpressionValue.RECORD, new ArrayList<>(ordered.values()), new Payload.RecordLayout(ordered));
    }

    /** An alias entry pointing at {@code targetId}. */
    public static NodeEntry alias(String targetId) {
        return new NodeEntry(ALIAS_KIND, List.of(targetId), Payload.none());
    }

    // ── Accessors ──

    /** True for alias entries. */
    public boolean isAlias() {
        return ALIAS_KIND.equals(kind);
    }

    /** True if the entry has no children. */
    public boolean isLeaf() {
        return children.isEmpty();
    }

    /** The literal value, or {@code null} if the payload is not a literal. */
    public Object literalValue() {
        return payload instanceof Payload.Literal literal ? literal.value() : null;
    }

    // ── Copy-with ──

    public NodeEntry withKind(String newKind) {
        return new NodeEntry(newKind, children, payload);
    }

    public NodeEntry withChildren(List<String> newChildren) {
        return new NodeEntry(kind, newChildren, payload);
    }

    public NodeEntry withPayload(Payload newPayload) {
        return new NodeEntry(kind, children, newPayload);
    }

    /**
     * Replaces every reference to {@code oldId}, in the child list and in embedded record/tuple
     * layouts.
     */
    public NodeEntry rewire(String oldId, String newId) {
        if (!children.contains(oldId) && !payload.embeddedIds().contains(oldId)) {
            return this;
        }
        List<String> next = new ArrayList<>(children.size());
        for (String child : children) {
            next.add(child.equals(oldId) ? newId : child);
        }
        return new NodeEntry(kind, next, payload.rewire(oldId, newId));
    }
}
