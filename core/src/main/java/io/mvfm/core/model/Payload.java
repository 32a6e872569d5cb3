package io.mvfm.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Auxiliary data carried by a {@link NodeEntry}. Which variant an entry holds depends on its kind
 * family: literals carry their value, access nodes their key, records and tuples the layout of
 * their child identifiers.
 */
public sealed interface Payload {

    /**
     * Returns a payload with every embedded reference to {@code oldId} replaced by {@code newId}.
     */
    default Payload rewire(String oldId, String newId) {
        return this;
    }

    /** Node identifiers embedded in this payload, in layout order. */
    default List<String> embeddedIds() {
        return List.of();
    }

    /** The empty payload. */
    static Payload none() {
        return None.INSTANCE;
    }

    // ── Variants ──

    /** No payload (operation nodes, aliases). */
    enum None implements Payload {
        INSTANCE
    }

    /**
     * A literal scalar, or data injected into a {@code core/input} node.
     *
     * @param value the carried value, may be {@code null} only for an input awaiting injection
     */
    record Literal(Object value) implements Payload {}

    /**
     * The key of a {@code core/access} node.
     *
     * @param key a {@link String} field name or an {@link Integer} index
     */
    record AccessKey(Object key) implements Payload {
        public AccessKey {
            Objects.requireNonNull(key, "key must not be null");
            if (!(key instanceof String) && !(key instanceof Integer)) {
                throw new IllegalArgumentException("access key must be a String or Integer, got: " + key);
            }
        }
    }

    /**
     * Field name to child id layout of a {@code core/record} node. Field order is preserved.
     */
    record RecordLayout(Map<String, String> fields) implements Payload {
        public RecordLayout {
            Objects.requireNonNull(fields, "fields must not be null");
            fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        }

        @Override
        public Payload rewire(String oldId, String newId) {
            if (!fields.containsValue(oldId)) {
                return this;
            }
            Map<String, String> next = new LinkedHashMap<>();
            fields.forEach((name, id) -> next.put(name, id.equals(oldId) ? newId : id));
            return new RecordLayout(next);
        }

        @Override
        public List<String> embeddedIds() {
            return List.copyOf(fields.values());
        }
    }

    /** Index to child id layout of a {@code core/tuple} node. */
    record TupleLayout(List<String> elements) implements Payload {
        public TupleLayout {
            elements = List.copyOf(Objects.requireNonNull(elements, "elements must not be null"));
        }

        @Override
        public Payload rewire(String oldId, String newId) {
            if (!elements.contains(oldId)) {
                return this;
            }
            List<String> next = new ArrayList<>(elements.size());
            for (String id : elements) {
                next.add(id.equals(oldId) ? newId : id);
            }
            return new TupleLayout(next);
        }

        @Override
        public List<String> embeddedIds() {
            return elements;
        }
    }
}
