package io.mvfm.core.model;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runtime type tags used by lift mappings, trait tables and kind specifications.
 *
 * <p>{@link #ANY} is the open tag: as an expected input it accepts every argument, and a node whose
 * declared output is {@code ANY} is accepted in every position (its value is checked by the
 * handler at fold time).
 */
public enum TypeTag {
    NUMBER("number"),
    STRING("string"),
    BOOLEAN("boolean"),
    RECORD("record"),
    TUPLE("tuple"),
    ANY("any");

    private final String wireName;

    TypeTag(String wireName) {
        this.wireName = wireName;
    }

    /** Lowercase name used in error messages and graph documents. */
    public String wireName() {
        return wireName;
    }

    /**
     * Returns {@code true} if a value of type {@code actual} may stand where this type is expected.
     */
    public boolean accepts(TypeTag actual) {
        return this == ANY || actual == ANY || this == actual;
    }

    /**
     * Classifies a plain value.
     *
     * @return the tag, or empty for values with no tag (null, arbitrary objects)
     */
    public static Optional<TypeTag> of(Object value) {
        if (value instanceof Number) return Optional.of(NUMBER);
        if (value instanceof CharSequence) return Optional.of(STRING);
        if (value instanceof Boolean) return Optional.of(BOOLEAN);
        if (value instanceof List<?>) return Optional.of(TUPLE);
        if (value instanceof Map<?, ?>) return Optional.of(RECORD);
        return Optional.empty();
    }

    /**
     * Parses a wire name.
     *
     * @throws IllegalArgumentException for unknown names
     */
    public static TypeTag fromWireName(String name) {
        return Arrays.stream(values())
                .filter(t -> t.wireName.equals(name))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown type tag: '" + name + "'"));
    }

    @Override
    public String toString() {
        return wireName;
    }
}
