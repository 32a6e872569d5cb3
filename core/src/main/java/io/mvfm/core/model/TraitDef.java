package io.mvfm.core.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * A type-directed operation: maps the runtime type of the first operand to the concrete kind that
 * implements the trait for that type.
 */
public record TraitDef(TypeTag output, Map<TypeTag, String> mapping) {

    public TraitDef {
        Objects.requireNonNull(output, "output must not be null");
        Objects.requireNonNull(mapping, "mapping must not be null");
        mapping = mapping.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(mapping));
    }

    public static TraitDef of(TypeTag output, TypeTag type, String kind) {
        return new TraitDef(output, Map.of(type, kind));
    }
}
