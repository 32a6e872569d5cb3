package io.mvfm.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Declared signature of a node kind: the expected type of each positional input and the output
 * type. Arguments past the end of {@code inputs} are unchecked, which is how variadic kinds
 * ({@code str/concat}, {@code core/begin}) are declared.
 */
public record KindSpec(List<TypeTag> inputs, TypeTag output) {

    public KindSpec {
        inputs = List.copyOf(Objects.requireNonNull(inputs, "inputs must not be null"));
        Objects.requireNonNull(output, "output must not be null");
    }

    public static KindSpec of(TypeTag output, TypeTag... inputs) {
        return new KindSpec(List.of(inputs), output);
    }

    /** Expected type of argument {@code index}; {@link TypeTag#ANY} beyond the declared inputs. */
    public TypeTag expectedInput(int index) {
        return index < inputs.size() ? inputs.get(index) : TypeTag.ANY;
    }
}
