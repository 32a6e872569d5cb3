package io.mvfm.core.engine;

import java.util.Objects;
import java.util.Set;

/**
 * Fold configuration.
 *
 * <p>Immutable and thread-safe.
 *
 * @param volatileKinds kinds whose results are never memoized; every node that consumed a volatile
 *                      value re-evaluates too (default: {@code st/get}, {@code error/caught})
 * @param maxSteps      maximum number of trampoline steps before the fold is aborted
 *                      (default: 10,000,000)
 */
public record FoldOptions(Set<String> volatileKinds, long maxSteps) {

    /** Default volatile kinds. */
    public static final Set<String> DEFAULT_VOLATILE_KINDS = Set.of("st/get", "error/caught");

    /** Default options. */
    public static final FoldOptions DEFAULT = new FoldOptions(DEFAULT_VOLATILE_KINDS, 10_000_000L);

    public FoldOptions {
        volatileKinds = Set.copyOf(Objects.requireNonNull(volatileKinds, "volatileKinds must not be null"));
        if (maxSteps <= 0) {
            throw new IllegalArgumentException("maxSteps must be positive, got: " + maxSteps);
        }
    }

    public FoldOptions withVolatileKinds(Set<String> kinds) {
        return new FoldOptions(kinds, maxSteps);
    }

    public FoldOptions withMaxSteps(long steps) {
        return new FoldOptions(volatileKinds, steps);
    }
}
