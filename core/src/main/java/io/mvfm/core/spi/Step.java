package io.mvfm.core.spi;

import io.mvfm.core.error.GraphEvalException;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * What a {@link Handler} asks the fold to do next. A handler either completes with a value or
 * suspends on exactly one child request, supplying the continuation to run once the child's value
 * is known. Continuations return the next step, so a handler that reads several children is a
 * chain of requests:
 *
 * <pre>{@code
 * node -> Step.child(0, a -> Step.child(1, b -> Step.done(num(a) + num(b))))
 * }</pre>
 *
 * <p>The fold drives steps from an explicit stack; continuations never run nested inside one
 * another, so long chains do not grow the native call stack.
 */
public sealed interface Step {

    /** Completes the node with {@code value} ({@code null} allowed). */
    static Step done(Object value) {
        return new Done(value);
    }

    /** Suspends until positional child {@code index} is evaluated. */
    static Request child(int index, Function<Object, Step> then) {
        return new Request(new ChildRef.Index(index), then, null);
    }

    /** Suspends until node {@code nodeId} is evaluated. */
    static Request node(String nodeId, Function<Object, Step> then) {
        return new Request(new ChildRef.NodeId(nodeId), then, null);
    }

    /**
     * Evaluates positional children {@code from} (inclusive) to {@code count} (exclusive) in order,
     * passing each value to {@code each}, then runs {@code after}.
     */
    static Step eachChild(int from, int count, Consumer<Object> each, Supplier<Step> after) {
        if (from >= count) {
            return after.get();
        }
        return child(from, value -> {
            each.accept(value);
            return eachChild(from + 1, count, each, after);
        });
    }

    // ── Variants ──

    /** Node completed. */
    record Done(Object value) implements Step {}

    /**
     * Node suspended on {@code ref}.
     *
     * @param ref     the node to evaluate
     * @param then    continuation receiving the evaluated value
     * @param recover continuation receiving a recoverable failure of the requested node, or
     *                {@code null} to let failures propagate
     */
    record Request(ChildRef ref, Function<Object, Step> then, Function<GraphEvalException, Step> recover)
            implements Step {

        public Request {
            Objects.requireNonNull(ref, "ref must not be null");
            Objects.requireNonNull(then, "then must not be null");
        }

        /**
         * Returns a copy of this request that intercepts recoverable failures with {@code
         * onFailure}.
         */
        public Request recover(Function<GraphEvalException, Step> onFailure) {
            return new Request(ref, then, Objects.requireNonNull(onFailure, "onFailure must not be null"));
        }
    }
}
