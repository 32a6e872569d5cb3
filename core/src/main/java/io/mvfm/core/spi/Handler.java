package io.mvfm.core.spi;

/**
 * Evaluates one node kind. A handler is a cooperative routine expressed as explicit
 * continuations: it returns a {@link Step} that either completes the node or requests one child
 * and continues once that child's value is available. Children that are never requested are never
 * evaluated, which is how conditionals short-circuit.
 *
 * <p>Handlers may perform arbitrary work (including I/O) before returning a step; the fold only
 * relies on them eventually completing. A handler may throw: the fold wraps the exception with the
 * node's id and kind.
 */
@FunctionalInterface
public interface Handler {

    /**
     * Starts evaluating {@code node}.
     *
     * @param node the node being evaluated
     * @return the first step
     */
    Step start(EvalNode node);
}
