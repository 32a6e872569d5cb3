package io.mvfm.core.plugins;

import static io.mvfm.core.model.TypeTag.ANY;
import static io.mvfm.core.model.TypeTag.BOOLEAN;
import static io.mvfm.core.model.TypeTag.RECORD;
import static io.mvfm.core.model.TypeTag.STRING;

import io.mvfm.core.error.GraphEvalException;
import io.mvfm.core.error.NodeFailureException;
import io.mvfm.core.model.ExpressionValue;
import io.mvfm.core.model.KindSpec;
import io.mvfm.core.spi.EvalNode;
import io.mvfm.core.spi.Handler;
import io.mvfm.core.spi.Plugin;
import io.mvfm.core.spi.Step;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Raising and recovering from failures inside a program.
 *
 * <ul>
 *   <li>{@code error/fail(message)} fails the enclosing computation.
 *   <li>{@code error/guard(condition, message)} fails when {@code condition} is false.
 *   <li>{@code error/try(body, handler)} evaluates {@code body}; if it fails, evaluates
 *       {@code handler}, inside which {@code error/caught} yields the failure message.
 *   <li>{@code error/attempt(body)} yields {@code {ok: value, err: null}} or
 *       {@code {ok: null, err: message}}.
 *   <li>{@code error/settle(a, b, ...)} evaluates every argument and yields
 *       {@code {fulfilled: [...], rejected: [...]}}.
 * </ul>
 *
 * <p>Only recoverable failures (handler failures and {@code error/fail}) are caught; structural
 * faults such as a dangling reference still abort the fold.
 */
public final class ErrorPlugin implements Plugin {

    public static final String NAME = "error";

    public static final String TRY = "error/try";
    public static final String CAUGHT = "error/caught";
    public static final String FAIL = "error/fail";
    public static final String GUARD = "error/guard";
    public static final String ATTEMPT = "error/attempt";
    public static final String SETTLE = "error/settle";

    public static final ErrorPlugin INSTANCE = new ErrorPlugin();

    private static final Map<String, KindSpec> KINDS;

    static {
        Map<String, KindSpec> kinds = new LinkedHashMap<>();
        kinds.put(TRY, KindSpec.of(ANY, ANY, ANY));
        kinds.put(CAUGHT, KindSpec.of(STRING));
        kinds.put(FAIL, KindSpec.of(ANY, STRING));
        kinds.put(GUARD, KindSpec.of(ANY, BOOLEAN, STRING));
        kinds.put(ATTEMPT, KindSpec.of(RECORD, ANY));
        kinds.put(SETTLE, KindSpec.of(RECORD));
        KINDS = Collections.unmodifiableMap(kinds);
    }

    private ErrorPlugin() {}

    // ── Constructors ──

    /**
     * Evaluates {@code body}; on failure evaluates the handler built by {@code onFailure}, which
     * receives the {@code error/caught} expression to read the message from.
     */
    public static ExpressionValue tryCatch(Object body, Function<ExpressionValue, Object> onFailure) {
        return ExpressionValue.of(TRY, body, onFailure.apply(caught()));
    }

    public static ExpressionValue caught() {
        return ExpressionValue.of(CAUGHT);
    }

    public static ExpressionValue fail(Object message) {
        return ExpressionValue.of(FAIL, message);
    }

    public static ExpressionValue guard(Object condition, Object message) {
        return ExpressionValue.of(GUARD, condition, message);
    }

    public static ExpressionValue attempt(Object body) {
        return ExpressionValue.of(ATTEMPT, body);
    }

    public static ExpressionValue settle(Object... bodies) {
        return ExpressionValue.of(SETTLE, bodies);
    }

    // ── Plugin ──

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Map<String, KindSpec> kinds() {
        return KINDS;
    }

    @Override
    public Optional<Map<String, Handler>> createDefaultHandlers() {
        // messages of the failures currently being handled, innermost first
        Deque<String> caught = new ArrayDeque<>();
        Map<String, Handler> h = new LinkedHashMap<>();
        h.put(TRY, node -> Step.child(0, Step::done).recover(failure -> {
            caught.push(messageOf(failure));
            return Step.child(1, value -> {
                        caught.pop();
                        return Step.done(value);
                    })
                    .recover(handlerFailure -> {
                        caught.pop();
                        throw handlerFailure;
                    });
        }));
        h.put(CAUGHT, node -> {
            if (caught.isEmpty()) {
                throw new IllegalStateException("error/caught used outside an error/try handler");
            }
            return Step.done(caught.peek());
        });
        h.put(FAIL, node -> Step.child(0, message -> {
            throw new NodeFailureException(Values.show(message), node.id(), node.kind());
        }));
        h.put(GUARD, node -> Step.child(0, condition -> Values.bool(condition)
                ? Step.done(null)
                : Step.child(1, message -> {
                    throw new NodeFailureException(Values.show(message), node.id(), node.kind());
                })));
        h.put(ATTEMPT, node -> Step.child(0, value -> Step.done(outcome(value, null)))
                .recover(failure -> Step.done(outcome(null, messageOf(failure)))));
        h.put(SETTLE, ErrorPlugin::evalSettle);
        return Optional.of(h);
    }

    // ── Handlers ──

    private static Step evalSettle(EvalNode node) {
        return settleFrom(0, node.childCount(), new ArrayList<>(), new ArrayList<>());
    }

    private static Step settleFrom(int index, int count, List<Object> fulfilled, List<Object> rejected) {
        if (index >= count) {
            Map<String, Object> result = new LinkedHashMap<>();
            result.put("fulfilled", fulfilled);
            result.put("rejected", rejected);
            return Step.done(result);
        }
        return Step.child(index, value -> {
                    fulfilled.add(value);
                    return settleFrom(index + 1, count, fulfilled, rejected);
                })
                .recover(failure -> {
                    rejected.add(messageOf(failure));
                    return settleFrom(index + 1, count, fulfilled, rejected);
                });
    }

    private static Map<String, Object> outcome(Object ok, String err) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("ok", ok);
        result.put("err", err);
        return result;
    }

    /**
     * The message a program sees: the text given to {@code error/fail}, or the handler's own error.
     */
    static String messageOf(GraphEvalException failure) {
        if (failure instanceof NodeFailureException) {
            return failure.getMessage();
        }
        Throwable cause = failure.getCause();
        if (cause != null && cause.getMessage() != null) {
            return cause.getMessage();
        }
        return failure.getMessage() == null ? failure.getClass().getSimpleName() : failure.getMessage();
    }
}
