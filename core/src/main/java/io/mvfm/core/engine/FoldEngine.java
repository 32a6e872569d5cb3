package io.mvfm.core.engine;

import io.mvfm.core.error.ChildIndexOutOfRangeException;
import io.mvfm.core.error.DanglingReferenceException;
import io.mvfm.core.error.FoldBudgetExceededException;
import io.mvfm.core.error.GraphEvalException;
import io.mvfm.core.error.HandlerFailureException;
import io.mvfm.core.error.MissingHandlerException;
import io.mvfm.core.error.RootNotEvaluatedException;
import io.mvfm.core.model.NodeEntry;
import io.mvfm.core.model.NormalizedGraph;
import io.mvfm.core.spi.ChildRef;
import io.mvfm.core.spi.EvalNode;
import io.mvfm.core.spi.Handler;
import io.mvfm.core.spi.Step;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Evaluates a normalized graph against a handler map ("fold").
 *
 * <p>Each in-flight node owns a frame on an explicit stack, so evaluation depth is bounded by heap,
 * not by the native call stack. A frame runs its handler's {@link Step}s until the handler requests
 * a node: a memoized result resumes the handler at once; otherwise a frame for the requested node
 * is
 * pushed and driven to completion first. Nodes that are never requested are never evaluated, and a
 * node reachable from several parents runs its handler once per fold.
 *
 * <p>Results of {@linkplain FoldOptions#volatileKinds() volatile} kinds are not reused. Taint
 * propagates to every node that consumed a volatile (or tainted) value, and tainted nodes
 * re-evaluate when requested again.
 *
 * <p>Failures thrown by handler bodies unwind the stack until a frame whose pending request carries
 * a recover continuation; structural faults abort the fold immediately.
 *
 * <p>Stateless and thread-safe; each fold uses its own stack and memo table.
 */
public final class FoldEngine {

    private static final Logger LOG = LoggerFactory.getLogger(FoldEngine.class);

    private final FoldOptions options;

    public FoldEngine() {
        this(FoldOptions.DEFAULT);
    }

    public FoldEngine(FoldOptions options) {
        this.options = Objects.requireNonNull(options, "options must not be null");
    }

    public FoldOptions options() {
        return options;
    }

    /**
     * Folds {@code graph} from its root.
     *
     * @param graph    the graph to evaluate
     * @param handlers handlers keyed by kind
     * @return the root's value (may be {@code null})
     * @throws GraphEvalException on dangling references, missing handlers, bad child indices, an
     *     exhausted budget, or an unrecovered handler failure
     */
    public Object fold(NormalizedGraph graph, Map<String, Handler> handlers) {
        Objects.requireNonNull(graph, "graph must not be null");
        return fold(graph.rootId(), graph.adjacency(), handlers);
    }

    /** Folds {@code graph} and casts the root value to {@code type}. */
    public <T> T fold(NormalizedGraph graph, Map<String, Handler> handlers, Class<T> type) {
        return type.cast(fold(graph, handlers));
    }

    /**
     * Folds the graph rooted at {@code rootId}.
     *
     * @param rootId    identifier of the node to evaluate
     * @param adjacency identifier to entry map; read-only for the duration of the fold
     * @param handlers  handlers keyed by kind
     * @return the root's value
     */
    public Object fold(String rootId, Map<String, NodeEntry> adjacency, Map<String, Handler> handlers) {
        Objects.requireNonNull(rootId, "rootId must not be null");
        Objects.requireNonNull(adjacency, "adjacency must not be null");
        Objects.requireNonNull(handlers, "handlers must not be null");
        Run run = new Run(adjacency, handlers);
        Object value = run.drive(rootId);
        LOG.debug("Folded root '{}' in {} steps ({} handler invocations)", rootId, run.steps, run.invocations);
        return value;
    }

    // ── One fold ──

    private static final class Frame {
        final String id;
        final NodeEntry entry;
        Step step;
        Step.Request awaiting;
        boolean tainted;

        Frame(String id, NodeEntry entry) {
            this.id = id;
            this.entry = entry;
        }
    }

    private final class Run {
        final Map<String, NodeEntry> adjacency;
        final Map<String, Handler> handlers;
        final Map<String, Object> memo = new HashMap<>();
        final Set<String> tainted = new HashSet<>();
        final Deque<Frame> stack = new ArrayDeque<>();
        GraphEvalException failure;
        long steps;
        long invocations;

        Run(Map<String, NodeEntry> adjacency, Map<String, Handler> handlers) {
            this.adjacency = adjacency;
            this.handlers = handlers;
        }

        Object drive(String rootId) {
            push(rootId);
            while (!stack.isEmpty()) {
                if (++steps > options.maxSteps()) {
                    Frame top = stack.peek();
                    throw new FoldBudgetExceededException(
                            "fold exceeded " + options.maxSteps() + " steps", top.id, top.entry.kind());
                }
                Frame frame = stack.peek();
                if (failure != null) {
                    unwind(frame);
                    continue;
                }
                if (frame.step instanceof Step.Done done) {
                    stack.pop();
                    complete(frame, done.value());
                    continue;
                }
                Step.Request request = (Step.Request) frame.step;
                String childId = resolve(frame, request.ref());
                if (memo.containsKey(childId) && !mustReevaluate(childId)) {
                    Object cached = memo.get(childId);
                    frame.step = advance(frame, () -> request.then().apply(cached));
                    continue;
                }
                frame.awaiting = request;
                frame.step = null;
                push(childId);
            }
            if (failure != null) {
                throw failure;
            }
            if (!memo.containsKey(rootId)) {
                NodeEntry root = adjacency.get(rootId);
                throw new RootNotEvaluatedException(
                        "fold: root \"" + rootId + "\" was not evaluated", rootId, root == null ? null : root.kind());
            }
            return memo.get(rootId);
        }

        private void push(String id) {
            NodeEntry entry = adjacency.get(id);
            if (entry == null) {
                Frame requester = stack.peek();
                throw new DanglingReferenceException(
                        "fold: missing node \"" + id + "\""
                                + (requester == null ? "" : " (requested by \"" + requester.id + "\")"),
                        id,
                        null);
            }
            Handler handler = handlers.get(entry.kind());
            if (handler == null) {
                throw new MissingHandlerException(
                        "fold: no handler for \"" + entry.kind() + "\" (node \"" + id + "\")", id, entry.kind());
            }
            if (LOG.isTraceEnabled()) {
                LOG.trace("push '{}' ({}) depth={}", id, entry.kind(), stack.size());
            }
            Frame frame = new Frame(id, entry);
            stack.push(frame);
            invocations++;
            frame.step = advance(frame, () -> handler.start(new EvalNode(id, entry)));
        }

        private void complete(Frame frame, Object value) {
            memo.put(frame.id, value);
            if (frame.tainted || options.volatileKinds().contains(frame.entry.kind())) {
                tainted.add(frame.id);
            }
            Frame parent = stack.peek();
            if (parent == null) {
                return;
            }
            if (tainted.contains(frame.id)) {
                parent.tainted = true;
            }
            Step.Request request = parent.awaiting;
            parent.awaiting = null;
            parent.step = advance(parent, () -> request.then().apply(value));
        }

        private void unwind(Frame frame) {
            Step.Request request = frame.awaiting;
            if (request != null && request.recover() != null && failure.isRecoverable()) {
                GraphEvalException caught = failure;
                failure = null;
                frame.awaiting = null;
                LOG.debug("Node '{}' ({}) recovers from: {}", frame.id, frame.entry.kind(), caught.getMessage());
                frame.step = advance(frame, () -> request.recover().apply(caught));
                return;
            }
            stack.pop();
        }

        private String resolve(Frame frame, ChildRef ref) {
            if (ref instanceof ChildRef.Index index) {
                int i = index.index();
                if (i < 0 || i >= frame.entry.children().size()) {
                    throw new ChildIndexOutOfRangeException(
                            "fold: node \"" + frame.id + "\" (" + frame.entry.kind() + ") has no child at index " + i,
                            frame.id,
                            frame.entry.kind());
                }
                return frame.entry.children().get(i);
            }
            String id = ((ChildRef.NodeId) ref).nodeId();
            // follow aliases to their target; bounded in case of an alias cycle
            for (int hops = 0; hops <= adjacency.size(); hops++) {
                NodeEntry entry = adjacency.get(id);
                if (entry == null || !entry.isAlias()) {
                    return id;
                }
                id = entry.children().get(0);
            }
            throw new DanglingReferenceException("fold: alias cycle at \"" + id + "\"", id, NodeEntry.ALIAS_KIND);
        }

        private boolean mustReevaluate(String id) {
            if (tainted.contains(id)) {
                return true;
            }
            NodeEntry entry = adjacency.get(id);
            return entry != null && options.volatileKinds().contains(entry.kind());
        }

        /**
         * Runs handler code for {@code frame}; a thrown failure is recorded and unwinds from here.
         */
        private Step advance(Frame frame, Supplier<Step> body) {
            try {
                Step next = body.get();
                if (next == null) {
                    throw new IllegalStateException("handler returned no step");
                }
                return next;
            } catch (GraphEvalException e) {
                if (!e.isRecoverable()) {
                    throw e;
                }
                failure = e;
            } catch (RuntimeException e) {
                failure = new HandlerFailureException(
                        "fold: handler for \"" + frame.entry.kind() + "\" failed at node \"" + frame.id + "\": "
                                + e.getMessage(),
                        e,
                        frame.id,
                        frame.entry.kind());
            }
            return null;
        }
    }
}
