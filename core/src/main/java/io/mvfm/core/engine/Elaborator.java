package io.mvfm.core.engine;

import io.mvfm.core.error.TypeMismatchException;
import io.mvfm.core.error.UnknownKindException;
import io.mvfm.core.error.UnliftableValueException;
import io.mvfm.core.error.UnmappedTraitException;
import io.mvfm.core.model.ExpressionValue;
import io.mvfm.core.model.KindSpec;
import io.mvfm.core.model.NodeEntry;
import io.mvfm.core.model.NodeIds;
import io.mvfm.core.model.NormalizedGraph;
import io.mvfm.core.model.TypeTag;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns an {@link ExpressionValue} into a {@link NormalizedGraph} using a composed
 * {@link PluginRegistry}.
 *
 * <p>Children are emitted before their parent (post-order), each emission taking the next
 * identifier from the cursor, so the same expression under the same registry always yields the
 * same identifiers. The traversal uses an explicit work stack; expression depth is bounded only by
 * heap.
 *
 * <p>Elaboration is all-or-nothing: the first structural error aborts the pass and no graph is
 * returned. Instances are stateless and thread-safe.
 */
public final class Elaborator {

    private static final Logger LOG = LoggerFactory.getLogger(Elaborator.class);

    private final PluginRegistry registry;

    public Elaborator(PluginRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
    }

    /** The registry this elaborator resolves kinds against. */
    public PluginRegistry registry() {
        return registry;
    }

    /**
     * Elaborates {@code expr}. The argument may be an expression value or a plain value (scalar,
     * list, map); plain values become a single literal, tuple or record graph.
     *
     * @param expr the program to elaborate
     * @return the normalized graph
     * @throws io.mvfm.core.error.GraphBuildException on unknown kinds, unmapped traits, type
     *     mismatches and unliftable scalars
     */
    public NormalizedGraph elaborate(Object expr) {
        Objects.requireNonNull(expr, "expr must not be null");
        Pass pass = new Pass();
        Emitted root = pass.run(expr);
        LOG.debug("Elaborated {} nodes, root '{}' ({})", pass.entries.size(), root.id, root.type);
        return new NormalizedGraph(root.id, pass.entries, pass.cursor, root.type);
    }

    // ── One elaboration pass ──

    private enum Mode {
        TRAIT,
        KIND,
        ACCESS,
        TUPLE,
        RECORD
    }

    /** A visited node: its identifier and resolved type. */
    private record Emitted(String id, TypeTag type) {}

    /** A composite value whose arguments are being visited. */
    private static final class Frame {
        final Mode mode;
        final String kind;
        final List<Object> args;
        final List<String> fieldNames;
        final KindSpec spec;
        final Object accessKey;
        final List<String> childIds = new ArrayList<>();
        final List<TypeTag> childTypes = new ArrayList<>();
        String resolvedKind;
        int next;

        Frame(Mode mode, String kind, List<Object> args, List<String> fieldNames, KindSpec spec, Object accessKey) {
            this.mode = mode;
            this.kind = kind;
            this.args = args;
            this.fieldNames = fieldNames;
            this.spec = spec;
            this.accessKey = accessKey;
        }

        TypeTag expected(int index) {
            switch (mode) {
                case KIND:
                    return spec.expectedInput(index);
                case TRAIT:
                    return index == 0 ? TypeTag.ANY : childTypes.get(0);
                default:
                    return TypeTag.ANY;
            }
        }
    }

    private final class Pass {
        final Map<String, NodeEntry> entries = new LinkedHashMap<>();
        final Deque<Frame> stack = new ArrayDeque<>();
        String cursor = NodeIds.FIRST;

        Emitted run(Object expr) {
            if (!isComposite(expr)) {
                return lift(expr, TypeTag.ANY, null, 0);
            }
            stack.push(frameFor(expr));
            Emitted result = null;
            while (!stack.isEmpty()) {
                Frame frame = stack.peek();
                if (frame.next < frame.args.size()) {
                    int index = frame.next++;
                    Object arg = frame.args.get(index);
                    if (isComposite(arg)) {
                        stack.push(frameFor(arg));
                    } else {
                        accept(frame, index, lift(arg, frame.expected(index), frame.kind, index));
                    }
                    continue;
                }
                stack.pop();
                Emitted emitted = emit(frame);
                if (stack.isEmpty()) {
                    result = emitted;
                } else {
                    Frame parent = stack.peek();
                    int index = parent.next - 1;
                    TypeTag expected = parent.expected(index);
                    if (!expected.accepts(emitted.type)) {
                        throw new TypeMismatchException(
                                parent.kind + ": expected " + expected + " for arg " + index + ", got " + emitted.type,
                                null,
                                parent.kind);
                    }
                    accept(parent, index, emitted);
                }
            }
            return result;
        }

        private boolean isComposite(Object value) {
            return value instanceof ExpressionValue || value instanceof List<?> || value instanceof Map<?, ?>;
        }

        private Frame frameFor(Object value) {
            if (value instanceof List<?> list) {
                return new Frame(Mode.TUPLE, ExpressionValue.TUPLE, new ArrayList<>(list), null, null, null);
            }
            if (value instanceof Map<?, ?> map) {
                return recordFrame(map);
            }
            ExpressionValue expr = (ExpressionValue) value;
            String kind = expr.kind();
            if (registry.isTrait(kind)) {
                if (expr.arity() == 0) {
                    throw new TypeMismatchException("Trait \"" + kind + "\" requires at least one operand", null, kind);
                }
                return new Frame(Mode.TRAIT, kind, expr.args(), null, null, null);
            }
            if (expr.isAccess()) {
                if (expr.arity() != 2) {
                    throw new TypeMismatchException(
                            kind + ": expected parent and key, got " + expr.arity() + " args", null, kind);
                }
                Object key = expr.args().get(1);
                if (!(key instanceof String) && !(key instanceof Integer)) {
                    throw new TypeMismatchException(kind + ": key must be a string or integer, got " + key, null, kind);
                }
                return new Frame(Mode.ACCESS, kind, List.of(expr.args().get(0)), null, null, key);
            }
            if (ExpressionValue.TUPLE.equals(kind)) {
                // core/tuple(list) wraps a plain list; core/tuple(a, b, ...) lists its own args
                if (expr.arity() == 1 && expr.args().get(0) instanceof List<?> list) {
                    return frameFor(list);
                }
                return new Frame(Mode.TUPLE, kind, expr.args(), null, null, null);
            }
            if (ExpressionValue.RECORD.equals(kind)) {
                if (expr.arity() != 1 || !(expr.args().get(0) instanceof Map<?, ?> map)) {
                    throw new TypeMismatchException(kind + ": expected a single map argument", null, kind);
                }
                return recordFrame(map);
            }
            KindSpec spec = registry.kindSpec(kind)
                    .orElseThrow(() -> new UnknownKindException("Unknown kind \"" + kind + "\"", null, kind));
            return new Frame(Mode.KIND, kind, expr.args(), null, spec, null);
        }

        private Frame recordFrame(Map<?, ?> map) {
            List<String> names = new ArrayList<>(map.size());
            List<Object> values = new ArrayList<>(map.size());
            map.forEach((key, value) -> {
                if (!(key instanceof String name)) {
                    throw new TypeMismatchException(
                            ExpressionValue.RECORD + ": field names must be strings, got " + key,
                            null,
                            ExpressionValue.RECORD);
                }
                if (value == null) {
                    throw new UnliftableValueException(
                            "Cannot lift value of type \"null\" (field '" + name + "')", null, ExpressionValue.RECORD);
                }
                names.add(name);
                values.add(value);
            });
            return new Frame(Mode.RECORD, ExpressionValue.RECORD, values, names, null, null);
        }

        private void accept(Frame frame, int index, Emitted child) {
            frame.childIds.add(child.id);
            frame.childTypes.add(child.type);
            if (frame.mode == Mode.TRAIT && index == 0) {
                String resolved = registry.trait(frame.kind).get(child.type);
                if (resolved == null) {
                    throw new UnmappedTraitException(
                            "No trait \"" + frame.kind + "\" instance for type \"" + child.type + "\"",
                            null,
                            frame.kind);
                }
                frame.resolvedKind = resolved;
            }
        }

        private Emitted lift(Object value, TypeTag expected, String parentKind, int index) {
            TypeTag type = TypeTag.of(value)
                    .orElseThrow(() -> new UnliftableValueException(
                            "Cannot lift value of type \"" + typeName(value) + "\"", null, parentKind));
            String literalKind = registry.liftKind(type)
                    .orElseThrow(() -> new UnliftableValueException(
                            "Cannot lift value of type \"" + type + "\"", null, parentKind));
            if (!expected.accepts(type)) {
                throw new TypeMismatchException(
                        parentKind + ": expected " + expected + " for arg " + index + ", got " + type + " (value: "
                                + value + ")",
                        null,
                        parentKind);
            }
            return add(NodeEntry.literal(literalKind, value), type);
        }

        private Emitted emit(Frame frame) {
            switch (frame.mode) {
                case TRAIT:
                    return add(NodeEntry.of(frame.resolvedKind, frame.childIds), traitOutput(frame));
                case KIND:
                    return add(NodeEntry.of(frame.kind, frame.childIds), frame.spec.output());
                case ACCESS:
                    return add(NodeEntry.access(frame.childIds.get(0), frame.accessKey), TypeTag.ANY);
                case TUPLE:
                    return add(NodeEntry.tuple(frame.childIds), TypeTag.TUPLE);
                case RECORD:
                    Map<String, String> fields = new LinkedHashMap<>();
                    for (int i = 0; i < frame.fieldNames.size(); i++) {
                        fields.put(frame.fieldNames.get(i), frame.childIds.get(i));
                    }
                    return add(NodeEntry.record(fields), TypeTag.RECORD);
                default:
                    throw new IllegalStateException("Unhandled mode: " + frame.mode);
            }
        }

        private TypeTag traitOutput(Frame frame) {
            return registry.kindSpec(frame.resolvedKind)
                    .map(KindSpec::output)
                    .orElseGet(() -> registry.traitOutput(frame.kind));
        }

        private Emitted add(NodeEntry entry, TypeTag type) {
            String id = cursor;
            cursor = NodeIds.increment(cursor);
            entries.put(id, entry);
            return new Emitted(id, type);
        }

        private String typeName(Object value) {
            return value == null ? "null" : value.getClass().getSimpleName();
        }
    }
}
