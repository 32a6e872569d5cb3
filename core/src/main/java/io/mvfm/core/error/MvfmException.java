package io.mvfm.core.error;

/**
 * Abstract base for all mvfm exceptions. Never thrown directly; use the concrete subclasses under
 * {@link GraphBuildException} or {@link GraphEvalException}.
 */
public abstract class MvfmException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        STRUCTURAL,
        EVALUATION
    }

    private final String nodeId;
    private final String kind;
    private final Phase phase;

    protected MvfmException(String message, String nodeId, String kind, Phase phase) {
        super(message);
        this.nodeId = nodeId;
        this.kind = kind;
        this.phase = phase;
    }

    protected MvfmException(String message, Throwable cause, String nodeId, String kind, Phase phase) {
        super(message, cause);
        this.nodeId = nodeId;
        this.kind = kind;
        this.phase = phase;
    }

    /** The offending node identifier, or {@code null} if no node was allocated yet. */
    public String nodeId() {
        return nodeId;
    }

    /** The offending node kind, or {@code null} if not applicable. */
    public String kind() {
        return kind;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}
