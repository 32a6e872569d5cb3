package io.mvfm.core.error;

/**
 * Abstract parent for fold-time errors. Structural fold faults (dangling reference, missing
 * handler,
 * bad child index, unevaluated root, exhausted budget) abort the fold. Failures raised by handler
 * bodies are {@linkplain #isRecoverable() recoverable}: a handler that suspended with a recover
 * continuation receives them instead of a value.
 */
public abstract class GraphEvalException extends MvfmException {

    private static final long serialVersionUID = 1L;

    protected GraphEvalException(String message, String nodeId, String kind) {
        super(message, nodeId, kind, Phase.EVALUATION);
    }

    protected GraphEvalException(String message, Throwable cause, String nodeId, String kind) {
        super(message, cause, nodeId, kind, Phase.EVALUATION);
    }

    /** Whether a suspended handler may intercept this failure. */
    public boolean isRecoverable() {
        return false;
    }
}
