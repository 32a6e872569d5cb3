package io.mvfm.core.error;

/**
 * Wraps an unexpected exception thrown by a handler body (for example a {@link ClassCastException}
 * on a mistyped child value) with the node it was evaluating. Recoverable. URN:
 * {@code urn:mvfm:error:handler-failure}
 */
public final class HandlerFailureException extends GraphEvalException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:mvfm:error:handler-failure";

    public HandlerFailureException(String message, String nodeId, String kind) {
        super(message, nodeId, kind);
    }

    public HandlerFailureException(String message, Throwable cause, String nodeId, String kind) {
        super(message, cause, nodeId, kind);
    }

    @Override
    public boolean isRecoverable() {
        return true;
    }
}
