package io.mvfm.core.error;

/**
 * Thrown when the fold drains its stack without producing a root value. URN: {@code
 * urn:mvfm:error:root-not-evaluated}
 */
public final class RootNotEvaluatedException extends GraphEvalException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:mvfm:error:root-not-evaluated";

    public RootNotEvaluatedException(String message, String nodeId, String kind) {
        super(message, nodeId, kind);
    }

    public RootNotEvaluatedException(String message, Throwable cause, String nodeId, String kind) {
        super(message, cause, nodeId, kind);
    }
}
