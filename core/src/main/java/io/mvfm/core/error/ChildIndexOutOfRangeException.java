package io.mvfm.core.error;

/**
 * Thrown when a handler requests a positional child beyond its node's child list. URN: {@code
 * urn:mvfm:error:child-index-out-of-range}
 */
public final class ChildIndexOutOfRangeException extends GraphEvalException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:mvfm:error:child-index-out-of-range";

    public ChildIndexOutOfRangeException(String message, String nodeId, String kind) {
        super(message, nodeId, kind);
    }

    public ChildIndexOutOfRangeException(String message, Throwable cause, String nodeId, String kind) {
        super(message, cause, nodeId, kind);
    }
}
