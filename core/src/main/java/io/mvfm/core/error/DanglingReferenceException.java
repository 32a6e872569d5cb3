package io.mvfm.core.error;

/**
 * Thrown when the fold reaches an identifier absent from the adjacency map. URN: {@code
 * urn:mvfm:error:dangling-reference}
 */
public final class DanglingReferenceException extends GraphEvalException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:mvfm:error:dangling-reference";

    public DanglingReferenceException(String message, String nodeId, String kind) {
        super(message, nodeId, kind);
    }

    public DanglingReferenceException(String message, Throwable cause, String nodeId, String kind) {
        super(message, cause, nodeId, kind);
    }
}
