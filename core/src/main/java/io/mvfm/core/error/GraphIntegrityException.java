package io.mvfm.core.error;

/**
 * Thrown when a graph references a missing root or child. URN: {@code
 * urn:mvfm:error:graph-integrity}
 */
public final class GraphIntegrityException extends GraphBuildException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:mvfm:error:graph-integrity";

    public GraphIntegrityException(String message, String nodeId, String kind) {
        super(message, nodeId, kind);
    }

    public GraphIntegrityException(String message, Throwable cause, String nodeId, String kind) {
        super(message, cause, nodeId, kind);
    }
}
