package io.mvfm.core.error;

/**
 * Thrown when a graph document is malformed or cannot be read. URN: {@code
 * urn:mvfm:error:graph-document}
 */
public final class GraphDocumentException extends GraphBuildException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:mvfm:error:graph-document";

    public GraphDocumentException(String message, String nodeId, String kind) {
        super(message, nodeId, kind);
    }

    public GraphDocumentException(String message, Throwable cause, String nodeId, String kind) {
        super(message, cause, nodeId, kind);
    }
}
