package io.mvfm.core.error;

/**
 * Thrown when an expression names a kind that no composed plugin declares. URN: {@code
 * urn:mvfm:error:unknown-kind}
 */
public final class UnknownKindException extends GraphBuildException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:mvfm:error:unknown-kind";

    public UnknownKindException(String message, String nodeId, String kind) {
        super(message, nodeId, kind);
    }

    public UnknownKindException(String message, Throwable cause, String nodeId, String kind) {
        super(message, cause, nodeId, kind);
    }
}
