package io.mvfm.core.error;

/**
 * Thrown when an argument's type does not match the kind's expected input type. URN: {@code
 * urn:mvfm:error:type-mismatch}
 */
public final class TypeMismatchException extends GraphBuildException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:mvfm:error:type-mismatch";

    public TypeMismatchException(String message, String nodeId, String kind) {
        super(message, nodeId, kind);
    }

    public TypeMismatchException(String message, Throwable cause, String nodeId, String kind) {
        super(message, cause, nodeId, kind);
    }
}
