package io.mvfm.core.error;

/**
 * Thrown when a scalar's runtime type has no lift mapping. URN: {@code
 * urn:mvfm:error:unliftable-value}
 */
public final class UnliftableValueException extends GraphBuildException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:mvfm:error:unliftable-value";

    public UnliftableValueException(String message, String nodeId, String kind) {
        super(message, nodeId, kind);
    }

    public UnliftableValueException(String message, Throwable cause, String nodeId, String kind) {
        super(message, cause, nodeId, kind);
    }
}
