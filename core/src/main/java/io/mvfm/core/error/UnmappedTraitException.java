package io.mvfm.core.error;

/**
 * Thrown when a trait has no instance for the resolved operand type. URN: {@code
 * urn:mvfm:error:unmapped-trait}
 */
public final class UnmappedTraitException extends GraphBuildException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:mvfm:error:unmapped-trait";

    public UnmappedTraitException(String message, String nodeId, String kind) {
        super(message, nodeId, kind);
    }

    public UnmappedTraitException(String message, Throwable cause, String nodeId, String kind) {
        super(message, cause, nodeId, kind);
    }
}
