package io.mvfm.core.error;

/**
 * Thrown when no handler is registered for an encountered kind. URN: {@code
 * urn:mvfm:error:missing-handler}
 */
public final class MissingHandlerException extends GraphEvalException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:mvfm:error:missing-handler";

    public MissingHandlerException(String message, String nodeId, String kind) {
        super(message, nodeId, kind);
    }

    public MissingHandlerException(String message, Throwable cause, String nodeId, String kind) {
        super(message, cause, nodeId, kind);
    }
}
