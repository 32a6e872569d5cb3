package io.mvfm.core.error;

/**
 * A failure raised deliberately by a program, e.g. by an {@code error/fail} or {@code error/guard}
 * node. The message is the program-supplied text, unchanged, so catching handlers can expose it.
 * Recoverable. URN: {@code urn:mvfm:error:node-failure}
 */
public final class NodeFailureException extends GraphEvalException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:mvfm:error:node-failure";

    public NodeFailureException(String message, String nodeId, String kind) {
        super(message, nodeId, kind);
    }

    @Override
    public boolean isRecoverable() {
        return true;
    }
}
