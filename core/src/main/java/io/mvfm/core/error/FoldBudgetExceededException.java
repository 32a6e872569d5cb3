package io.mvfm.core.error;

/**
 * Thrown when a fold exceeds {@code FoldOptions.maxSteps}. URN: {@code
 * urn:mvfm:error:fold-budget-exceeded}
 */
public final class FoldBudgetExceededException extends GraphEvalException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:mvfm:error:fold-budget-exceeded";

    public FoldBudgetExceededException(String message, String nodeId, String kind) {
        super(message, nodeId, kind);
    }

    public FoldBudgetExceededException(String message, Throwable cause, String nodeId, String kind) {
        super(message, cause, nodeId, kind);
    }
}
