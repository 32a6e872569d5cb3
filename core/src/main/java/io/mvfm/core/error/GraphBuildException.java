package io.mvfm.core.error;

/**
 * Abstract parent for structural errors: raised while composing plugins, elaborating an expression,
 * committing an edited graph or decoding a graph document. Elaboration is all-or-nothing, so a
 * structural error always means no graph was produced.
 */
public abstract class GraphBuildException extends MvfmException {

    private static final long serialVersionUID = 1L;

    protected GraphBuildException(String message, String nodeId, String kind) {
        super(message, nodeId, kind, Phase.STRUCTURAL);
    }

    protected GraphBuildException(String message, Throwable cause, String nodeId, String kind) {
        super(message, cause, nodeId, kind, Phase.STRUCTURAL);
    }
}
