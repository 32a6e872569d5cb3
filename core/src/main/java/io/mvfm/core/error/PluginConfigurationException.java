package io.mvfm.core.error;

/**
 * Thrown when a plugin declares node kinds but has neither default handlers nor an override. URN:
 * {@code urn:mvfm:error:plugin-configuration}
 */
public final class PluginConfigurationException extends GraphBuildException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:mvfm:error:plugin-configuration";

    public PluginConfigurationException(String message, String nodeId, String kind) {
        super(message, nodeId, kind);
    }

    public PluginConfigurationException(String message, Throwable cause, String nodeId, String kind) {
        super(message, cause, nodeId, kind);
    }
}
