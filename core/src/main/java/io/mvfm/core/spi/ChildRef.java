package io.mvfm.core.spi;

import java.util.Objects;

/** Names the node a suspended handler waits on. */
public sealed interface ChildRef {

    /**
     * A position in the requesting node's own child list.
     *
     * @param index zero-based child index
     */
    record Index(int index) implements ChildRef {}

    /**
     * An explicit node identifier, not necessarily a child of the requester (e.g. an alias target).
     *
     * @param nodeId the node identifier
     */
    record NodeId(String nodeId) implements ChildRef {
        public NodeId {
            Objects.requireNonNull(nodeId, "nodeId must not be null");
        }
    }
}
