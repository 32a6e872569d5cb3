package io.mvfm.core.spi;

import io.mvfm.core.model.NodeEntry;
import io.mvfm.core.model.Payload;
import java.util.List;

/**
 * The node a handler is evaluating: its identifier and entry.
 *
 * @param id    node identifier
 * @param entry node entry
 */
public record EvalNode(String id, NodeEntry entry) {

    public String kind() {
        return entry.kind();
    }

    public List<String> children() {
        return entry.children();
    }

    public int childCount() {
        return entry.children().size();
    }

    public Payload payload() {
        return entry.payload();
    }

    /** The literal payload value, or {@code null}. */
    public Object literal() {
        return entry.literalValue();
    }
}
