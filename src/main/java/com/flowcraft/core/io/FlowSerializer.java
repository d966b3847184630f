package com.flowcraft.core.io;

import com.flowcraft.core.api.Flow;
import com.flowcraft.core.engine.GraphIndex;

import java.util.Map;

/**
 * Renders a flow as a canonical text document.
 *
 * <p>
 * Implementations only decide the text dialect; ordering and field
 * projection come from {@link CanonicalDocument}, so every backend emits the
 * same content and nesting.
 */
public interface FlowSerializer {

    /** Renders an already-built canonical document tree. */
    String render(Map<String, Object> document);

    default String serialize(Flow flow) {
        return render(CanonicalDocument.build(flow));
    }

    default String serialize(Flow flow, GraphIndex index) {
        return render(CanonicalDocument.build(flow, index));
    }
}
