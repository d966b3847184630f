package com.flowcraft.core.io;

/**
 * Raised when a flow document cannot be read into a {@link com.flowcraft.core.api.Flow}:
 * malformed JSON, a missing required field or an unknown node type.
 */
public class FlowFormatException extends IllegalArgumentException {

    public FlowFormatException(String message) {
        super(message);
    }

    public FlowFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
