package com.arbor.tree.callback;

/**
 * A registered callback threw while its stage was firing.
 */
public final class CallbackException extends RuntimeException {

    private final String nodeId;
    private final CallbackStage stage;
    private final int bindingIndex;

    public CallbackException(String nodeId, CallbackStage stage, int bindingIndex, Throwable cause) {
        super(String.format("Callback #%d for %s on node %s failed: %s", bindingIndex, stage, nodeId, cause), cause);
        this.nodeId = nodeId;
        this.stage = stage;
        this.bindingIndex = bindingIndex;
    }

    public String getNodeId() {
        return nodeId;
    }

    public CallbackStage getStage() {
        return stage;
    }

    /** Position of the failing binding in registration order for its stage. */
    public int getBindingIndex() {
        return bindingIndex;
    }
}
