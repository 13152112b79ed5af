package com.arbor.tree;

/**
 * A node body raised an error while running. Stored as the node's error and rethrown to
 * callers that await the node.
 */
public final class ExecutionFaultException extends RuntimeException {

    private final String nodeId;

    public ExecutionFaultException(String nodeId, Throwable cause) {
        super(String.format("Node %s failed: %s", nodeId, cause), cause);
        this.nodeId = nodeId;
    }

    public String getNodeId() {
        return nodeId;
    }
}
