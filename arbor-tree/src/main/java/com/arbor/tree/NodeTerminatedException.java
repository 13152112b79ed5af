package com.arbor.tree;

/**
 * Cooperative termination signal. Raised at scheduler boundaries (submission, await,
 * {@link JobContext#checkTerminated()}) once a node was terminated. Not an execution fault:
 * it never fires {@code AT_EXCEPTION}.
 */
public final class NodeTerminatedException extends RuntimeException {

    private final String nodeId;

    public NodeTerminatedException(String nodeId) {
        super("Node " + nodeId + " was terminated");
        this.nodeId = nodeId;
    }

    public String getNodeId() {
        return nodeId;
    }
}
