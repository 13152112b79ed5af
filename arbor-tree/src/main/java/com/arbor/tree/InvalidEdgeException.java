package com.arbor.tree;

/**
 * Thrown when a connection or submission names something that cannot be scheduled there:
 * an unsupported node kind, a job submitted twice, or a second call of a non-reusable handler.
 */
public final class InvalidEdgeException extends IllegalArgumentException {

    private final String nodeId;

    public InvalidEdgeException(String nodeId, String reason) {
        super(String.format("Invalid edge for node %s: %s", nodeId, reason));
        this.nodeId = nodeId;
    }

    /** Offending node id; null when the target was not a node at all. */
    public String getNodeId() {
        return nodeId;
    }
}
