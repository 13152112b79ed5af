package com.arbor.tree;

/**
 * Snapshot of one resolved execution cycle: terminal status plus result or error.
 * Reusable handlers produce one outcome per cycle.
 */
public final class NodeOutcome {

    private final String nodeId;
    private final int cycle;
    private final NodeStatus status;
    private final Object result;
    private final ExecutionFaultException error;

    NodeOutcome(String nodeId, int cycle, NodeStatus status, Object result, ExecutionFaultException error) {
        this.nodeId = nodeId;
        this.cycle = cycle;
        this.status = status;
        this.result = result;
        this.error = error;
    }

    public String getNodeId() {
        return nodeId;
    }

    public int getCycle() {
        return cycle;
    }

    public NodeStatus getStatus() {
        return status;
    }

    /** Result when COMPLETED; null otherwise. */
    public Object getResult() {
        return result;
    }

    /** Error when FAILED; null otherwise. */
    public ExecutionFaultException getError() {
        return error;
    }

    /**
     * Returns the result, or rethrows the failure.
     *
     * @throws ExecutionFaultException  if the cycle FAILED
     * @throws NodeTerminatedException if the cycle was TERMINATED
     */
    public Object resultOrThrow() {
        return switch (status) {
            case COMPLETED -> result;
            case FAILED -> throw error;
            case TERMINATED -> throw new NodeTerminatedException(nodeId);
            default -> throw new IllegalStateException("Outcome of node " + nodeId + " is not terminal: " + status);
        };
    }

    @Override
    public String toString() {
        return "NodeOutcome{nodeId=" + nodeId + ", cycle=" + cycle + ", status=" + status + "}";
    }
}
