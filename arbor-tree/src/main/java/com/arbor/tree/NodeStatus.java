package com.arbor.tree;

/**
 * Status of a node in the task tree.
 */
public enum NodeStatus {
    /** Created or re-enqueued; body not started yet. */
    PENDING,
    /** Body running, or body finished and waiting for children to resolve. */
    RUNNING,
    /** Body returned normally and every child resolved. */
    COMPLETED,
    /** Body (or a start callback) raised a fault, or a propagated child fault arrived. */
    FAILED,
    /** Termination was requested while PENDING or RUNNING. */
    TERMINATED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == TERMINATED;
    }
}
