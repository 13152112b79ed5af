package com.arbor.tree;

/**
 * Closed set of node variants. Dispatch on this tag rather than on the node class.
 */
public enum NodeKind {
    COMMANDER,
    JOB,
    HANDLER
}
