package com.arbor.tree;

/**
 * Notified whenever a node is attached under a commander's tree, before it is scheduled.
 * Reusable handlers notify once per cycle. Failures are logged and ignored.
 */
@FunctionalInterface
public interface NodeAttachListener {

    void onAttach(TaskNode node);
}
