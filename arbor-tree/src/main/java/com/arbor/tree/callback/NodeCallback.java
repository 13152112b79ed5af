package com.arbor.tree.callback;

/**
 * Function bound to a lifecycle stage. May submit jobs or call handlers; that is how edges
 * between nodes are expressed.
 */
@FunctionalInterface
public interface NodeCallback {

    /**
     * @param invocation stored arguments plus, when injection was requested, the triggering node
     */
    void onStage(CallbackInvocation invocation) throws Exception;
}
