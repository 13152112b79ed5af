package com.arbor.features.debug;

import com.arbor.tree.Commander;
import com.arbor.tree.TaskNode;
import com.arbor.tree.callback.CallbackBinding;
import com.arbor.tree.callback.CallbackInvocation;
import com.arbor.tree.callback.CallbackStage;
import com.arbor.tree.callback.NodeCallback;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Debug logging for every lifecycle stage a node goes through.
 * {@link #install(Commander)} covers the commander and every node attached under it later.
 */
public final class DebugCallbacks {

    private static final Logger log = LoggerFactory.getLogger(DebugCallbacks.class);

    private static final NodeCallback LOG_STAGE = DebugCallbacks::logStage;

    private DebugCallbacks() {
    }

    public static void install(Commander commander) {
        attach(commander);
        commander.addAttachListener(DebugCallbacks::attach);
    }

    /**
     * Registers a logging callback on each stage that applies to the node. A node that already has
     * them (e.g. a reusable handler attached again for its next cycle) is left unchanged.
     */
    public static void attach(TaskNode node) {
        if (isAttached(node)) {
            return;
        }
        for (CallbackStage stage : CallbackStage.values()) {
            if (stage.appliesTo(node.getKind())) {
                node.addCallback(stage, LOG_STAGE);
            }
        }
    }

    private static boolean isAttached(TaskNode node) {
        for (CallbackBinding binding : node.getCallbacks().bindings(CallbackStage.AT_TERMINATE)) {
            if (binding.getFunction() == LOG_STAGE) return true;
        }
        return false;
    }

    private static void logStage(CallbackInvocation inv) {
        TaskNode node = inv.getNode();
        log.info("[DEBUG] {} nodeId={} kind={} status={} cycle={} parentId={} children={} resultPresent={} error={}",
                inv.getStage(), node.getId(), node.getKind(), node.getStatus(), node.getCycle(),
                node.getParent() != null ? node.getParent().getId() : null,
                node.getChildren().size(), node.getResult() != null,
                node.getError() != null ? node.getError().getMessage() : null);
    }
}
