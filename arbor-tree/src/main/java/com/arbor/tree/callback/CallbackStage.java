package com.arbor.tree.callback;

import com.arbor.tree.NodeKind;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle points at which registered callbacks fire.
 */
public enum CallbackStage {
    /** Job PENDING to RUNNING, before the body. */
    AT_JOB_START(EnumSet.of(NodeKind.JOB)),
    /** Job reached COMPLETED; result is set. */
    AT_JOB_END(EnumSet.of(NodeKind.JOB)),
    /** Handler PENDING to RUNNING, before the callable. */
    AT_HANDLER_START(EnumSet.of(NodeKind.HANDLER)),
    /** Handler reached COMPLETED; result is set. */
    AT_HANDLER_END(EnumSet.of(NodeKind.HANDLER)),
    /** Job or handler reached FAILED; error is set. */
    AT_EXCEPTION(EnumSet.of(NodeKind.JOB, NodeKind.HANDLER)),
    /** Node was terminated. */
    AT_TERMINATE(EnumSet.allOf(NodeKind.class)),
    /** Commander resolved: every root resolved. Fires once per commander. */
    AT_COMMANDER_END(EnumSet.of(NodeKind.COMMANDER));

    private final Set<NodeKind> applicableKinds;

    CallbackStage(Set<NodeKind> applicableKinds) {
        this.applicableKinds = applicableKinds;
    }

    public boolean appliesTo(NodeKind kind) {
        return kind != null && applicableKinds.contains(kind);
    }

    /** Stage fired when a node of this kind starts running; null for the commander. */
    public static CallbackStage startOf(NodeKind kind) {
        return switch (kind) {
            case JOB -> AT_JOB_START;
            case HANDLER -> AT_HANDLER_START;
            case COMMANDER -> null;
        };
    }

    /** Stage fired when a node of this kind completes normally. */
    public static CallbackStage endOf(NodeKind kind) {
        return switch (kind) {
            case JOB -> AT_JOB_END;
            case HANDLER -> AT_HANDLER_END;
            case COMMANDER -> AT_COMMANDER_END;
        };
    }
}
