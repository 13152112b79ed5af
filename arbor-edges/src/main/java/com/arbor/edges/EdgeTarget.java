package com.arbor.edges;

import com.arbor.tree.FaultPolicy;
import com.arbor.tree.Handler;
import com.arbor.tree.InvalidEdgeException;
import com.arbor.tree.Job;
import com.arbor.tree.JobBody;
import com.arbor.tree.TaskNode;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * What an edge schedules when it fires, and with which fault policy.
 */
public final class EdgeTarget {

    @FunctionalInterface
    private interface Launcher {
        TaskNode launch(TaskNode parent, FaultPolicy policy);
    }

    private final String label;
    private final Launcher launcher;
    private final FaultPolicy faultPolicy;

    private EdgeTarget(String label, Launcher launcher, FaultPolicy faultPolicy) {
        this.label = label;
        this.launcher = launcher;
        this.faultPolicy = faultPolicy;
    }

    /** Builds and submits a new job each time the edge fires. */
    public static EdgeTarget job(String name, JobBody body, Object... args) {
        Objects.requireNonNull(body, "body");
        Object[] fixed = args != null ? args.clone() : new Object[0];
        return new EdgeTarget("job:" + name,
                (parent, policy) -> Job.submit(parent, policy, name, body, fixed), null);
    }

    /**
     * Calls the handler each time the edge fires. Only a reusable handler can be the target of an
     * edge that fires more than once.
     */
    public static EdgeTarget handler(Handler handler, Object... args) {
        Objects.requireNonNull(handler, "handler");
        List<Object> fixed = args == null || args.length == 0
                ? List.of() : Collections.unmodifiableList(new ArrayList<>(Arrays.asList(args)));
        return new EdgeTarget("handler:" + handler.getId(),
                (parent, policy) -> handler.call(parent, policy, fixed), null);
    }

    /**
     * Schedules an already-built node. A job target can fire once.
     *
     * @throws InvalidEdgeException for a commander
     */
    public static EdgeTarget of(TaskNode node) {
        Objects.requireNonNull(node, "node");
        return switch (node.getKind()) {
            case JOB -> new EdgeTarget("job:" + node.getId(),
                    (parent, policy) -> ((Job) node).submitTo(parent, policy), null);
            case HANDLER -> handler((Handler) node);
            case COMMANDER -> throw new InvalidEdgeException(node.getId(), "a commander cannot be an edge target");
        };
    }

    /** Same target, submitted with the given policy instead of the commander default. */
    public EdgeTarget withFaultPolicy(FaultPolicy policy) {
        return new EdgeTarget(label, launcher, policy);
    }

    public String getLabel() {
        return label;
    }

    /** Policy used on submission; null means the commander default. */
    public FaultPolicy getFaultPolicy() {
        return faultPolicy;
    }

    TaskNode fire(TaskNode parent) {
        return launcher.launch(parent, faultPolicy);
    }

    @Override
    public String toString() {
        return "EdgeTarget{" + label + (faultPolicy != null ? ", " + faultPolicy : "") + "}";
    }
}
