package com.arbor.tree;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Node wrapping a {@link HandlerFunction}, scheduled by calling it under a parent.
 * <p>
 * A reusable handler can be called again once a cycle resolved, under the same or another parent;
 * each cycle starts from PENDING with the new arguments and produces its own result. Calling it from
 * its own end or exception callback defers the next cycle until the current one resolved, which is
 * how loops are built. {@link #invoke(Object...)} runs the function directly, outside the tree.
 */
public final class Handler extends TaskNode {

    private static final Logger log = LoggerFactory.getLogger(Handler.class);

    private final HandlerFunction function;
    private final boolean reusable;
    private volatile List<Object> args = List.of();

    private Handler(String name, HandlerFunction function, boolean reusable) {
        super(name, NodeKind.HANDLER);
        this.function = Objects.requireNonNull(function, "function");
        this.reusable = reusable;
    }

    /** Single-shot handler. */
    public static Handler create(String name, HandlerFunction function) {
        return new Handler(name, function, false);
    }

    public static Handler reusable(String name, HandlerFunction function) {
        return new Handler(name, function, true);
    }

    public boolean isReusable() {
        return reusable;
    }

    /** Arguments of the current (or last) cycle. */
    public List<Object> getArgs() {
        return args;
    }

    /** Schedules the handler under the parent with the commander's default fault policy. */
    public Handler call(TaskNode parent, Object... args) {
        return call(parent, null, Job.toArgs(args));
    }

    /**
     * Schedules the handler under the parent.
     *
     * @param policy fault policy for this cycle; null means the commander's configured default
     * @throws InvalidEdgeException   if a single-shot handler was already called
     * @throws IllegalStateException  if a reusable handler is pending, running or terminated
     */
    public Handler call(TaskNode parent, FaultPolicy policy, List<?> args) {
        Objects.requireNonNull(parent, "parent");
        List<Object> cycleArgs = args == null || args.isEmpty()
                ? List.of() : Collections.unmodifiableList(new ArrayList<>(args));
        FaultPolicy effective = effectivePolicy(parent, policy);
        if (tryAttach(parent, effective, cycleArgs)) {
            return this;
        }
        if (!reusable) {
            throw new InvalidEdgeException(getId(), "handler is single-shot and was already called");
        }
        if (deferReenqueue(parent, effective, cycleArgs)) {
            return this;
        }
        if (log.isDebugEnabled()) {
            log.debug("Handler call again | handlerId={} | parentId={} | previousCycle={}", getId(), parent.getId(), getCycle());
        }
        reenqueue(parent, effective, cycleArgs);
        return this;
    }

    /** Runs the function on the calling thread. No callbacks fire and the tree is not touched. */
    public Object invoke(Object... args) throws Exception {
        return function.apply(Job.toArgs(args));
    }

    @Override
    protected Object runBody() throws Exception {
        return function.apply(args);
    }

    @Override
    void applyCycleArguments(List<Object> args) {
        this.args = args != null ? args : List.of();
    }
}
