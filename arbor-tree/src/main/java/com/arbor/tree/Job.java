package com.arbor.tree;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Single-shot node that runs a {@link JobBody}. The body may submit child jobs and call handlers
 * through its {@link JobContext}; the job completes only after all of them resolved.
 */
public final class Job extends TaskNode {

    private final JobBody body;
    private final List<Object> args;
    private final List<TaskNode> submitted = new CopyOnWriteArrayList<>();

    private Job(String name, JobBody body, List<Object> args) {
        super(name, NodeKind.JOB);
        this.body = Objects.requireNonNull(body, "body");
        this.args = args;
    }

    /** Creates a job that is not attached yet; see {@link #submitTo(TaskNode)}. */
    public static Job create(String name, JobBody body, Object... args) {
        return new Job(name, body, toArgs(args));
    }

    /** Creates a job and attaches it under the parent with the commander's default fault policy. */
    public static Job submit(TaskNode parent, String name, JobBody body, Object... args) {
        return create(name, body, args).submitTo(parent, null);
    }

    public static Job submit(TaskNode parent, FaultPolicy policy, String name, JobBody body, Object... args) {
        return create(name, body, args).submitTo(parent, policy);
    }

    public Job submitTo(TaskNode parent) {
        return submitTo(parent, null);
    }

    /**
     * Attaches this job under the parent and schedules it.
     *
     * @param policy fault policy; null means the commander's configured default
     * @throws InvalidEdgeException    if this job was already submitted
     * @throws NodeTerminatedException if the parent is terminated
     */
    public Job submitTo(TaskNode parent, FaultPolicy policy) {
        if (!tryAttach(parent, effectivePolicy(parent, policy), null)) {
            throw new InvalidEdgeException(getId(), "job was already submitted and is single-shot");
        }
        return this;
    }

    /** Positional arguments passed at creation. */
    public List<Object> getArgs() {
        return args;
    }

    /** Nodes this job's body submitted or called, in submission order. */
    public List<TaskNode> getSubmitted() {
        return Collections.unmodifiableList(new ArrayList<>(submitted));
    }

    void recordSubmitted(TaskNode node) {
        submitted.add(node);
    }

    @Override
    protected Object runBody() throws Exception {
        return body.run(new JobContext(this));
    }

    static List<Object> toArgs(Object[] args) {
        if (args == null || args.length == 0) return List.of();
        // allows null elements, unlike List.of
        return Collections.unmodifiableList(new ArrayList<>(Arrays.asList(args)));
    }
}
