package com.arbor.tree;

import java.util.List;
import java.util.Objects;

/**
 * View a running job body gets of its node: arguments, child submission and awaiting.
 * Children submitted here are owned by the job, which completes only after they resolved.
 */
public final class JobContext {

    private final Job job;

    JobContext(Job job) {
        this.job = job;
    }

    public Job node() {
        return job;
    }

    public Commander commander() {
        return job.getCommander();
    }

    public List<Object> args() {
        return job.getArgs();
    }

    /**
     * Positional argument cast to the type.
     *
     * @throws IndexOutOfBoundsException if there is no such argument
     * @throws ClassCastException        if it has another type
     */
    public <T> T arg(int index, Class<T> type) {
        return type.cast(job.getArgs().get(index));
    }

    public Job submitJob(String name, JobBody body, Object... args) {
        return submitJob(Job.create(name, body, args), null);
    }

    public Job submitJob(FaultPolicy policy, String name, JobBody body, Object... args) {
        return submitJob(Job.create(name, body, args), policy);
    }

    public Job submitJob(Job child) {
        return submitJob(child, null);
    }

    /**
     * Attaches a prepared job as a child of this job.
     *
     * @throws NodeTerminatedException if this job was terminated
     */
    public Job submitJob(Job child, FaultPolicy policy) {
        checkTerminated();
        child.submitTo(job, policy);
        job.recordSubmitted(child);
        return child;
    }

    public Handler callHandler(Handler handler, Object... args) {
        checkTerminated();
        handler.call(job, args);
        job.recordSubmitted(handler);
        return handler;
    }

    public Handler callHandler(Handler handler, FaultPolicy policy, List<?> args) {
        checkTerminated();
        handler.call(job, policy, args);
        job.recordSubmitted(handler);
        return handler;
    }

    /** Calls the handler as a child and waits for this cycle's result. */
    public Object callAndAwait(Handler handler, Object... args) {
        return await(callHandler(handler, args));
    }

    /**
     * Blocks until the node resolved and returns its result. Awaiting a failed node rethrows its
     * {@link ExecutionFaultException} and counts as inspecting the fault.
     *
     * @throws IllegalArgumentException if the node is this job or one of its ancestors
     * @throws IllegalStateException    if the node was never submitted
     * @throws NodeTerminatedException  if the node was terminated, or this thread was interrupted
     */
    public Object await(TaskNode node) {
        Objects.requireNonNull(node, "node");
        if (node == job || node.isAncestorOf(job)) {
            throw new IllegalArgumentException("Job " + job.getId() + " cannot await " + node.getId()
                    + ": it only resolves after this job");
        }
        if (node.getCommander() == null && !node.isResolved()) {
            throw new IllegalStateException("Node " + node.getId() + " was never submitted; awaiting it would block forever");
        }
        checkTerminated();
        NodeOutcome outcome;
        try {
            outcome = node.awaitResolution();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NodeTerminatedException(job.getId());
        }
        if (outcome.getStatus() == NodeStatus.FAILED) {
            node.markFaultObserved();
        }
        return outcome.resultOrThrow();
    }

    public <T> T await(TaskNode node, Class<T> type) {
        return type.cast(await(node));
    }

    /** Throws if this job was terminated; long bodies call it between steps. */
    public void checkTerminated() {
        if (job.getStatus() == NodeStatus.TERMINATED) {
            throw new NodeTerminatedException(job.getId());
        }
    }
}
