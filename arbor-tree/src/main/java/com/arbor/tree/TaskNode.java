package com.arbor.tree;

import com.arbor.tree.callback.CallbackException;
import com.arbor.tree.callback.CallbackRegistry;
import com.arbor.tree.callback.CallbackStage;
import com.arbor.tree.callback.NodeCallback;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Node of the task tree: identity, parent link, ordered children, status, result or error,
 * caller data and a {@link CallbackRegistry}.
 * <p>
 * Lifecycle of one cycle: PENDING, RUNNING (body runs, then waits for children), then COMPLETED or
 * FAILED once every child resolved; TERMINATED from PENDING or RUNNING on {@link #terminate()}.
 * A node is <b>resolved</b> when its terminal transition and that stage's callbacks are done and all
 * children are resolved; the parent re-checks its own readiness each time a child resolves.
 * <p>
 * State transitions and child-list changes are serialized on the node's monitor. Callbacks run
 * outside it. Locks are only ever nested child-then-ancestor.
 */
public abstract class TaskNode {

    private static final Logger log = LoggerFactory.getLogger(TaskNode.class);

    private final String id;
    private final String name;
    private final NodeKind kind;
    private final CallbackRegistry callbacks;
    /** Guarded by this. */
    private final List<TaskNode> children = new ArrayList<>();

    private volatile TaskNode parent;
    private volatile Commander commander;
    private volatile NodeStatus status = NodeStatus.PENDING;
    private volatile Object result;
    private volatile ExecutionFaultException error;
    private volatile Object data;
    private volatile FaultPolicy faultPolicy = FaultPolicy.RECORD;
    private volatile boolean resolved;
    private volatile long resolvedAtNanos;
    private volatile boolean faultObserved;

    // Cycle bookkeeping; guarded by this.
    private boolean attached;
    private boolean terminating;
    private int cycle;
    private boolean bodyFinished;
    private Object pendingResult;
    private Throwable pendingError;
    private ExecutionFaultException propagatedFault;
    private boolean settling;
    private boolean selfDone;
    private Future<?> execution;
    private Reenqueue pendingReenqueue;
    private CompletableFuture<NodeOutcome> resolution = new CompletableFuture<>();

    protected TaskNode(String name, NodeKind kind) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.name = name != null && !name.isBlank() ? name.trim() : kind.name().toLowerCase(Locale.ROOT);
        this.id = this.name + "-" + UUID.randomUUID().toString().substring(0, 8);
        this.callbacks = new CallbackRegistry(kind);
        if (kind == NodeKind.COMMANDER) {
            this.commander = (Commander) this;
        }
    }

    /** Runs the node's work on an executor thread. */
    protected abstract Object runBody() throws Exception;

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public NodeKind getKind() {
        return kind;
    }

    /** Owning node; null for the commander and for nodes not submitted yet. */
    public TaskNode getParent() {
        return parent;
    }

    /** Commander driving this node; null until submitted. */
    public Commander getCommander() {
        return commander;
    }

    public NodeStatus getStatus() {
        return status;
    }

    /** Value produced by the current cycle; present only once COMPLETED. */
    public Object getResult() {
        return result;
    }

    /** Fault of the current cycle; present only once FAILED. */
    public ExecutionFaultException getError() {
        return error;
    }

    public Object getData() {
        return data;
    }

    @SuppressWarnings("unchecked")
    public <T> T getData(Class<T> type) {
        Object v = data;
        return (v != null && type.isInstance(v)) ? (T) v : null;
    }

    /** Attaches caller data. Not interpreted by the scheduler; concurrent access is the caller's concern. */
    public void setData(Object data) {
        this.data = data;
    }

    /** Snapshot of children in insertion order. */
    public List<TaskNode> getChildren() {
        synchronized (this) {
            return Collections.unmodifiableList(new ArrayList<>(children));
        }
    }

    public CallbackRegistry getCallbacks() {
        return callbacks;
    }

    /** Number of started execution cycles (greater than 1 only for reusable handlers). */
    public int getCycle() {
        synchronized (this) {
            return cycle;
        }
    }

    public boolean isResolved() {
        return resolved;
    }

    /** {@link System#nanoTime()} at resolution of the latest cycle; 0 while unresolved. */
    public long getResolvedAtNanos() {
        return resolvedAtNanos;
    }

    public FaultPolicy getFaultPolicy() {
        return faultPolicy;
    }

    /** True once someone awaited this node's failure or it was propagated to the parent. */
    public boolean isFaultObserved() {
        return faultObserved;
    }

    /**
     * Registers a callback for a lifecycle stage.
     *
     * @throws IllegalArgumentException if the stage does not apply to this node's kind
     */
    public void addCallback(CallbackStage stage, NodeCallback callback, List<?> args,
                            Map<String, ?> kwargs, boolean injectNode) {
        callbacks.register(stage, callback, args, kwargs, injectNode);
    }

    /** Registers a callback with no fixed arguments that receives this node. */
    public void addCallback(CallbackStage stage, NodeCallback callback) {
        callbacks.register(stage, callback, List.of(), Map.of(), true);
    }

    /**
     * Requests cooperative termination. Unresolved children are terminated first, then this node is
     * marked TERMINATED (if PENDING or RUNNING), fires {@code AT_TERMINATE} and its running body is
     * interrupted. A PENDING node never runs. Nodes already past their terminal transition only
     * cascade to their children.
     */
    public void terminate() {
        List<TaskNode> snapshot;
        synchronized (this) {
            if (resolved) return;
            terminating = true;
            snapshot = new ArrayList<>(children);
        }
        for (TaskNode child : snapshot) {
            if (!child.isResolved()) {
                child.terminate();
            }
        }
        Future<?> running;
        synchronized (this) {
            if (status != NodeStatus.PENDING && status != NodeStatus.RUNNING) {
                if (log.isDebugEnabled()) {
                    log.debug("Node terminate | cascade only | nodeId={} | status={}", id, status);
                }
                return;
            }
            status = NodeStatus.TERMINATED;
            running = execution;
            execution = null;
            bodyFinished = true;
            pendingResult = null;
            pendingError = null;
            propagatedFault = null;
            pendingReenqueue = null;
        }
        if (log.isInfoEnabled()) {
            log.info("Node terminated | nodeId={} | kind={} | children={}", id, kind, snapshot.size());
        }
        fireObserving(CallbackStage.AT_TERMINATE);
        if (running != null) {
            running.cancel(true);
        }
        completeCycle();
    }

    /** Blocks until the current cycle resolves. */
    public NodeOutcome awaitResolution() throws InterruptedException {
        try {
            return currentResolution().get();
        } catch (ExecutionException e) {
            throw unwrap(e);
        }
    }

    /** Blocks until the current cycle resolves or the timeout elapses. */
    public NodeOutcome awaitResolution(long timeout, TimeUnit unit) throws InterruptedException, TimeoutException {
        try {
            return currentResolution().get(timeout, unit);
        } catch (ExecutionException e) {
            throw unwrap(e);
        }
    }

    @Override
    public String toString() {
        return kind + "[" + id + ", " + status + "]";
    }

    // ---------------------------------------------------------------- scheduling internals

    /**
     * Attaches this node under the parent and schedules it, unless it was attached before.
     *
     * @param cycleArgs arguments for the first cycle, or null when the node carries its own
     * @return false if the node had already been attached
     */
    final boolean tryAttach(TaskNode newParent, FaultPolicy policy, List<Object> cycleArgs) {
        Objects.requireNonNull(newParent, "parent");
        if (newParent == this) {
            throw new InvalidEdgeException(id, "a node cannot be its own parent");
        }
        Commander owner = newParent.commanderForChildren();
        synchronized (this) {
            if (attached) return false;
            newParent.addChild(this);
            attached = true;
            parent = newParent;
            commander = owner;
            faultPolicy = policy;
            if (cycleArgs != null) applyCycleArguments(cycleArgs);
        }
        if (log.isInfoEnabled()) {
            log.info("Node attached | nodeId={} | kind={} | parentId={} | policy={}", id, kind, newParent.getId(), policy);
        }
        owner.nodeAttached(this);
        owner.schedule(this);
        return true;
    }

    /** Commander that children of this node are scheduled on. */
    final Commander commanderForChildren() {
        Commander c = commander;
        if (c == null) {
            throw new IllegalStateException("Node " + id + " is not attached to a commander; submit it before adding children");
        }
        return c;
    }

    final void addChild(TaskNode child) {
        synchronized (this) {
            if (terminating || status == NodeStatus.TERMINATED) {
                throw new NodeTerminatedException(id);
            }
            if (resolved) {
                throw new IllegalStateException("Node " + id + " already resolved; cannot attach " + child.getId());
            }
            children.add(child);
        }
    }

    final void removeChild(TaskNode child) {
        synchronized (this) {
            children.remove(child);
        }
    }

    final void trackExecution(Future<?> future) {
        synchronized (this) {
            if (status == NodeStatus.PENDING || status == NodeStatus.RUNNING) {
                execution = future;
                return;
            }
        }
        // terminated between scheduling and tracking
        future.cancel(true);
    }

    /** Entry point on the executor thread. */
    final void execute() {
        CallbackStage startStage = CallbackStage.startOf(kind);
        int currentCycle;
        synchronized (this) {
            if (status != NodeStatus.PENDING) {
                if (log.isDebugEnabled()) log.debug("Node execute skip | nodeId={} | status={}", id, status);
                return;
            }
            status = NodeStatus.RUNNING;
            currentCycle = ++cycle;
        }
        if (log.isInfoEnabled()) {
            log.info("Node start | nodeId={} | kind={} | cycle={}", id, kind, currentCycle);
        }
        try {
            callbacks.fire(startStage, this);
        } catch (CallbackException e) {
            log.warn("Start callback failed; body skipped | nodeId={} | stage={}", id, startStage, e);
            finishBody(null, e);
            return;
        }
        if (status != NodeStatus.RUNNING) return;
        Object value;
        try {
            value = runBody();
        } catch (Throwable t) {
            finishBody(null, t);
            return;
        }
        finishBody(value, null);
    }

    /** Marks the commander as running; it has no body of its own. */
    final void beginWithoutBody() {
        synchronized (this) {
            if (status == NodeStatus.PENDING) {
                status = NodeStatus.RUNNING;
                cycle++;
            }
            bodyFinished = true;
        }
    }

    /** Re-evaluates settle and resolution readiness after a child resolved or left. */
    final void childChanged() {
        trySettle();
        checkResolved();
    }

    /**
     * A child with PROPAGATE failed. Fails this node when it settles, or forwards the fault upwards if
     * this node is already past its terminal transition.
     */
    void receivePropagatedFault(ExecutionFaultException fault) {
        TaskNode forwardTo;
        synchronized (this) {
            if (!settling && (status == NodeStatus.PENDING || status == NodeStatus.RUNNING)) {
                if (propagatedFault == null) propagatedFault = fault;
                return;
            }
            forwardTo = parent;
        }
        if (forwardTo != null) {
            forwardTo.receivePropagatedFault(fault);
        } else {
            log.warn("Propagated fault dropped; no parent | nodeId={} | fault={}", id, fault.getMessage());
        }
    }

    /** Called once per resolution, before awaiters are released and the parent is notified. */
    void onResolved() {
    }

    /** Sets arguments for the next cycle (handlers). */
    void applyCycleArguments(List<Object> args) {
    }

    final void markFaultObserved() {
        faultObserved = true;
    }

    /** True if this node is a strict ancestor of other. */
    final boolean isAncestorOf(TaskNode other) {
        for (TaskNode p = other.getParent(); p != null; p = p.getParent()) {
            if (p == this) return true;
        }
        return false;
    }

    final void fireObserving(CallbackStage stage) {
        List<CallbackException> failures = callbacks.fireAll(stage, this);
        if (!failures.isEmpty()) {
            Commander c = commander;
            if (c != null) c.recordCallbackFailures(failures);
        }
    }

    static FaultPolicy effectivePolicy(TaskNode parent, FaultPolicy requested) {
        Objects.requireNonNull(parent, "parent");
        return requested != null ? requested : parent.commanderForChildren().getDefaultFaultPolicy();
    }

    // ---------------------------------------------------------------- reuse (handlers)

    /**
     * Queues a re-enqueue for when the current cycle resolves, if the node is between its terminal
     * transition and resolution (e.g. called from its own end callback).
     *
     * @return false if the cycle is not in that window
     */
    final boolean deferReenqueue(TaskNode newParent, FaultPolicy policy, List<Object> args) {
        synchronized (this) {
            boolean ending = (status == NodeStatus.COMPLETED || status == NodeStatus.FAILED) && !resolved;
            if (!ending) return false;
            if (pendingReenqueue != null) {
                throw new IllegalStateException("Node " + id + " already has a pending re-enqueue");
            }
            pendingReenqueue = new Reenqueue(newParent, policy, args);
        }
        if (log.isDebugEnabled()) {
            log.debug("Node re-enqueue deferred to end of cycle | nodeId={} | parentId={}", id, newParent.getId());
        }
        return true;
    }

    /**
     * Resets a resolved node to PENDING under the new parent and schedules it.
     *
     * @throws IllegalStateException if the node is still pending/running or was terminated
     */
    final void reenqueue(TaskNode newParent, FaultPolicy policy, List<Object> args) {
        attachForNextCycle(new Reenqueue(newParent, policy, args), true);
    }

    private void attachForNextCycle(Reenqueue next, boolean requireResolved) {
        Commander owner = next.parent.commanderForChildren();
        TaskNode old;
        synchronized (this) {
            if (requireResolved) {
                if (status == NodeStatus.TERMINATED) {
                    throw new IllegalStateException("Node " + id + " was terminated and cannot run again");
                }
                if (!resolved) {
                    throw new IllegalStateException("Node " + id + " is still " + status + "; call it again once it resolved");
                }
            }
            next.parent.addChild(this);
            old = parent;
            reset();
            parent = next.parent;
            commander = owner;
            faultPolicy = next.policy;
            applyCycleArguments(next.args);
        }
        if (old != null) {
            old.removeChild(this);
            if (old != next.parent) old.childChanged();
        }
        if (log.isInfoEnabled()) {
            log.info("Node re-enqueued | nodeId={} | parentId={} | previousParentId={}",
                    id, next.parent.getId(), old != null ? old.getId() : null);
        }
        owner.nodeAttached(this);
        owner.schedule(this);
    }

    /** Clears per-cycle state back to PENDING. Caller holds the monitor. */
    private void reset() {
        status = NodeStatus.PENDING;
        result = null;
        error = null;
        resolved = false;
        resolvedAtNanos = 0;
        faultObserved = false;
        terminating = false;
        bodyFinished = false;
        pendingResult = null;
        pendingError = null;
        propagatedFault = null;
        settling = false;
        selfDone = false;
        execution = null;
        resolution = new CompletableFuture<>();
    }

    // ---------------------------------------------------------------- transitions

    private void finishBody(Object value, Throwable failure) {
        synchronized (this) {
            execution = null;
            if (status != NodeStatus.RUNNING) {
                if (log.isDebugEnabled()) {
                    log.debug("Node outcome discarded | nodeId={} | status={} | failed={}", id, status, failure != null);
                }
                return;
            }
            bodyFinished = true;
            pendingResult = value;
            pendingError = failure;
        }
        trySettle();
    }

    private void trySettle() {
        ExecutionFaultException fault;
        TaskNode p;
        FaultPolicy policy;
        synchronized (this) {
            if (!bodyFinished || settling || status != NodeStatus.RUNNING || !allChildrenResolved()) return;
            settling = true;
            if (pendingError != null) {
                fault = new ExecutionFaultException(id, pendingError);
            } else if (propagatedFault != null) {
                fault = new ExecutionFaultException(id, propagatedFault);
            } else {
                fault = null;
            }
            if (fault == null) {
                result = pendingResult;
                status = NodeStatus.COMPLETED;
            } else {
                error = fault;
                status = NodeStatus.FAILED;
            }
            pendingResult = null;
            pendingError = null;
            propagatedFault = null;
            p = parent;
            policy = faultPolicy;
        }
        if (fault == null) {
            if (log.isInfoEnabled()) log.info("Node completed | nodeId={} | kind={}", id, kind);
            // commander end fires on resolution, see Commander#onResolved
            if (kind != NodeKind.COMMANDER) fireObserving(CallbackStage.endOf(kind));
        } else {
            if (log.isInfoEnabled()) {
                log.info("Node failed | nodeId={} | kind={} | policy={} | cause={}", id, kind, policy, fault.getCause());
            }
            fireObserving(CallbackStage.AT_EXCEPTION);
            if (policy == FaultPolicy.PROPAGATE && p != null) {
                markFaultObserved();
                p.receivePropagatedFault(fault);
            }
        }
        completeCycle();
    }

    private void completeCycle() {
        synchronized (this) {
            selfDone = true;
        }
        checkResolved();
    }

    private void checkResolved() {
        CompletableFuture<NodeOutcome> done;
        NodeOutcome outcome;
        Reenqueue next;
        TaskNode p;
        synchronized (this) {
            if (!selfDone || resolved || !allChildrenResolved()) return;
            resolvedAtNanos = System.nanoTime();
            outcome = new NodeOutcome(id, cycle, status, result, error);
            done = resolution;
            next = pendingReenqueue;
            pendingReenqueue = null;
            if (next == null) {
                resolved = true;
            } else {
                // keeps concurrent checks from resolving the cycle while it restarts
                selfDone = false;
            }
            p = parent;
        }
        if (next != null) {
            done.complete(outcome);
            try {
                attachForNextCycle(next, false);
                return;
            } catch (RuntimeException e) {
                log.warn("Deferred re-enqueue failed; resolving cycle | nodeId={} | parentId={}", id, next.parent.getId(), e);
                completeCycle();
                return;
            }
        }
        if (log.isDebugEnabled()) {
            log.debug("Node resolved | nodeId={} | status={} | cycle={}", id, outcome.getStatus(), outcome.getCycle());
        }
        onResolved();
        done.complete(outcome);
        if (p != null) p.childChanged();
    }

    private boolean allChildrenResolved() {
        for (TaskNode child : children) {
            if (!child.isResolved()) return false;
        }
        return true;
    }

    private CompletableFuture<NodeOutcome> currentResolution() {
        synchronized (this) {
            return resolution;
        }
    }

    private static RuntimeException unwrap(ExecutionException e) {
        Throwable cause = e.getCause() != null ? e.getCause() : e;
        if (cause instanceof RuntimeException re) return re;
        return new RuntimeException(cause);
    }

    private static final class Reenqueue {
        private final TaskNode parent;
        private final FaultPolicy policy;
        private final List<Object> args;

        private Reenqueue(TaskNode parent, FaultPolicy policy, List<Object> args) {
            this.parent = Objects.requireNonNull(parent, "parent");
            this.policy = policy;
            this.args = args;
        }
    }
}
