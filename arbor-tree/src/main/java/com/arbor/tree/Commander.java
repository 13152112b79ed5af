package com.arbor.tree;

import com.arbor.config.ArborConfig;
import com.arbor.tree.callback.CallbackException;
import com.arbor.tree.callback.CallbackStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Root of a task tree. Owns the executor, accepts root submissions and blocks in {@link #run()}
 * until every root resolved.
 * <p>
 * Nodes submitted before {@code run()} are queued and dispatched when it starts; nodes attached
 * afterwards (children submitted by bodies, handler calls from callbacks) are dispatched immediately.
 * A commander runs once.
 */
public final class Commander extends TaskNode {

    private static final Logger log = LoggerFactory.getLogger(Commander.class);

    private final ArborConfig config;
    private final FaultPolicy defaultFaultPolicy;
    private final List<NodeAttachListener> attachListeners = new CopyOnWriteArrayList<>();
    private final List<ExecutionFaultException> propagatedFaults = new CopyOnWriteArrayList<>();
    private final List<CallbackException> callbackFailures = new CopyOnWriteArrayList<>();

    // guarded by this
    private boolean started;
    private final List<TaskNode> queued = new ArrayList<>();
    private ExecutorService executor;

    /** Commander configured from ARBOR_* environment variables. */
    public Commander() {
        this("commander", ArborConfig.fromEnvironment());
    }

    public Commander(ArborConfig config) {
        this("commander", config);
    }

    public Commander(String name, ArborConfig config) {
        super(name, NodeKind.COMMANDER);
        this.config = Objects.requireNonNull(config, "config");
        this.defaultFaultPolicy = FaultPolicy.parse(config.getDefaultFaultPolicy());
    }

    public ArborConfig getConfig() {
        return config;
    }

    public FaultPolicy getDefaultFaultPolicy() {
        return defaultFaultPolicy;
    }

    public void addAttachListener(NodeAttachListener listener) {
        attachListeners.add(Objects.requireNonNull(listener, "listener"));
    }

    /** Submits a root with the default fault policy. */
    public void submit(TaskNode node) {
        submit(node, null);
    }

    /**
     * Submits a root job or calls a root handler.
     *
     * @throws InvalidEdgeException    for a commander, or a job/single-shot handler already submitted
     * @throws NodeTerminatedException if this commander was terminated
     */
    public void submit(TaskNode node, FaultPolicy policy) {
        Objects.requireNonNull(node, "node");
        switch (node.getKind()) {
            case JOB -> ((Job) node).submitTo(this, policy);
            case HANDLER -> ((Handler) node).call(this, policy, List.of());
            case COMMANDER -> throw new InvalidEdgeException(node.getId(), "a commander cannot be a child node");
        }
    }

    /**
     * Dispatches queued roots and blocks until every root resolved, then fires
     * {@code AT_COMMANDER_END}. With no roots it resolves immediately.
     *
     * @throws IllegalStateException      if this commander already ran
     * @throws UnhandledFaultException    if faults were propagated up to the commander
     * @throws CommanderTimeoutException  if the configured run timeout elapsed (the tree is terminated)
     * @throws NodeTerminatedException    if the calling thread was interrupted (the tree is terminated)
     */
    public void run() {
        List<TaskNode> roots;
        ExecutorService ex;
        synchronized (this) {
            if (started) {
                throw new IllegalStateException("Commander " + getId() + " already ran");
            }
            started = true;
            executor = createExecutor();
            ex = executor;
            roots = new ArrayList<>(queued);
            queued.clear();
        }
        if (log.isInfoEnabled()) {
            log.info("Commander run start | commanderId={} | roots={} | config={}", getId(), roots.size(), config);
        }
        beginWithoutBody();
        for (TaskNode root : roots) {
            dispatch(ex, root);
        }
        childChanged();
        try {
            awaitRun();
        } finally {
            ex.shutdown();
        }
        if (config.isLogUnobservedFaults()) {
            for (TaskNode failed : getFailures()) {
                log.warn("Unobserved fault | nodeId={} | kind={} | error={}", failed.getId(), failed.getKind(),
                        failed.getError() != null ? failed.getError().getMessage() : null);
            }
        }
        if (log.isInfoEnabled()) {
            log.info("Commander run end | commanderId={} | status={} | propagatedFaults={} | callbackFailures={}",
                    getId(), getStatus(), propagatedFaults.size(), callbackFailures.size());
        }
        if (!propagatedFaults.isEmpty()) {
            throw new UnhandledFaultException(getId(), new ArrayList<>(propagatedFaults));
        }
    }

    public boolean isStarted() {
        synchronized (this) {
            return started;
        }
    }

    /**
     * FAILED nodes in the tree whose fault was neither awaited nor propagated, in depth-first order.
     */
    public List<TaskNode> getFailures() {
        List<TaskNode> failures = new ArrayList<>();
        Deque<TaskNode> stack = new ArrayDeque<>();
        pushChildren(stack, this);
        while (!stack.isEmpty()) {
            TaskNode node = stack.pop();
            if (node.getStatus() == NodeStatus.FAILED && !node.isFaultObserved()) {
                failures.add(node);
            }
            pushChildren(stack, node);
        }
        return failures;
    }

    /** Faults delivered to the commander by roots (or forwarded) with PROPAGATE. */
    public List<ExecutionFaultException> getPropagatedFaults() {
        return List.copyOf(propagatedFaults);
    }

    /** Failures of observing callbacks (end, exception, terminate, commander end) anywhere in the tree. */
    public List<CallbackException> getCallbackFailures() {
        return List.copyOf(callbackFailures);
    }

    void recordCallbackFailures(List<CallbackException> failures) {
        callbackFailures.addAll(failures);
    }

    void nodeAttached(TaskNode node) {
        for (NodeAttachListener listener : attachListeners) {
            try {
                listener.onAttach(node);
            } catch (RuntimeException e) {
                log.warn("Attach listener failed | commanderId={} | nodeId={}", getId(), node.getId(), e);
            }
        }
    }

    void schedule(TaskNode node) {
        ExecutorService ex;
        synchronized (this) {
            if (!started) {
                queued.add(node);
                return;
            }
            ex = executor;
        }
        dispatch(ex, node);
    }

    /** Never dispatched: {@link #run()} marks the commander RUNNING without a body. */
    @Override
    protected Object runBody() {
        throw new IllegalStateException("Commander " + getId() + " has no body; it is driven by run()");
    }

    @Override
    void receivePropagatedFault(ExecutionFaultException fault) {
        propagatedFaults.add(fault);
        if (log.isInfoEnabled()) {
            log.info("Fault propagated to commander | commanderId={} | nodeId={}", getId(), fault.getNodeId());
        }
    }

    @Override
    void onResolved() {
        if (log.isInfoEnabled()) {
            log.info("Commander resolved | commanderId={} | status={}", getId(), getStatus());
        }
        fireObserving(CallbackStage.AT_COMMANDER_END);
    }

    private void awaitRun() {
        long timeout = config.getRunTimeoutSeconds();
        try {
            if (timeout <= 0) {
                awaitResolution();
                return;
            }
            try {
                awaitResolution(timeout, TimeUnit.SECONDS);
            } catch (TimeoutException e) {
                log.warn("Commander run timed out; terminating tree | commanderId={} | timeoutSeconds={}", getId(), timeout);
                terminate();
                awaitResolution();
                throw new CommanderTimeoutException(getId(), timeout);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Commander run interrupted; terminating tree | commanderId={}", getId());
            terminate();
            throw new NodeTerminatedException(getId());
        }
    }

    private void dispatch(ExecutorService ex, TaskNode node) {
        if (log.isDebugEnabled()) {
            log.debug("Dispatch | commanderId={} | nodeId={}", getId(), node.getId());
        }
        node.trackExecution(ex.submit(node::execute));
    }

    private ExecutorService createExecutor() {
        AtomicInteger seq = new AtomicInteger();
        String prefix = config.getThreadNamePrefix();
        ThreadFactory factory = r -> {
            Thread t = new Thread(r, prefix + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        int max = config.getMaxThreads();
        return max > 0 ? Executors.newFixedThreadPool(max, factory) : Executors.newCachedThreadPool(factory);
    }

    private static void pushChildren(Deque<TaskNode> stack, TaskNode node) {
        List<TaskNode> children = node.getChildren();
        for (int i = children.size() - 1; i >= 0; i--) {
            stack.push(children.get(i));
        }
    }
}
