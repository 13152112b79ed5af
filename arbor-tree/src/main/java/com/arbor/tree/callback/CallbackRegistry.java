package com.arbor.tree.callback;

import com.arbor.tree.NodeKind;
import com.arbor.tree.TaskNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Per-node registry of callback bindings keyed by stage. Bindings of a stage fire in
 * registration order, synchronously with the transition that triggers them.
 * <p>
 * Two firing modes:
 * <ul>
 *   <li>{@link #fire} – blocking: the first failing binding aborts the stage with a
 *   {@link CallbackException} (used for start stages, so a failing start callback keeps the body from running)</li>
 *   <li>{@link #fireAll} – observing: every binding runs; failures are logged and returned (end, exception,
 *   terminate and commander-end stages)</li>
 * </ul>
 */
public final class CallbackRegistry {

    private static final Logger log = LoggerFactory.getLogger(CallbackRegistry.class);

    private final NodeKind kind;
    private final Map<CallbackStage, List<CallbackBinding>> byStage = new EnumMap<>(CallbackStage.class);

    public CallbackRegistry(NodeKind kind) {
        this.kind = Objects.requireNonNull(kind, "kind");
        // populated once so concurrent readers never see the map change shape
        for (CallbackStage stage : CallbackStage.values()) {
            byStage.put(stage, new CopyOnWriteArrayList<>());
        }
    }

    /**
     * Appends a binding for the stage.
     *
     * @throws IllegalArgumentException if the stage does not apply to this registry's node kind
     *                                  (e.g. {@code AT_JOB_START} on a handler)
     */
    public CallbackBinding register(CallbackStage stage, NodeCallback function, List<?> args,
                                    Map<String, ?> kwargs, boolean injectNode) {
        Objects.requireNonNull(stage, "stage");
        Objects.requireNonNull(function, "function");
        if (!stage.appliesTo(kind)) {
            throw new IllegalArgumentException("Stage " + stage + " does not apply to " + kind + " nodes");
        }
        CallbackBinding binding = new CallbackBinding(stage, function, args, kwargs, injectNode);
        byStage.get(stage).add(binding);
        return binding;
    }

    /** Snapshot of bindings for the stage in registration order. */
    public List<CallbackBinding> bindings(CallbackStage stage) {
        if (stage == null) return List.of();
        return Collections.unmodifiableList(new ArrayList<>(byStage.get(stage)));
    }

    /** Total number of bindings over all stages. */
    public int size() {
        int n = 0;
        for (List<CallbackBinding> list : byStage.values()) {
            n += list.size();
        }
        return n;
    }

    /**
     * Runs every binding for the stage in order; stops at the first failure.
     *
     * @throws CallbackException wrapping the first failure
     */
    public void fire(CallbackStage stage, TaskNode node) {
        if (stage == null) return;
        List<CallbackBinding> bindings = byStage.get(stage);
        int index = 0;
        for (CallbackBinding binding : bindings) {
            try {
                invoke(binding, node);
            } catch (Exception e) {
                throw new CallbackException(node.getId(), stage, index, e);
            }
            index++;
        }
    }

    /**
     * Runs every binding for the stage in order. A failing binding is logged and does not keep
     * later bindings from running.
     *
     * @return failures in binding order; empty when all bindings succeeded
     */
    public List<CallbackException> fireAll(CallbackStage stage, TaskNode node) {
        if (stage == null) return List.of();
        List<CallbackBinding> bindings = byStage.get(stage);
        List<CallbackException> failures = null;
        int index = 0;
        for (CallbackBinding binding : bindings) {
            try {
                invoke(binding, node);
            } catch (Exception e) {
                CallbackException failure = new CallbackException(node.getId(), stage, index, e);
                log.warn("Callback failed; continuing | nodeId={} | stage={} | index={}", node.getId(), stage, index, e);
                if (failures == null) failures = new ArrayList<>();
                failures.add(failure);
            }
            index++;
        }
        return failures != null ? failures : List.of();
    }

    private static void invoke(CallbackBinding binding, TaskNode node) throws Exception {
        CallbackInvocation invocation = new CallbackInvocation(
                binding.getStage(),
                binding.getArgs(),
                binding.getKwargs(),
                binding.isInjectNode() ? node : null);
        binding.getFunction().onStage(invocation);
    }
}
