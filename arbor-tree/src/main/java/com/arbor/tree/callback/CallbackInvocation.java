package com.arbor.tree.callback;

import com.arbor.tree.TaskNode;

import java.util.List;
import java.util.Map;

/**
 * Arguments handed to a {@link NodeCallback} when its stage fires.
 */
public final class CallbackInvocation {

    private final CallbackStage stage;
    private final List<Object> args;
    private final Map<String, Object> kwargs;
    private final TaskNode node;

    CallbackInvocation(CallbackStage stage, List<Object> args, Map<String, Object> kwargs, TaskNode node) {
        this.stage = stage;
        this.args = args;
        this.kwargs = kwargs;
        this.node = node;
    }

    public CallbackStage getStage() {
        return stage;
    }

    /** Positional arguments fixed at registration. Unmodifiable. */
    public List<Object> getArgs() {
        return args;
    }

    /** Keyword arguments fixed at registration. Unmodifiable. */
    public Map<String, Object> getKwargs() {
        return kwargs;
    }

    /** Triggering node, or null if the binding did not ask for injection. */
    public TaskNode getNode() {
        return node;
    }

    public boolean hasNode() {
        return node != null;
    }

    @SuppressWarnings("unchecked")
    public <T> T getArg(int index, Class<T> type) {
        if (index < 0 || index >= args.size()) return null;
        Object v = args.get(index);
        return (v != null && type.isInstance(v)) ? (T) v : null;
    }

    @SuppressWarnings("unchecked")
    public <T> T getKwarg(String key, Class<T> type) {
        Object v = kwargs.get(key);
        return (v != null && type.isInstance(v)) ? (T) v : null;
    }
}
