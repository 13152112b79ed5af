package com.arbor.tree.callback;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One registered callback: function, fixed positional and keyword arguments, and whether the
 * triggering node is injected. Immutable.
 */
public final class CallbackBinding {

    private final CallbackStage stage;
    private final NodeCallback function;
    private final List<Object> args;
    private final Map<String, Object> kwargs;
    private final boolean injectNode;

    public CallbackBinding(CallbackStage stage, NodeCallback function, List<?> args,
                           Map<String, ?> kwargs, boolean injectNode) {
        this.stage = Objects.requireNonNull(stage, "stage");
        this.function = Objects.requireNonNull(function, "function");
        // copies tolerate null elements, unlike List.copyOf
        this.args = args != null ? Collections.unmodifiableList(new ArrayList<>(args)) : List.of();
        if (kwargs != null) {
            for (String key : kwargs.keySet()) {
                if (key == null || key.isBlank()) {
                    throw new IllegalArgumentException("Callback keyword argument names must be non-blank");
                }
            }
            this.kwargs = Collections.unmodifiableMap(new LinkedHashMap<>(kwargs));
        } else {
            this.kwargs = Map.of();
        }
        this.injectNode = injectNode;
    }

    public CallbackStage getStage() {
        return stage;
    }

    public NodeCallback getFunction() {
        return function;
    }

    public List<Object> getArgs() {
        return args;
    }

    public Map<String, Object> getKwargs() {
        return kwargs;
    }

    public boolean isInjectNode() {
        return injectNode;
    }
}
