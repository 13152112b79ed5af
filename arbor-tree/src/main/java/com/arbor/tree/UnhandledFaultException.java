package com.arbor.tree;

import java.util.List;

/**
 * Thrown by {@link Commander#run()} after the whole tree resolved when faults were propagated
 * up to the commander. The first fault is the cause; all of them are in {@link #getFaults()}.
 */
public final class UnhandledFaultException extends RuntimeException {

    private final String commanderId;
    private final List<ExecutionFaultException> faults;

    public UnhandledFaultException(String commanderId, List<ExecutionFaultException> faults) {
        super(String.format("Commander %s finished with %d unhandled fault(s); first: %s",
                commanderId, faults.size(), faults.isEmpty() ? "none" : faults.get(0).getMessage()),
                faults.isEmpty() ? null : faults.get(0));
        this.commanderId = commanderId;
        this.faults = List.copyOf(faults);
    }

    public String getCommanderId() {
        return commanderId;
    }

    public List<ExecutionFaultException> getFaults() {
        return faults;
    }
}
