package com.arbor.tree;

/**
 * Thrown by {@link Commander#run()} when the configured run timeout elapsed. The tree has been
 * terminated by the time this is thrown.
 */
public final class CommanderTimeoutException extends RuntimeException {

    private final String commanderId;
    private final long timeoutSeconds;

    public CommanderTimeoutException(String commanderId, long timeoutSeconds) {
        super(String.format("Commander %s did not resolve within %d second(s); tree terminated",
                commanderId, timeoutSeconds));
        this.commanderId = commanderId;
        this.timeoutSeconds = timeoutSeconds;
    }

    public String getCommanderId() {
        return commanderId;
    }

    public long getTimeoutSeconds() {
        return timeoutSeconds;
    }
}
