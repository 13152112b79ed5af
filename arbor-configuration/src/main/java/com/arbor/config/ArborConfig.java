package com.arbor.config;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Configuration for a commander run, loaded from environment variables.
 * <p>
 * Threads: ARBOR_THREAD_NAME_PREFIX, ARBOR_MAX_THREADS (0 = unbounded cached pool).
 * Run: ARBOR_RUN_TIMEOUT_SECONDS (0 = wait forever), ARBOR_DEFAULT_FAULT_POLICY (RECORD or PROPAGATE),
 * ARBOR_LOG_UNOBSERVED_FAULTS.
 * <p>
 * Malformed environment values (non-numeric limits, negative limits, unknown fault policy) fall back
 * to their defaults. The {@link Builder} setters reject the same values with IllegalArgumentException.
 */
public final class ArborConfig {

    private static final String ENV_THREAD_NAME_PREFIX = "ARBOR_THREAD_NAME_PREFIX";
    private static final String ENV_MAX_THREADS = "ARBOR_MAX_THREADS";
    private static final String ENV_RUN_TIMEOUT_SECONDS = "ARBOR_RUN_TIMEOUT_SECONDS";
    private static final String ENV_DEFAULT_FAULT_POLICY = "ARBOR_DEFAULT_FAULT_POLICY";
    private static final String ENV_LOG_UNOBSERVED_FAULTS = "ARBOR_LOG_UNOBSERVED_FAULTS";

    public static final String FAULT_POLICY_RECORD = "RECORD";
    public static final String FAULT_POLICY_PROPAGATE = "PROPAGATE";
    private static final Set<String> FAULT_POLICIES = Set.of(FAULT_POLICY_RECORD, FAULT_POLICY_PROPAGATE);

    private static final String DEFAULT_THREAD_NAME_PREFIX = "arbor-node-";
    private static final int DEFAULT_MAX_THREADS = 0;
    private static final long DEFAULT_RUN_TIMEOUT_SECONDS = 0;
    private static final String DEFAULT_FAULT_POLICY = FAULT_POLICY_RECORD;
    private static final boolean DEFAULT_LOG_UNOBSERVED_FAULTS = true;

    private final String threadNamePrefix;
    private final int maxThreads;
    private final long runTimeoutSeconds;
    private final String defaultFaultPolicy;
    private final boolean logUnobservedFaults;

    private ArborConfig(Builder b) {
        this.threadNamePrefix = b.threadNamePrefix;
        this.maxThreads = b.maxThreads;
        this.runTimeoutSeconds = b.runTimeoutSeconds;
        this.defaultFaultPolicy = b.defaultFaultPolicy;
        this.logUnobservedFaults = b.logUnobservedFaults;
    }

    /** Prefix for executor thread names (e.g. arbor-node-3). Default {@code arbor-node-}. */
    public String getThreadNamePrefix() {
        return threadNamePrefix;
    }

    /**
     * Upper bound on executor threads. 0 means an unbounded cached pool. A bounded pool can stall
     * when bodies block on {@code await} of descendants that have no free thread left to run on.
     */
    public int getMaxThreads() {
        return maxThreads;
    }

    /** Seconds a commander run may take before the tree is terminated. 0 = no limit. */
    public long getRunTimeoutSeconds() {
        return runTimeoutSeconds;
    }

    /** Fault policy applied when a submission does not name one: RECORD or PROPAGATE. */
    public String getDefaultFaultPolicy() {
        return defaultFaultPolicy;
    }

    /** Whether failed nodes whose fault nobody inspected are logged at WARN when a run ends. */
    public boolean isLogUnobservedFaults() {
        return logUnobservedFaults;
    }

    public static ArborConfig fromEnvironment() {
        return fromMap(System.getenv());
    }

    /** Same parsing as {@link #fromEnvironment()} over an explicit variable map. */
    public static ArborConfig fromMap(Map<String, String> env) {
        Objects.requireNonNull(env, "env");
        return builder()
                .threadNamePrefix(getEnv(env, ENV_THREAD_NAME_PREFIX, DEFAULT_THREAD_NAME_PREFIX))
                .maxThreads(nonNegative(parseInt(env.get(ENV_MAX_THREADS), DEFAULT_MAX_THREADS), DEFAULT_MAX_THREADS))
                .runTimeoutSeconds(nonNegative(parseLong(env.get(ENV_RUN_TIMEOUT_SECONDS), DEFAULT_RUN_TIMEOUT_SECONDS),
                        DEFAULT_RUN_TIMEOUT_SECONDS))
                .defaultFaultPolicy(parseFaultPolicy(env.get(ENV_DEFAULT_FAULT_POLICY), DEFAULT_FAULT_POLICY))
                .logUnobservedFaults(parseBoolean(env.get(ENV_LOG_UNOBSERVED_FAULTS), DEFAULT_LOG_UNOBSERVED_FAULTS))
                .build();
    }

    public static ArborConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    private static boolean parseBoolean(String value, boolean defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        return "true".equalsIgnoreCase(value.trim()) || "1".equals(value.trim());
    }

    private static int parseInt(String value, int defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static long parseLong(String value, long defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static int nonNegative(int value, int defaultValue) {
        return value >= 0 ? value : defaultValue;
    }

    private static long nonNegative(long value, long defaultValue) {
        return value >= 0 ? value : defaultValue;
    }

    private static String parseFaultPolicy(String value, String defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        return FAULT_POLICIES.contains(normalized) ? normalized : defaultValue;
    }

    private static String getEnv(Map<String, String> env, String key, String defaultValue) {
        String v = env.get(key);
        return (v != null && !v.isBlank()) ? v.trim() : defaultValue;
    }

    @Override
    public String toString() {
        return "ArborConfig{threadNamePrefix=" + threadNamePrefix
                + ", maxThreads=" + maxThreads
                + ", runTimeoutSeconds=" + runTimeoutSeconds
                + ", defaultFaultPolicy=" + defaultFaultPolicy
                + ", logUnobservedFaults=" + logUnobservedFaults + "}";
    }

    public static final class Builder {
        private String threadNamePrefix = DEFAULT_THREAD_NAME_PREFIX;
        private int maxThreads = DEFAULT_MAX_THREADS;
        private long runTimeoutSeconds = DEFAULT_RUN_TIMEOUT_SECONDS;
        private String defaultFaultPolicy = DEFAULT_FAULT_POLICY;
        private boolean logUnobservedFaults = DEFAULT_LOG_UNOBSERVED_FAULTS;

        public Builder threadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix != null && !threadNamePrefix.isBlank()
                    ? threadNamePrefix : DEFAULT_THREAD_NAME_PREFIX;
            return this;
        }

        public Builder maxThreads(int maxThreads) {
            if (maxThreads < 0) throw new IllegalArgumentException("maxThreads must be >= 0: " + maxThreads);
            this.maxThreads = maxThreads;
            return this;
        }

        public Builder runTimeoutSeconds(long runTimeoutSeconds) {
            if (runTimeoutSeconds < 0) {
                throw new IllegalArgumentException("runTimeoutSeconds must be >= 0: " + runTimeoutSeconds);
            }
            this.runTimeoutSeconds = runTimeoutSeconds;
            return this;
        }

        /**
         * @throws IllegalArgumentException if the value is neither RECORD nor PROPAGATE (case-insensitive)
         */
        public Builder defaultFaultPolicy(String defaultFaultPolicy) {
            String normalized = defaultFaultPolicy != null
                    ? defaultFaultPolicy.trim().toUpperCase(Locale.ROOT) : DEFAULT_FAULT_POLICY;
            if (!FAULT_POLICIES.contains(normalized)) {
                throw new IllegalArgumentException("Unknown fault policy: " + defaultFaultPolicy
                        + " (expected " + FAULT_POLICY_RECORD + " or " + FAULT_POLICY_PROPAGATE + ")");
            }
            this.defaultFaultPolicy = normalized;
            return this;
        }

        public Builder logUnobservedFaults(boolean logUnobservedFaults) {
            this.logUnobservedFaults = logUnobservedFaults;
            return this;
        }

        public ArborConfig build() {
            return new ArborConfig(this);
        }
    }
}
