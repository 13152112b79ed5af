package com.arbor.features.metrics;

import com.arbor.tree.Commander;
import com.arbor.tree.NodeKind;
import com.arbor.tree.TaskNode;
import com.arbor.tree.callback.CallbackStage;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Records node lifecycle metrics through callbacks:
 * <ul>
 *   <li>{@code arbor.node.starts}, {@code arbor.node.completions}, {@code arbor.node.failures},
 *   {@code arbor.node.terminations} counters tagged by kind and name</li>
 *   <li>{@code arbor.node.duration} timer from start to terminal status, tagged by kind, name and status</li>
 *   <li>{@code arbor.commander.runs} counter tagged by final commander status</li>
 * </ul>
 * Meter names and tags are fixed; node ids are never used as tags.
 */
public final class MetricsCallbacks {

    private static final Logger log = LoggerFactory.getLogger(MetricsCallbacks.class);

    static final String NODE_STARTS = "arbor.node.starts";
    static final String NODE_COMPLETIONS = "arbor.node.completions";
    static final String NODE_FAILURES = "arbor.node.failures";
    static final String NODE_TERMINATIONS = "arbor.node.terminations";
    static final String NODE_DURATION = "arbor.node.duration";
    static final String COMMANDER_RUNS = "arbor.commander.runs";

    private final MeterRegistry registry;
    private final Set<String> attachedIds = ConcurrentHashMap.newKeySet();
    private final Map<String, Long> startNanos = new ConcurrentHashMap<>();

    public MetricsCallbacks(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    /** Uses an in-memory {@link SimpleMeterRegistry}. */
    public MetricsCallbacks() {
        this(new SimpleMeterRegistry());
    }

    /**
     * Attaches metrics to the commander and to every node attached under it from now on.
     * Call before {@link Commander#run()} and before submitting roots to cover the whole tree.
     */
    public static MetricsCallbacks install(Commander commander, MeterRegistry registry) {
        MetricsCallbacks metrics = new MetricsCallbacks(registry);
        metrics.attach(commander);
        commander.addAttachListener(metrics::attach);
        return metrics;
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    /** Registers the metric callbacks on the node. A node is attached at most once. */
    public void attach(TaskNode node) {
        Objects.requireNonNull(node, "node");
        if (!attachedIds.add(node.getId())) {
            return;
        }
        if (node.getKind() == NodeKind.COMMANDER) {
            node.addCallback(CallbackStage.AT_COMMANDER_END, inv ->
                    registry.counter(COMMANDER_RUNS, "status", status(inv.getNode())).increment());
            node.addCallback(CallbackStage.AT_TERMINATE, inv -> counter(NODE_TERMINATIONS, inv.getNode()));
            return;
        }
        node.addCallback(CallbackStage.startOf(node.getKind()), inv -> {
            TaskNode n = inv.getNode();
            startNanos.put(n.getId(), System.nanoTime());
            counter(NODE_STARTS, n);
        });
        node.addCallback(CallbackStage.endOf(node.getKind()), inv -> finished(NODE_COMPLETIONS, inv.getNode()));
        node.addCallback(CallbackStage.AT_EXCEPTION, inv -> finished(NODE_FAILURES, inv.getNode()));
        node.addCallback(CallbackStage.AT_TERMINATE, inv -> finished(NODE_TERMINATIONS, inv.getNode()));
        if (log.isDebugEnabled()) {
            log.debug("Metrics attached | nodeId={} | kind={}", node.getId(), node.getKind());
        }
    }

    private void finished(String counterName, TaskNode node) {
        counter(counterName, node);
        Long started = startNanos.remove(node.getId());
        // a node terminated while PENDING never started
        if (started == null) return;
        Timer.builder(NODE_DURATION)
                .tag("kind", kind(node))
                .tag("name", node.getName())
                .tag("status", status(node))
                .register(registry)
                .record(System.nanoTime() - started, TimeUnit.NANOSECONDS);
    }

    private void counter(String name, TaskNode node) {
        registry.counter(name, "kind", kind(node), "name", node.getName()).increment();
    }

    private static String kind(TaskNode node) {
        return node.getKind().name().toLowerCase(Locale.ROOT);
    }

    private static String status(TaskNode node) {
        return node.getStatus().name().toLowerCase(Locale.ROOT);
    }
}
