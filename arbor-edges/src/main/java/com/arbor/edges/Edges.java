package com.arbor.edges;

import com.arbor.tree.InvalidEdgeException;
import com.arbor.tree.TaskNode;
import com.arbor.tree.callback.CallbackStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Edges between nodes, expressed as end-stage callbacks that schedule the next node.
 * <p>
 * An edge fires when its source completes ({@code AT_JOB_END} / {@code AT_HANDLER_END}); failed or
 * terminated sources fire nothing. The target is attached under {@code parent}, or under the
 * source's parent at firing time when no parent is given. Scheduling failures inside the callback
 * are recorded as callback failures on the commander.
 */
public final class Edges {

    private static final Logger log = LoggerFactory.getLogger(Edges.class);

    private Edges() {
    }

    /** {@code from} completes, then {@code to} is scheduled under {@code from}'s parent. */
    public static void addEdge(TaskNode from, EdgeTarget to) {
        addEdge(from, to, null);
    }

    public static void addEdge(TaskNode from, TaskNode to, TaskNode parent) {
        addEdge(from, EdgeTarget.of(to), parent);
    }

    /**
     * {@code from} completes, then {@code to} is scheduled under {@code parent}.
     *
     * @throws InvalidEdgeException if {@code from} is a commander
     */
    public static void addEdge(TaskNode from, EdgeTarget to, TaskNode parent) {
        Objects.requireNonNull(to, "to");
        CallbackStage stage = endStageOf(from);
        from.addCallback(stage, inv -> {
            TaskNode source = inv.getNode();
            TaskNode launched = to.fire(parentFor(source, parent));
            if (log.isInfoEnabled()) {
                log.info("Edge fired | fromId={} | target={} | launchedId={}", source.getId(), to.getLabel(), launched.getId());
            }
        });
    }

    /** Routes on {@code from}'s result. */
    public static void addConditionalEdge(TaskNode from, Map<?, EdgeTarget> routes, TaskNode parent) {
        addConditionalEdge(from, TaskNode::getResult, routes, parent);
    }

    /**
     * When {@code from} completes, {@code router} computes a key from it and the matching route is
     * scheduled. A key with no route schedules nothing and is not a fault.
     *
     * @throws InvalidEdgeException if {@code from} is a commander or a route has no target
     */
    public static void addConditionalEdge(TaskNode from, Function<? super TaskNode, ?> router,
                                          Map<?, EdgeTarget> routes, TaskNode parent) {
        Objects.requireNonNull(router, "router");
        Objects.requireNonNull(routes, "routes");
        CallbackStage stage = endStageOf(from);
        Map<Object, EdgeTarget> table = new LinkedHashMap<>();
        for (Map.Entry<?, EdgeTarget> route : routes.entrySet()) {
            if (route.getValue() == null) {
                throw new InvalidEdgeException(from.getId(), "route '" + route.getKey() + "' has no target");
            }
            table.put(route.getKey(), route.getValue());
        }
        from.addCallback(stage, inv -> {
            TaskNode source = inv.getNode();
            Object key = router.apply(source);
            EdgeTarget target = match(table, key);
            if (target == null) {
                log.debug("Conditional edge | no matching route | fromId={} | key={} | routes={}", source.getId(), key, table.keySet());
                return;
            }
            TaskNode launched = target.fire(parentFor(source, parent));
            if (log.isInfoEnabled()) {
                log.info("Conditional edge fired | fromId={} | key={} | target={} | launchedId={}",
                        source.getId(), key, target.getLabel(), launched.getId());
            }
        });
    }

    private static CallbackStage endStageOf(TaskNode from) {
        Objects.requireNonNull(from, "from");
        return switch (from.getKind()) {
            case JOB, HANDLER -> CallbackStage.endOf(from.getKind());
            case COMMANDER -> throw new InvalidEdgeException(from.getId(), "a commander cannot be the source of an edge");
        };
    }

    private static TaskNode parentFor(TaskNode source, TaskNode parent) {
        if (parent != null) return parent;
        TaskNode p = source.getParent();
        if (p == null) {
            throw new IllegalStateException("Edge source " + source.getId() + " has no parent to schedule under");
        }
        return p;
    }

    /** Exact key match first, then string form, so "200" routes an Integer 200 result. */
    private static EdgeTarget match(Map<Object, EdgeTarget> table, Object key) {
        EdgeTarget exact = table.get(key);
        if (exact != null || key == null) return exact;
        String text = key.toString();
        for (Map.Entry<Object, EdgeTarget> route : table.entrySet()) {
            if (route.getKey() != null && text.equals(route.getKey().toString())) {
                return route.getValue();
            }
        }
        return null;
    }
}
