package com.arbor.features.debug;

import com.arbor.tree.TaskNode;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Point-in-time view of a (sub)tree as nested maps or JSON. */
public final class TreeSnapshot {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private TreeSnapshot() {
    }

    /**
     * Nested map per node: id, name, kind, status, cycle, resolved, resultPresent, error (message,
     * only when failed), faultPolicy and children.
     */
    public static Map<String, Object> toMap(TaskNode node) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("id", node.getId());
        out.put("name", node.getName());
        out.put("kind", node.getKind().name());
        out.put("status", node.getStatus().name());
        out.put("cycle", node.getCycle());
        out.put("resolved", node.isResolved());
        out.put("resultPresent", node.getResult() != null);
        if (node.getError() != null) {
            Throwable cause = node.getError().getCause();
            out.put("error", cause != null ? cause.toString() : node.getError().getMessage());
        }
        if (node.getParent() != null) {
            out.put("faultPolicy", node.getFaultPolicy().name());
        }
        List<Map<String, Object>> children = new ArrayList<>();
        for (TaskNode child : node.getChildren()) {
            children.add(toMap(child));
        }
        out.put("children", children);
        return out;
    }

    public static String toJson(TaskNode node) throws JsonProcessingException {
        return MAPPER.writeValueAsString(toMap(node));
    }
}
