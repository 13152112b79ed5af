package com.arbor.tree;

import java.util.Locale;

/**
 * What happens to an execution fault beyond the failing node, chosen per submission.
 */
public enum FaultPolicy {
    /** Keep the fault on the node; the parent inspects status/error when it wants to. */
    RECORD,
    /** Also deliver the fault to the parent (up to the commander, where run() raises it). */
    PROPAGATE;

    /**
     * Parses a configured policy name. Null or blank yields {@link #RECORD}.
     *
     * @throws IllegalArgumentException for unknown names
     */
    public static FaultPolicy parse(String value) {
        if (value == null || value.isBlank()) return RECORD;
        return FaultPolicy.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
