package com.arbor.config;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ArborConfigTest {

    @Test
    void fromMap_emptyUsesDefaults() {
        ArborConfig config = ArborConfig.fromMap(Map.of());

        assertEquals("arbor-node-", config.getThreadNamePrefix());
        assertEquals(0, config.getMaxThreads());
        assertEquals(0, config.getRunTimeoutSeconds());
        assertEquals(ArborConfig.FAULT_POLICY_RECORD, config.getDefaultFaultPolicy());
        assertTrue(config.isLogUnobservedFaults());
    }

    @Test
    void fromMap_readsAllVariables() {
        ArborConfig config = ArborConfig.fromMap(Map.of(
                "ARBOR_THREAD_NAME_PREFIX", " tree- ",
                "ARBOR_MAX_THREADS", "8",
                "ARBOR_RUN_TIMEOUT_SECONDS", "30",
                "ARBOR_DEFAULT_FAULT_POLICY", "propagate",
                "ARBOR_LOG_UNOBSERVED_FAULTS", "false"));

        assertEquals("tree-", config.getThreadNamePrefix());
        assertEquals(8, config.getMaxThreads());
        assertEquals(30, config.getRunTimeoutSeconds());
        assertEquals(ArborConfig.FAULT_POLICY_PROPAGATE, config.getDefaultFaultPolicy());
        assertFalse(config.isLogUnobservedFaults());
    }

    @Test
    void fromMap_unparsableNumbersFallBackToDefaults() {
        ArborConfig config = ArborConfig.fromMap(Map.of(
                "ARBOR_MAX_THREADS", "many",
                "ARBOR_RUN_TIMEOUT_SECONDS", "soon"));

        assertEquals(0, config.getMaxThreads());
        assertEquals(0, config.getRunTimeoutSeconds());
    }

    @Test
    void fromMap_malformedPolicyAndNegativeLimitsFallBackToDefaults() {
        ArborConfig config = ArborConfig.fromMap(Map.of(
                "ARBOR_DEFAULT_FAULT_POLICY", "IGNORE",
                "ARBOR_MAX_THREADS", "-4",
                "ARBOR_RUN_TIMEOUT_SECONDS", "-1"));

        assertEquals(ArborConfig.FAULT_POLICY_RECORD, config.getDefaultFaultPolicy());
        assertEquals(0, config.getMaxThreads());
        assertEquals(0, config.getRunTimeoutSeconds());
    }

    @Test
    void builder_rejectsUnknownFaultPolicy() {
        assertThrows(IllegalArgumentException.class,
                () -> ArborConfig.builder().defaultFaultPolicy("IGNORE"));
    }

    @Test
    void builder_rejectsNegativeLimits() {
        assertThrows(IllegalArgumentException.class, () -> ArborConfig.builder().maxThreads(-1));
        assertThrows(IllegalArgumentException.class, () -> ArborConfig.builder().runTimeoutSeconds(-5));
    }
}
