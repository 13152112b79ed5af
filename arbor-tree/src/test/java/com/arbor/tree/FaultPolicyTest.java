package com.arbor.tree;

import com.arbor.config.ArborConfig;
import com.arbor.tree.callback.CallbackException;
import com.arbor.tree.callback.CallbackStage;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Timeout(20)
class FaultPolicyTest {

    private static Commander newCommander() {
        return new Commander(ArborConfig.builder().runTimeoutSeconds(15).build());
    }

    private static JobBody failing(String message) {
        return ctx -> {
            throw new IllegalStateException(message);
        };
    }

    @Test
    void record_failedChildLeavesSiblingAndParentAlone() {
        Commander commander = newCommander();
        List<Job> children = Collections.synchronizedList(new ArrayList<>());
        Job parent = Job.create("parent", ctx -> {
            children.add(ctx.submitJob("bad", failing("boom")));
            children.add(ctx.submitJob("good", inner -> "ok"));
            return "parent-ok";
        });
        commander.submit(parent);

        commander.run();

        Job bad = children.get(0);
        Job good = children.get(1);
        assertEquals(NodeStatus.FAILED, bad.getStatus());
        assertEquals(bad.getId(), bad.getError().getNodeId());
        assertEquals("boom", bad.getError().getCause().getMessage());
        assertNull(bad.getResult());
        assertEquals(NodeStatus.COMPLETED, good.getStatus());
        assertEquals(NodeStatus.COMPLETED, parent.getStatus());
        assertEquals("parent-ok", parent.getResult());
        assertEquals(List.of(bad), commander.getFailures());
    }

    @Test
    void failedChild_isResolvedForTheBarrier() {
        Commander commander = newCommander();
        List<Job> children = Collections.synchronizedList(new ArrayList<>());
        Job parent = Job.create("parent", ctx -> {
            children.add(ctx.submitJob("bad", failing("boom")));
            return null;
        });
        commander.submit(parent);

        commander.run();

        Job bad = children.get(0);
        assertTrue(bad.isResolved());
        assertTrue(parent.isResolved());
        assertTrue(bad.getResolvedAtNanos() < parent.getResolvedAtNanos());
    }

    @Test
    void propagate_failsParentOnceChildrenResolved() {
        Commander commander = newCommander();
        List<Job> children = Collections.synchronizedList(new ArrayList<>());
        AtomicInteger parentExceptions = new AtomicInteger();
        Job parent = Job.create("parent", ctx -> {
            children.add(ctx.submitJob(FaultPolicy.PROPAGATE, "bad", failing("boom")));
            children.add(ctx.submitJob("slow-sibling", inner -> {
                Thread.sleep(50);
                return "sibling";
            }));
            return "never-used";
        });
        parent.addCallback(CallbackStage.AT_EXCEPTION, inv -> parentExceptions.incrementAndGet());
        commander.submit(parent);

        commander.run();

        Job bad = children.get(0);
        Job sibling = children.get(1);
        assertEquals(NodeStatus.FAILED, parent.getStatus());
        assertNull(parent.getResult());
        assertSame(bad.getError(), parent.getError().getCause());
        assertEquals(NodeStatus.COMPLETED, sibling.getStatus());
        assertTrue(bad.isFaultObserved());
        assertEquals(1, parentExceptions.get());
        assertEquals(List.of(parent), commander.getFailures());
    }

    @Test
    void propagate_rootFaultRaisedFromRun() {
        Commander commander = newCommander();
        AtomicInteger commanderEnd = new AtomicInteger();
        commander.addCallback(CallbackStage.AT_COMMANDER_END, inv -> commanderEnd.incrementAndGet());
        Job root = Job.create("root", failing("fatal"));
        Job bystander = Job.create("bystander", ctx -> "fine");
        commander.submit(root, FaultPolicy.PROPAGATE);
        commander.submit(bystander);

        UnhandledFaultException e = assertThrows(UnhandledFaultException.class, commander::run);

        assertEquals(1, e.getFaults().size());
        assertEquals(root.getId(), e.getFaults().get(0).getNodeId());
        assertSame(root.getError(), e.getCause());
        assertEquals(commander.getId(), e.getCommanderId());
        assertEquals(NodeStatus.COMPLETED, bystander.getStatus());
        assertTrue(commander.isResolved());
        assertEquals(1, commanderEnd.get());
    }

    @Test
    void defaultPolicy_comesFromConfiguration() {
        Commander commander = new Commander(ArborConfig.builder()
                .runTimeoutSeconds(15)
                .defaultFaultPolicy(ArborConfig.FAULT_POLICY_PROPAGATE)
                .build());
        Job root = Job.create("root", failing("fatal"));
        commander.submit(root);

        assertEquals(FaultPolicy.PROPAGATE, root.getFaultPolicy());
        assertThrows(UnhandledFaultException.class, commander::run);
    }

    @Test
    void await_rethrowsChildFaultAndMarksItObserved() {
        Commander commander = newCommander();
        List<Job> children = Collections.synchronizedList(new ArrayList<>());
        Job parent = Job.create("parent", ctx -> {
            Job bad = ctx.submitJob("bad", failing("boom"));
            children.add(bad);
            try {
                return ctx.await(bad);
            } catch (ExecutionFaultException e) {
                return "recovered:" + e.getCause().getMessage();
            }
        });
        commander.submit(parent);

        commander.run();

        assertEquals("recovered:boom", parent.getResult());
        assertTrue(children.get(0).isFaultObserved());
        assertTrue(commander.getFailures().isEmpty());
    }

    @Test
    void startCallbackFailure_skipsBodyAndFailsNode() {
        Commander commander = newCommander();
        AtomicBoolean ran = new AtomicBoolean();
        AtomicInteger exceptions = new AtomicInteger();
        Job job = Job.create("guarded", ctx -> {
            ran.set(true);
            return null;
        });
        job.addCallback(CallbackStage.AT_JOB_START, inv -> {
            throw new IllegalStateException("quota exceeded");
        });
        job.addCallback(CallbackStage.AT_EXCEPTION, inv -> exceptions.incrementAndGet());
        commander.submit(job);

        commander.run();

        assertFalse(ran.get());
        assertEquals(NodeStatus.FAILED, job.getStatus());
        CallbackException cause = assertInstanceOf(CallbackException.class, job.getError().getCause());
        assertEquals(CallbackStage.AT_JOB_START, cause.getStage());
        assertEquals(1, exceptions.get());
    }

    @Test
    void endCallbackFailure_recordedWithoutFailingNode() {
        Commander commander = newCommander();
        Job job = Job.create("job", ctx -> "ok");
        job.addCallback(CallbackStage.AT_JOB_END, inv -> {
            throw new IllegalArgumentException("bad callback");
        });
        commander.submit(job);

        commander.run();

        assertEquals(NodeStatus.COMPLETED, job.getStatus());
        assertEquals(1, commander.getCallbackFailures().size());
        assertEquals(job.getId(), commander.getCallbackFailures().get(0).getNodeId());
    }

    @Test
    void handlerFailure_firesExceptionStageWithNode() {
        Commander commander = newCommander();
        List<TaskNode> failedNodes = Collections.synchronizedList(new ArrayList<>());
        Handler handler = Handler.create("broken", args -> {
            throw new UnsupportedOperationException("nope");
        });
        handler.addCallback(CallbackStage.AT_EXCEPTION, inv -> failedNodes.add(inv.getNode()));
        commander.submit(handler);

        commander.run();

        assertEquals(List.of(handler), failedNodes);
        assertInstanceOf(UnsupportedOperationException.class, handler.getError().getCause());
        assertThrows(ExecutionFaultException.class, () -> handler.awaitResolution().resultOrThrow());
    }
}
