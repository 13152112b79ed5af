package com.arbor.tree;

import com.arbor.config.ArborConfig;
import com.arbor.tree.callback.CallbackStage;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Timeout(20)
class HandlerTest {

    private static Commander newCommander() {
        return new Commander(ArborConfig.builder().runTimeoutSeconds(15).build());
    }

    @Test
    void reusable_twoCyclesProduceIndependentResults() {
        Commander commander = newCommander();
        AtomicInteger ends = new AtomicInteger();
        Handler doubler = Handler.reusable("double", args -> (Integer) args.get(0) * 2);
        doubler.addCallback(CallbackStage.AT_HANDLER_END, inv -> ends.incrementAndGet());
        Job job = Job.create("caller", ctx -> List.of(ctx.callAndAwait(doubler, 2), ctx.callAndAwait(doubler, 5)));
        commander.submit(job);

        commander.run();

        assertEquals(List.of(4, 10), job.getResult());
        assertEquals(10, doubler.getResult());
        assertEquals(List.of(5), doubler.getArgs());
        assertEquals(2, doubler.getCycle());
        assertEquals(2, ends.get());
        assertEquals(NodeStatus.COMPLETED, doubler.getStatus());
        assertEquals(List.of(doubler), job.getChildren());
    }

    @Test
    void reusable_canMoveToAnotherParent() {
        Commander commander = newCommander();
        Handler echo = Handler.reusable("echo", args -> args.get(0));
        Job first = Job.create("first", ctx -> ctx.callAndAwait(echo, "one"));
        commander.submit(first);
        first.addCallback(CallbackStage.AT_JOB_END,
                inv -> Job.submit(commander, "second", ctx -> ctx.callAndAwait(echo, "two")));

        commander.run();

        assertEquals("one", first.getResult());
        assertEquals("two", echo.getResult());
        assertEquals(2, echo.getCycle());
        assertTrue(first.getChildren().isEmpty());
        assertEquals("second", echo.getParent().getName());
    }

    @Test
    void singleShot_secondCallRejected() {
        Commander commander = newCommander();
        Handler once = Handler.create("once", args -> "done");
        once.call(commander);
        commander.run();

        assertThrows(InvalidEdgeException.class, () -> once.call(commander));
        assertEquals("done", once.getResult());
        assertEquals(1, once.getCycle());
    }

    @Test
    void reusable_callWhileActiveRejected() throws Exception {
        Commander commander = newCommander();
        CountDownLatch release = new CountDownLatch(1);
        Handler slow = Handler.reusable("slow", args -> {
            assertTrue(release.await(5, TimeUnit.SECONDS));
            return "slow";
        });
        Job job = Job.create("caller", ctx -> {
            ctx.callHandler(slow);
            try {
                ctx.callHandler(slow);
                return "accepted";
            } catch (IllegalStateException e) {
                return "busy";
            } finally {
                release.countDown();
            }
        });
        commander.submit(job);

        commander.run();

        assertEquals("busy", job.getResult());
        assertEquals(1, slow.getCycle());
    }

    @Test
    void reusable_callFromOwnEndCallbackLoops() {
        Commander commander = newCommander();
        List<Object> seen = Collections.synchronizedList(new ArrayList<>());
        Handler counter = Handler.reusable("counter", args -> args.get(0));
        counter.addCallback(CallbackStage.AT_HANDLER_END, inv -> {
            Handler self = (Handler) inv.getNode();
            int n = (Integer) self.getResult();
            seen.add(n);
            if (n < 3) {
                self.call(commander, n + 1);
            }
        });
        counter.call(commander, 1);

        commander.run();

        assertEquals(List.of(1, 2, 3), seen);
        assertEquals(3, counter.getCycle());
        assertTrue(counter.isResolved());
        assertEquals(List.of(counter), commander.getChildren());
        assertTrue(counter.getResolvedAtNanos() < commander.getResolvedAtNanos());
    }

    @Test
    void awaitResolution_returnsOutcomePerCycle() throws Exception {
        Commander commander = newCommander();
        Handler square = Handler.reusable("square", args -> (Integer) args.get(0) * (Integer) args.get(0));
        List<NodeOutcome> outcomes = Collections.synchronizedList(new ArrayList<>());
        Job job = Job.create("caller", ctx -> {
            ctx.callHandler(square, 3);
            outcomes.add(square.awaitResolution());
            ctx.callHandler(square, 4);
            outcomes.add(square.awaitResolution());
            return null;
        });
        commander.submit(job);

        commander.run();

        assertEquals(2, outcomes.size());
        assertEquals(1, outcomes.get(0).getCycle());
        assertEquals(9, outcomes.get(0).getResult());
        assertEquals(2, outcomes.get(1).getCycle());
        assertEquals(16, outcomes.get(1).resultOrThrow());
    }

    @Test
    void invoke_runsDirectlyOutsideTree() throws Exception {
        AtomicInteger starts = new AtomicInteger();
        Handler add = Handler.create("add", args -> (Integer) args.get(0) + (Integer) args.get(1));
        add.addCallback(CallbackStage.AT_HANDLER_START, inv -> starts.incrementAndGet());

        assertEquals(5, add.invoke(2, 3));
        assertEquals(NodeStatus.PENDING, add.getStatus());
        assertEquals(0, add.getCycle());
        assertEquals(0, starts.get());
    }

    @Test
    void submit_rootHandlerRunsWithoutArguments() {
        Commander commander = newCommander();
        Handler noArgs = Handler.create("no-args", List::size);
        commander.submit(noArgs, FaultPolicy.RECORD);

        commander.run();

        assertEquals(0, noArgs.getResult());
        assertSame(commander, noArgs.getParent());
        assertSame(commander, noArgs.getCommander());
    }

    @Test
    void addCallback_jobStageOnHandlerRejected() {
        Handler handler = Handler.create("h", args -> null);

        assertThrows(IllegalArgumentException.class,
                () -> handler.addCallback(CallbackStage.AT_JOB_END, inv -> { }));
    }
}
