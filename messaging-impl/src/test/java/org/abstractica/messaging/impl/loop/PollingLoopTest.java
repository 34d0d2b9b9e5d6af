package org.abstractica.messaging.impl.loop;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for PollingLoop.
 */
class PollingLoopTest
{
    private PollingLoop loop;

    @AfterEach
    void tearDown()
    {
        if (loop != null)
        {
            loop.stop();
        }
    }

    private static boolean sleepOnePoll() throws InterruptedException
    {
        Thread.sleep(5);
        return true;
    }

    // ========== Lifecycle ==========

    @Test
    void newLoop_isIdle()
    {
        loop = new PollingLoop("idle", PollingLoopTest::sleepOnePoll, e -> {});

        assertEquals(LoopState.IDLE, loop.getState());
        assertFalse(loop.isRunning());
    }

    @Test
    void start_runsBodyRepeatedly() throws InterruptedException
    {
        CountDownLatch polled = new CountDownLatch(5);
        loop = new PollingLoop("repeat", () ->
        {
            polled.countDown();
            return sleepOnePoll();
        }, e -> {});

        assertTrue(loop.start());

        assertTrue(polled.await(2, TimeUnit.SECONDS));
        assertTrue(loop.isRunning());
        assertEquals(LoopState.RUNNING, loop.getState());
    }

    @Test
    void start_twice_secondReturnsFalse()
    {
        loop = new PollingLoop("twice", PollingLoopTest::sleepOnePoll, e -> {});

        assertTrue(loop.start());
        assertFalse(loop.start());
    }

    @Test
    void stop_joinsThreadAndStopsPolling() throws InterruptedException
    {
        AtomicInteger polls = new AtomicInteger();
        loop = new PollingLoop("stop", () ->
        {
            polls.incrementAndGet();
            return sleepOnePoll();
        }, e -> {});
        loop.start();
        Thread.sleep(50);

        loop.stop();
        int afterStop = polls.get();
        Thread.sleep(50);

        assertFalse(loop.isRunning());
        assertEquals(LoopState.STOPPED, loop.getState());
        assertEquals(afterStop, polls.get());
    }

    @Test
    void stop_beforeStart_isNoOp()
    {
        loop = new PollingLoop("never", PollingLoopTest::sleepOnePoll, e -> {});

        loop.stop();
        loop.stop();

        assertEquals(LoopState.IDLE, loop.getState());
    }

    @Test
    void start_afterStop_runsAgain() throws InterruptedException
    {
        AtomicInteger polls = new AtomicInteger();
        loop = new PollingLoop("restart", () ->
        {
            polls.incrementAndGet();
            return sleepOnePoll();
        }, e -> {});
        loop.start();
        loop.stop();
        int afterFirstRun = polls.get();

        assertTrue(loop.start());
        Thread.sleep(50);

        assertTrue(loop.isRunning());
        assertTrue(polls.get() > afterFirstRun);
        assertFalse(loop.isStopRequested());
    }

    @Test
    void requestStop_thenStop_endsLoop()
    {
        loop = new PollingLoop("request", PollingLoopTest::sleepOnePoll, e -> {});
        loop.start();

        loop.requestStop();
        assertTrue(loop.isStopRequested());

        loop.stop();
        assertEquals(LoopState.STOPPED, loop.getState());
    }

    @Test
    void stop_fromLoopThread_doesNotDeadlock() throws InterruptedException
    {
        AtomicReference<PollingLoop> self = new AtomicReference<>();
        loop = new PollingLoop("self-stop", () ->
        {
            self.get().stop();
            return true;
        }, e -> {});
        self.set(loop);

        loop.start();

        assertTrue(awaitStopped(loop));
    }

    // ========== Body Outcomes ==========

    @Test
    void bodyReturnsFalse_endsLoop() throws InterruptedException
    {
        AtomicInteger polls = new AtomicInteger();
        loop = new PollingLoop("finite", () -> polls.incrementAndGet() < 3, e -> {});

        loop.start();

        assertTrue(awaitStopped(loop));
        assertEquals(3, polls.get());
    }

    @Test
    void bodyThrows_callsFailureHandlerAndEnds() throws InterruptedException
    {
        CountDownLatch failed = new CountDownLatch(1);
        AtomicReference<Exception> failure = new AtomicReference<>();
        AtomicReference<String> handlerThread = new AtomicReference<>();
        loop = new PollingLoop("failing", () ->
        {
            throw new IllegalStateException("boom");
        }, e ->
        {
            failure.set(e);
            handlerThread.set(Thread.currentThread().getName());
            failed.countDown();
        });

        loop.start();

        assertTrue(failed.await(2, TimeUnit.SECONDS));
        assertInstanceOf(IllegalStateException.class, failure.get());
        assertEquals("failing", handlerThread.get());
        assertTrue(awaitStopped(loop));
    }

    @Test
    void failureHandlerThrows_loopStillEnds() throws InterruptedException
    {
        loop = new PollingLoop("bad-handler", () ->
        {
            throw new Exception("body");
        }, e ->
        {
            throw new RuntimeException("handler");
        });

        loop.start();

        assertTrue(awaitStopped(loop));
    }

    @Test
    void thread_isNamedAndDaemon() throws InterruptedException
    {
        CountDownLatch seen = new CountDownLatch(1);
        AtomicReference<Thread> bodyThread = new AtomicReference<>();
        loop = new PollingLoop("named-loop", () ->
        {
            bodyThread.set(Thread.currentThread());
            seen.countDown();
            return sleepOnePoll();
        }, e -> {});

        loop.start();

        assertTrue(seen.await(2, TimeUnit.SECONDS));
        assertEquals("named-loop", bodyThread.get().getName());
        assertTrue(bodyThread.get().isDaemon());
        assertEquals("named-loop", loop.getName());
    }

    private static boolean awaitStopped(PollingLoop loop) throws InterruptedException
    {
        long deadline = System.currentTimeMillis() + 2000;
        while (System.currentTimeMillis() < deadline)
        {
            if (!loop.isRunning() && loop.getState() == LoopState.STOPPED)
            {
                return true;
            }
            Thread.sleep(5);
        }
        return false;
    }
}
