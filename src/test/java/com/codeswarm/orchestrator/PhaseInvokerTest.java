package com.codeswarm.orchestrator;

import com.codeswarm.core.filesystem.SandboxViolationException;
import com.codeswarm.core.state.LoopPhase;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class PhaseInvokerTest {

    private final PhaseInvoker invoker = new PhaseInvoker("test", Duration.ofMillis(200), Duration.ofSeconds(2));

    @AfterEach
    void tearDown() {
        invoker.close();
    }

    @Test
    void testReturnsCallResult() {
        assertEquals("plan", invoker.invoke(LoopPhase.AUDIT, () -> "plan"));
    }

    @Test
    void testFailureIsWrapped() {
        AdapterInvocationException e = assertThrows(AdapterInvocationException.class,
                () -> invoker.invoke(LoopPhase.FIX, () -> {
                    throw new IllegalStateException("boom");
                }));

        assertEquals(LoopPhase.FIX, e.getPhase());
        assertFalse(e.isTimedOut());
        assertTrue(e.getMessage().contains("IllegalStateException: boom"));
    }

    @Test
    void testSandboxViolationPassesThrough() {
        assertThrows(SandboxViolationException.class,
                () -> invoker.invoke(LoopPhase.FIX, () -> {
                    throw new SandboxViolationException("../etc/passwd", "outside sandbox");
                }));
    }

    @Test
    void testTimeoutWaitsForInterruptedCallToReturn() {
        AtomicBoolean finished = new AtomicBoolean();

        AdapterInvocationException e = assertThrows(AdapterInvocationException.class,
                () -> invoker.invoke(LoopPhase.JUDGE, () -> {
                    try {
                        Thread.sleep(5_000);
                    } catch (InterruptedException ie) {
                        Thread.sleep(300);
                        finished.set(true);
                    }
                    return null;
                }));

        assertTrue(e.isTimedOut());
        assertTrue(finished.get(), "call must have returned before the invoker gave up");
        assertEquals("next", invoker.invoke(LoopPhase.AUDIT, () -> "next"));
    }

    @Test
    void testCallerInterruptIsReportedAsRunInterruption() throws Exception {
        PhaseInvoker slow = new PhaseInvoker("interrupt", Duration.ofSeconds(30), Duration.ofSeconds(2));
        CountDownLatch running = new CountDownLatch(1);
        AtomicReference<Throwable> thrown      = new AtomicReference<>();
        AtomicBoolean              interrupted = new AtomicBoolean();

        Thread caller = new Thread(() -> {
            try {
                slow.invoke(LoopPhase.FIX, () -> {
                    running.countDown();
                    Thread.sleep(10_000);
                    return null;
                });
            } catch (RuntimeException e) {
                thrown.set(e);
            }
            interrupted.set(Thread.currentThread().isInterrupted());
        });
        caller.start();

        assertTrue(running.await(5, TimeUnit.SECONDS));
        caller.interrupt();
        caller.join(10_000);
        slow.close();

        assertInstanceOf(RunInterruptedException.class, thrown.get());
        assertEquals(LoopPhase.FIX, ((RunInterruptedException) thrown.get()).getPhase());
        assertTrue(interrupted.get());
    }
}
