package com.codeswarm.orchestrator;

import com.codeswarm.core.filesystem.SandboxViolationException;
import com.codeswarm.core.logging.MdcContext;
import com.codeswarm.core.state.LoopPhase;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs adapter calls on a single worker thread with a per-phase timeout.
 *
 * One worker per run: adapter calls are strictly sequential. A call that times
 * out or whose caller is interrupted is interrupted in turn, and the invoker
 * waits up to a grace period for it to return before the loop moves on. A call
 * that ignores interruption past the grace period delays the next phase instead
 * of running alongside it.
 *
 * Failures surface as {@link AdapterInvocationException}. Two exceptions pass
 * through with their own type: {@link SandboxViolationException} from the
 * adapter, and {@link RunInterruptedException} when the calling thread is
 * interrupted.
 */
class PhaseInvoker implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PhaseInvoker.class);

    static final Duration DEFAULT_DRAIN_GRACE = Duration.ofSeconds(5);

    private final Duration        timeout;
    private final Duration        drainGrace;
    private final ExecutorService worker;

    PhaseInvoker(String runId, Duration timeout) {
        this(runId, timeout, DEFAULT_DRAIN_GRACE);
    }

    PhaseInvoker(String runId, Duration timeout, Duration drainGrace) {
        this.timeout    = timeout;
        this.drainGrace = drainGrace;
        this.worker     = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "codeswarm-phase-" + runId);
            t.setDaemon(true);
            return t;
        });
    }

    <T> T invoke(LoopPhase phase, Callable<T> call) {
        Map<String, String> mdc     = MdcContext.capture();
        AtomicBoolean       started = new AtomicBoolean();
        CountDownLatch      done    = new CountDownLatch(1);

        Future<T> future = worker.submit(() -> {
            started.set(true);
            MdcContext.restore(mdc);
            try {
                return call.call();
            } finally {
                MdcContext.clear();
                done.countDown();
            }
        });

        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);

        } catch (TimeoutException e) {
            log.error("[Orchestrator] {} timed out after {} ms", phase, timeout.toMillis());
            stop(phase, future, started, done);
            throw new AdapterInvocationException(phase,
                    phase + " timed out after " + timeout.toMillis() + " ms", true, e);

        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof SandboxViolationException) {
                throw (SandboxViolationException) cause;
            }
            throw new AdapterInvocationException(phase,
                    phase + " failed: " + cause.getClass().getSimpleName() + ": " + cause.getMessage(), false, cause);

        } catch (InterruptedException e) {
            log.warn("[Orchestrator] Interrupted while waiting for {}", phase);
            stop(phase, future, started, done);
            Thread.currentThread().interrupt();
            throw new RunInterruptedException(phase, e);
        }
    }

    /** Interrupts the call and waits for it to return, keeping the caller's interrupt status. */
    private void stop(LoopPhase phase, Future<?> future, AtomicBoolean started, CountDownLatch done) {
        future.cancel(true);
        if (!started.get()) {
            return;
        }

        boolean interrupted = Thread.interrupted();
        try {
            if (!done.await(drainGrace.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("[Orchestrator] {} still running {} ms after interruption", phase, drainGrace.toMillis());
            }
        } catch (InterruptedException e) {
            interrupted = true;
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    @Override
    public void close() {
        worker.shutdownNow();

        boolean interrupted = Thread.interrupted();
        try {
            if (!worker.awaitTermination(drainGrace.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("[Orchestrator] Phase worker did not stop within {} ms", drainGrace.toMillis());
            }
        } catch (InterruptedException e) {
            interrupted = true;
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }
}
