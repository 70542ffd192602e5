package com.codeswarm.orchestrator;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag for one run. The orchestrator polls it at
 * phase boundaries; an adapter call already in progress runs to completion.
 *
 * The token also carries the run id, so callers can cancel a run they started.
 */
public final class CancellationToken {

    private final String        runId;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    private CancellationToken(String runId) {
        this.runId = runId;
    }

    public static CancellationToken create() {
        return new CancellationToken(UUID.randomUUID().toString().substring(0, 8));
    }

    public String getRunId() {
        return runId;
    }

    /** @return true if this call flipped the flag */
    public boolean cancel() {
        return cancelled.compareAndSet(false, true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    @Override
    public String toString() {
        return "CancellationToken{runId=" + runId + ", cancelled=" + cancelled.get() + "}";
    }
}
