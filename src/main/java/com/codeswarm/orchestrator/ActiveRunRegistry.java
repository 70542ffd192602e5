package com.codeswarm.orchestrator;

import jakarta.annotation.PreDestroy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Cancellation tokens of the runs currently in progress, keyed by run id.
 * All of them are cancelled when the application context shuts down.
 */
@Component
public class ActiveRunRegistry {

    private static final Logger log = LoggerFactory.getLogger(ActiveRunRegistry.class);

    private final Map<String, CancellationToken> active = new ConcurrentHashMap<>();

    public CancellationToken open() {
        CancellationToken token = CancellationToken.create();
        active.put(token.getRunId(), token);
        return token;
    }

    public void close(CancellationToken token) {
        active.remove(token.getRunId());
    }

    public int activeCount() {
        return active.size();
    }

    public boolean cancel(String runId) {
        CancellationToken token = active.get(runId);
        if (token == null) {
            return false;
        }
        token.cancel();
        log.info("[Registry] Cancellation requested for run {}", runId);
        return true;
    }

    /** @return number of runs that were asked to cancel */
    public int cancelAll() {
        int count = 0;
        for (CancellationToken token : active.values()) {
            if (token.cancel()) {
                count++;
            }
        }
        if (count > 0) {
            log.info("[Registry] Cancellation requested for {} run(s)", count);
        }
        return count;
    }

    @PreDestroy
    public void shutdown() {
        cancelAll();
    }
}
