package com.example.paperdigest.service;

import com.example.paperdigest.model.UsageSummary;
import com.example.paperdigest.port.BudgetExhaustedException;
import com.example.paperdigest.port.ModelTier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-wide model usage ledger for the current run.
 *
 * <p>Usage pattern:
 * <pre>
 *   budget.start(maxCalls, maxTokens);   // coordinator, before the pipeline
 *   ...                                   // workers call acquireCall / recordTokens
 *   UsageSummary usage = budget.snapshot();
 * </pre>
 *
 * <p>Worker threads of every pool share the same counters; runs are serialized by the
 * coordinator, so one ledger per process is enough. Before the first {@link #start} the
 * budget is unlimited.
 */
@Component
public class CallBudget {

    private static final Logger log = LoggerFactory.getLogger(CallBudget.class);

    private volatile int maxCalls = Integer.MAX_VALUE;
    private volatile long maxTokens = Long.MAX_VALUE;

    private final AtomicInteger calls = new AtomicInteger();
    private final AtomicLong fastTierTokens = new AtomicLong();
    private final AtomicLong smartTierTokens = new AtomicLong();
    private final AtomicBoolean exhausted = new AtomicBoolean();

    // ── Lifecycle ────────────────────────────────────────────────────────────

    /**
     * Resets the counters and arms the ceilings for a new run.
     * Non-positive limits mean unlimited.
     */
    public synchronized void start(int maxCalls, long maxTokens) {
        this.maxCalls = maxCalls > 0 ? maxCalls : Integer.MAX_VALUE;
        this.maxTokens = maxTokens > 0 ? maxTokens : Long.MAX_VALUE;
        calls.set(0);
        fastTierTokens.set(0);
        smartTierTokens.set(0);
        exhausted.set(false);
    }

    // ── Accounting ───────────────────────────────────────────────────────────

    /**
     * Reserves one model call.
     *
     * @throws BudgetExhaustedException when the call or token ceiling is already reached
     */
    public void acquireCall(String task) {
        if (totalTokens() >= maxTokens) {
            markExhausted(task, "token ceiling " + maxTokens + " reached");
        }
        int n = calls.incrementAndGet();
        if (n > maxCalls) {
            calls.decrementAndGet();
            markExhausted(task, "call ceiling " + maxCalls + " reached");
        }
    }

    public void recordTokens(ModelTier tier, long tokens) {
        if (tokens <= 0) return;
        if (tier == ModelTier.FAST) {
            fastTierTokens.addAndGet(tokens);
        } else {
            smartTierTokens.addAndGet(tokens);
        }
    }

    // ── Read ─────────────────────────────────────────────────────────────────

    public boolean isExhausted() {
        return exhausted.get() || calls.get() >= maxCalls || totalTokens() >= maxTokens;
    }

    public UsageSummary snapshot() {
        return new UsageSummary(calls.get(), fastTierTokens.get(), smartTierTokens.get(), isExhausted());
    }

    private long totalTokens() {
        return fastTierTokens.get() + smartTierTokens.get();
    }

    private void markExhausted(String task, String reason) {
        if (exhausted.compareAndSet(false, true)) {
            log.warn("CallBudget: {} while running {}, optional stages will be skipped", reason, task);
        }
        throw new BudgetExhaustedException(task + ": " + reason);
    }
}
