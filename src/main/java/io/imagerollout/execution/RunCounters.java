package io.imagerollout.execution;

import lombok.Getter;

import java.time.OffsetDateTime;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Counters of one rollout run. A fresh instance is created per run and passed explicitly to the
 * components that update it; all updates are atomic.
 *
 * <p>The restart budget is enforced through {@link #tryReserveRestart(int)}: every real or simulated
 * restart must reserve a slot first, so requested + simulated restarts never exceed the budget,
 * even if actions are executed in parallel.
 */
public class RunCounters {

    @Getter
    private final OffsetDateTime startedAt;

    private final AtomicInteger nagsSent = new AtomicInteger();
    private final AtomicInteger nagsFailed = new AtomicInteger();
    private final AtomicInteger nagsSimulated = new AtomicInteger();
    private final AtomicInteger restartsRequested = new AtomicInteger();
    private final AtomicInteger restartsFailed = new AtomicInteger();
    private final AtomicInteger restartsSimulated = new AtomicInteger();
    private final AtomicInteger restartsSkippedStale = new AtomicInteger();
    private final AtomicInteger restartsSkippedBudget = new AtomicInteger();
    private final AtomicInteger restartsDowngraded = new AtomicInteger();
    private final AtomicInteger restartsCompleted = new AtomicInteger();
    private final AtomicInteger restartsCompletedWithFailure = new AtomicInteger();

    private int restartSlotsReserved = 0;

    public RunCounters(OffsetDateTime startedAt) {
        this.startedAt = startedAt;
    }

    /**
     * Reserve one restart slot if the budget allows it.
     *
     * @param budget maximum number of restarts (real and simulated) for the run
     * @return true if a slot was reserved
     */
    public synchronized boolean tryReserveRestart(int budget) {
        if (restartSlotsReserved >= budget) {
            return false;
        }
        restartSlotsReserved++;
        return true;
    }

    public synchronized boolean isRestartBudgetExhausted(int budget) {
        return restartSlotsReserved >= budget;
    }

    public synchronized int getRestartSlotsReserved() {
        return restartSlotsReserved;
    }

    public void recordNagSent() {
        nagsSent.incrementAndGet();
    }

    public void recordNagFailed() {
        nagsFailed.incrementAndGet();
    }

    public void recordNagSimulated() {
        nagsSimulated.incrementAndGet();
    }

    public void recordRestartRequested() {
        restartsRequested.incrementAndGet();
    }

    public void recordRestartFailed() {
        restartsFailed.incrementAndGet();
    }

    public void recordRestartSimulated() {
        restartsSimulated.incrementAndGet();
    }

    public void recordRestartSkippedStale() {
        restartsSkippedStale.incrementAndGet();
    }

    public void recordRestartSkippedBudget() {
        restartsSkippedBudget.incrementAndGet();
    }

    public void recordRestartDowngraded() {
        restartsDowngraded.incrementAndGet();
    }

    public void recordRestartCompleted() {
        restartsCompleted.incrementAndGet();
    }

    public void recordRestartCompletedWithFailure() {
        restartsCompletedWithFailure.incrementAndGet();
    }

    public int getNagsSent() {
        return nagsSent.get();
    }

    public int getNagsFailed() {
        return nagsFailed.get();
    }

    public int getNagsSimulated() {
        return nagsSimulated.get();
    }

    public int getRestartsRequested() {
        return restartsRequested.get();
    }

    public int getRestartsFailed() {
        return restartsFailed.get();
    }

    public int getRestartsSimulated() {
        return restartsSimulated.get();
    }

    public int getRestartsSkippedStale() {
        return restartsSkippedStale.get();
    }

    public int getRestartsSkippedBudget() {
        return restartsSkippedBudget.get();
    }

    public int getRestartsDowngraded() {
        return restartsDowngraded.get();
    }

    public int getRestartsCompleted() {
        return restartsCompleted.get();
    }

    public int getRestartsCompletedWithFailure() {
        return restartsCompletedWithFailure.get();
    }
}
