package io.imagerollout.monitor;

import io.imagerollout.broker.BrokerClient;
import io.imagerollout.broker.BrokerException;
import io.imagerollout.execution.RunCounters;
import io.imagerollout.metrics.MetricsProvider;
import io.imagerollout.models.PendingTask;
import io.imagerollout.models.PowerActionStatus;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static io.imagerollout.metrics.MetricsConstants.MONITOR_ELAPSED_SECONDS_METRIC_NAME;
import static io.imagerollout.metrics.MetricsConstants.OUTCOME_TAG;
import static io.imagerollout.metrics.MetricsConstants.PENDING_POWER_ACTIONS_METRIC_NAME;
import static io.imagerollout.metrics.MetricsConstants.RESTARTS_COMPLETED_METRIC_NAME;
import static io.imagerollout.metrics.MetricsUtils.buildSiteTags;

/**
 * Polls submitted power actions until all of them reach a terminal state or the monitor timeout
 * elapses. Polling runs as a fixed-delay task on a single scheduler thread; the caller waits on a
 * deadline and cancels the schedule when it passes.
 */
@Slf4j
public class PowerActionMonitor {

    private final BrokerClient brokerClient;
    private final MetricsProvider metricsProvider;
    private final Duration timeout;
    private final Duration pollInterval;

    public PowerActionMonitor(BrokerClient brokerClient, MetricsProvider metricsProvider,
                              Duration timeout, Duration pollInterval) {
        if (pollInterval.isZero() || pollInterval.isNegative()) {
            throw new IllegalArgumentException("Poll interval must be positive: " + pollInterval);
        }
        this.brokerClient = brokerClient;
        this.metricsProvider = metricsProvider;
        this.timeout = timeout;
        this.pollInterval = pollInterval;
    }

    /**
     * Wait for the given power actions. Returns within the monitor timeout plus one poll interval.
     *
     * @param tasks power actions handed over by the executor
     * @param counters counters of the current run, updated with completed restarts
     * @return tallies of the tasks that finished, and the tasks still pending at the deadline
     */
    public MonitorResult await(List<PendingTask> tasks, RunCounters counters) {
        if (tasks.isEmpty()) {
            log.info("No power actions to monitor");
            return new MonitorResult(true, 0, 0, List.of(), false, Duration.ZERO);
        }

        List<PendingTask> pending = new CopyOnWriteArrayList<>(tasks);
        AtomicInteger succeeded = new AtomicInteger();
        AtomicInteger failed = new AtomicInteger();
        AtomicBoolean stopped = new AtomicBoolean();
        CountDownLatch allDone = new CountDownLatch(1);
        long startNanos = System.nanoTime();

        log.info("Monitoring {} power action(s) for up to {}s", pending.size(), timeout.toSeconds());
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "power-action-monitor");
            thread.setDaemon(true);
            return thread;
        });

        boolean finished = false;
        List<PendingTask> remaining;
        int succeededCount;
        int failedCount;
        try {
            scheduler.scheduleWithFixedDelay(() -> {
                try {
                    pollRound(pending, counters, succeeded, failed, stopped, startNanos);
                } catch (RuntimeException e) {
                    log.error("Power action poll round failed: {}", e.getMessage(), e);
                }
                if (pending.isEmpty()) {
                    allDone.countDown();
                }
            }, 0, pollInterval.toMillis(), TimeUnit.MILLISECONDS);

            finished = allDone.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while monitoring power actions");
        } finally {
            // Completions are tallied under this lock; the poller may outlive the shutdown below.
            synchronized (pending) {
                stopped.set(true);
                remaining = List.copyOf(pending);
                succeededCount = succeeded.get();
                failedCount = failed.get();
            }
            scheduler.shutdownNow();
            try {
                if (!scheduler.awaitTermination(pollInterval.toMillis(), TimeUnit.MILLISECONDS)) {
                    log.warn("Power action poller did not stop within {}ms", pollInterval.toMillis());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }

        Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
        metricsProvider.gauge(PENDING_POWER_ACTIONS_METRIC_NAME, remaining.size(), Map.of());
        if (!finished && !remaining.isEmpty()) {
            log.warn("Monitor timeout of {}s reached with {} power action(s) still pending; they are no longer tracked:",
                    timeout.toSeconds(), remaining.size());
            for (PendingTask task : remaining) {
                log.warn("  [Site: {}] {} (task {}, submitted {})", task.getSiteId(), task.getMachineName(),
                        task.getTaskId(), task.getSubmittedAt());
            }
        } else {
            log.info("All power actions finished after {}s: {} succeeded, {} failed",
                    elapsed.toSeconds(), succeededCount, failedCount);
        }
        return new MonitorResult(true, succeededCount, failedCount, remaining, !remaining.isEmpty(), elapsed);
    }

    private void pollRound(List<PendingTask> pending, RunCounters counters,
                           AtomicInteger succeeded, AtomicInteger failed, AtomicBoolean stopped, long startNanos) {
        for (PendingTask task : pending) {
            if (stopped.get() || Thread.currentThread().isInterrupted()) {
                return;
            }
            PowerActionStatus status;
            try {
                status = brokerClient.pollTask(task.getEndpoint(), task.getTaskId());
            } catch (BrokerException e) {
                log.warn("[Site: {}] Could not poll task {} for {}: {}", task.getSiteId(), task.getTaskId(),
                        task.getMachineName(), e.getMessage());
                continue;
            }
            if (status == null || !status.isCompleted()) {
                continue;
            }
            synchronized (pending) {
                if (stopped.get()) {
                    return;
                }
                pending.remove(task);
                boolean success = status.getOutcome() != null && status.getOutcome().isSuccess();
                String outcome = status.getOutcome() != null ? status.getOutcome().name() : "UNKNOWN";
                if (success) {
                    succeeded.incrementAndGet();
                    counters.recordRestartCompleted();
                    log.info("[Site: {}] Restart of {} completed at {}", task.getSiteId(), task.getMachineName(),
                            status.getCompletionTime());
                } else {
                    failed.incrementAndGet();
                    counters.recordRestartCompletedWithFailure();
                    log.warn("[Site: {}] Restart of {} ended with {}{}", task.getSiteId(), task.getMachineName(), outcome,
                            status.getMessage() != null ? ": " + status.getMessage() : "");
                }
                Map<String, String> tags = buildSiteTags(task.getSiteId());
                tags.put(OUTCOME_TAG, outcome);
                metricsProvider.counter(RESTARTS_COMPLETED_METRIC_NAME, tags).increment();
            }
        }

        long elapsedSeconds = TimeUnit.NANOSECONDS.toSeconds(System.nanoTime() - startNanos);
        metricsProvider.gauge(PENDING_POWER_ACTIONS_METRIC_NAME, pending.size(), Map.of());
        metricsProvider.gauge(MONITOR_ELAPSED_SECONDS_METRIC_NAME, elapsedSeconds, Map.of());
        if (!pending.isEmpty()) {
            log.info("Waiting on {} power action(s), {}s elapsed", pending.size(), elapsedSeconds);
        }
    }
}
