package io.imagerollout.inventory;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Resolves disk images for a batch of hosts with a bounded worker pool and one deadline for the
 * whole batch. Hosts that fail or do not answer before the deadline are simply absent from the result.
 */
@Slf4j
public class DiskImageResolver {

    private final DiskImageQuery query;
    private final int concurrency;
    private final Duration batchTimeout;

    public DiskImageResolver(DiskImageQuery query, int concurrency, Duration batchTimeout) {
        if (concurrency <= 0) {
            throw new IllegalArgumentException("Concurrency must be positive: " + concurrency);
        }
        this.query = query;
        this.concurrency = concurrency;
        this.batchTimeout = batchTimeout;
    }

    /**
     * Query every distinct host once.
     *
     * @param hosts host names, duplicates and blanks are ignored
     * @return map of host to disk image for the hosts that answered with one
     */
    public Map<String, String> resolve(Collection<String> hosts) {
        List<String> distinctHosts = new ArrayList<>(new LinkedHashSet<>(hosts.stream()
                .filter(h -> h != null && !h.isBlank())
                .toList()));
        if (distinctHosts.isEmpty()) {
            return Map.of();
        }

        int poolSize = Math.min(concurrency, distinctHosts.size());
        log.info("Resolving disk images for {} host(s) with {} worker(s), timeout {}s",
                distinctHosts.size(), poolSize, batchTimeout.toSeconds());

        ExecutorService pool = Executors.newFixedThreadPool(poolSize, daemonThreadFactory());
        Map<String, String> resolved = new HashMap<>();
        int failed = 0;
        int unanswered = 0;
        try {
            List<Callable<Optional<String>>> tasks = new ArrayList<>();
            for (String host : distinctHosts) {
                tasks.add(() -> query.queryDiskImage(host, batchTimeout));
            }

            // invokeAll cancels whatever has not finished when the deadline passes
            List<Future<Optional<String>>> futures = pool.invokeAll(tasks, batchTimeout.toMillis(), TimeUnit.MILLISECONDS);
            for (int i = 0; i < futures.size(); i++) {
                String host = distinctHosts.get(i);
                Future<Optional<String>> future = futures.get(i);
                try {
                    future.get().ifPresent(image -> resolved.put(host, image));
                } catch (CancellationException e) {
                    unanswered++;
                    log.debug("Disk image query for {} did not complete before the deadline", host);
                } catch (ExecutionException e) {
                    failed++;
                    log.warn("Disk image query for {} failed: {}", host, e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while resolving disk images, continuing with {} partial result(s)", resolved.size());
        } finally {
            pool.shutdownNow();
        }

        log.info("Resolved disk images for {} of {} host(s) ({} failed, {} timed out)",
                resolved.size(), distinctHosts.size(), failed, unanswered);
        return resolved;
    }

    private static ThreadFactory daemonThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r);
            t.setName("disk-image-query-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
