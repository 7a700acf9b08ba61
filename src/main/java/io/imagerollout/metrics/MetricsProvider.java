package io.imagerollout.metrics;

import com.google.common.util.concurrent.AtomicDouble;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static io.imagerollout.metrics.MetricsConstants.ROLLOUT_ID_TAG;

/*
 * MetricsProvider creates and caches the counters, gauges and timers a rollout run publishes.
 * Every meter is tagged with the rollout identifier.
 */
@Slf4j
public class MetricsProvider {
    private static final double[] TIMER_PERCENTILES = {0.5, 0.9, 0.99};

    private final MeterRegistry registry;
    private final String rolloutId;
    private final Map<String, AtomicDouble> gaugeCache = new ConcurrentHashMap<>();

    public MetricsProvider(MeterRegistry registry, String rolloutId) {
        this.registry = registry;
        this.rolloutId = rolloutId;
        log.info("MetricsProvider initialized for rollout: {}", rolloutId);
    }

    /**
     * Creates or retrieves a Counter metric with the given name and tags.
     *
     * @param name the name of the counter
     * @param tags a map of tag keys to tag values
     * @return the Counter instance
     */
    public Counter counter(String name, Map<String, String> tags) {
        return Counter.builder(name).tags(mapToTagArray(withRolloutTag(tags))).register(registry);
    }

    /**
     * Gets or creates a Gauge metric that can be updated.
     * Returns the same AtomicDouble for identical name+tags combinations.
     *
     * @param name the name of the gauge
     * @param value the value of the gauge
     * @param tags a map of tag keys to tag values
     * @return the AtomicDouble instance representing the gauge value
     */
    public AtomicDouble gauge(String name, double value, Map<String, String> tags) {
        Map<String, String> allTags = withRolloutTag(tags);
        String cacheKey = buildCacheKey(name, allTags);
        AtomicDouble gauge = gaugeCache.computeIfAbsent(cacheKey, k -> {
            AtomicDouble gaugeValue = new AtomicDouble(value);
            Gauge.builder(name, gaugeValue::get)
                .tags(mapToTagArray(allTags))
                .register(registry);
            return gaugeValue;
        });
        gauge.set(value);
        return gauge;
    }

    /**
     * Creates or retrieves a Timer metric with the given name and tags.
     *
     * @param name the name of the timer
     * @param tags a map of tag keys to tag values
     * @return the Timer instance
     */
    public Timer timer(String name, Map<String, String> tags) {
        return Timer.builder(name)
            .tags(mapToTagArray(withRolloutTag(tags)))
            .publishPercentiles(TIMER_PERCENTILES)
            .register(registry);
    }

    private Map<String, String> withRolloutTag(Map<String, String> tags) {
        Map<String, String> copy = new HashMap<>(tags);
        copy.put(ROLLOUT_ID_TAG, rolloutId);
        return copy;
    }

    private String buildCacheKey(String name, Map<String, String> tags) {
        StringBuilder key = new StringBuilder(name);
        tags.entrySet().stream()
            .sorted(Map.Entry.comparingByKey())
            .forEach(e -> key.append(":").append(e.getKey()).append("=").append(e.getValue()));
        return key.toString();
    }

    private String[] mapToTagArray(Map<String, String> tags) {
        String[] tagArray = new String[tags.size() * 2];
        int index = 0;
        for (Map.Entry<String, String> entry : tags.entrySet()) {
            tagArray[index++] = entry.getKey();
            tagArray[index++] = entry.getValue();
        }
        return tagArray;
    }
}
