package io.imagerollout.metrics;

import com.google.common.util.concurrent.AtomicDouble;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static io.imagerollout.metrics.MetricsConstants.ROLLOUT_ID_TAG;
import static org.assertj.core.api.Assertions.assertThat;

class MetricsProviderTest {

    private static final String TEST_ROLLOUT_ID = "rollout-2026-03";

    private MeterRegistry registry;
    private MetricsProvider provider;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        provider = new MetricsProvider(registry, TEST_ROLLOUT_ID);
    }

    @Test
    void testCounterCarriesRolloutTag() {
        Map<String, String> tags = new HashMap<>();
        tags.put("site", "site-1");

        Counter counter = provider.counter("test.counter", tags);
        counter.increment();
        counter.increment(2.0);

        assertThat(counter.getId().getName()).isEqualTo("test.counter");
        assertThat(counter.getId().getTag(ROLLOUT_ID_TAG)).isEqualTo(TEST_ROLLOUT_ID);
        assertThat(counter.getId().getTag("site")).isEqualTo("site-1");
        assertThat(counter.count()).isEqualTo(3.0);
        assertThat(tags).doesNotContainKey(ROLLOUT_ID_TAG);
    }

    @Test
    void testSameCounterReturnedForSameTags() {
        provider.counter("test.counter", Map.of("site", "a")).increment();
        provider.counter("test.counter", Map.of("site", "a")).increment();

        assertThat(registry.find("test.counter").tag("site", "a").counter().count()).isEqualTo(2.0);
    }

    @Test
    void testGaugeIsCachedAndUpdated() {
        AtomicDouble first = provider.gauge("test.gauge", 5.0, Map.of("site", "a"));
        AtomicDouble second = provider.gauge("test.gauge", 7.5, Map.of("site", "a"));

        assertThat(second).isSameAs(first);
        Gauge gauge = registry.find("test.gauge").gauge();
        assertThat(gauge).isNotNull();
        assertThat(gauge.value()).isEqualTo(7.5);
        assertThat(gauge.getId().getTag(ROLLOUT_ID_TAG)).isEqualTo(TEST_ROLLOUT_ID);
    }

    @Test
    void testGaugesWithDifferentTagsAreIndependent() {
        provider.gauge("test.gauge", 1.0, Map.of("site", "a"));
        provider.gauge("test.gauge", 2.0, Map.of("site", "b"));

        assertThat(registry.find("test.gauge").tag("site", "a").gauge().value()).isEqualTo(1.0);
        assertThat(registry.find("test.gauge").tag("site", "b").gauge().value()).isEqualTo(2.0);
    }

    @Test
    void testTimerRecordsDuration() {
        Timer timer = provider.timer("test.timer", Map.of("entityKind", "Session"));

        timer.record(100, TimeUnit.MILLISECONDS);

        assertThat(timer.getId().getTag(ROLLOUT_ID_TAG)).isEqualTo(TEST_ROLLOUT_ID);
        assertThat(timer.count()).isEqualTo(1);
        assertThat(timer.totalTime(TimeUnit.MILLISECONDS)).isEqualTo(100.0);
    }
}
