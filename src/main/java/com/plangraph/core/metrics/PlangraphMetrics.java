package com.plangraph.core.metrics;

import com.plangraph.core.parser.DroppedElement;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for plan builds and queries.
 */
@Service
public class PlangraphMetrics {

    private final MeterRegistry registry;

    public PlangraphMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * @param result {@code success} or the lower-cased failure kind
     */
    public void recordBuild(String result, long ms) {
        Counter.builder("plangraph.build.total")
                .tag("result", result)
                .register(registry)
                .increment();
        Timer.builder("plangraph.build.duration")
                .tag("result", result)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordDropped(DroppedElement element) {
        Counter.builder("plangraph.parse.dropped")
                .tag("level", element.level().name().toLowerCase())
                .tag("reason", element.reason().name().toLowerCase())
                .register(registry)
                .increment();
    }

    public void recordReadyTasks(int count) {
        DistributionSummary.builder("plangraph.ready.tasks")
                .register(registry)
                .record(count);
    }
}
