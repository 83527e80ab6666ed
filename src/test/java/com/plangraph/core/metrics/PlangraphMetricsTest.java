package com.plangraph.core.metrics;

import com.plangraph.core.model.NodeKind;
import com.plangraph.core.parser.DropReason;
import com.plangraph.core.parser.DroppedElement;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class PlangraphMetricsTest {

    private SimpleMeterRegistry registry;
    private PlangraphMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new PlangraphMetrics(registry);
    }

    @Test
    void buildCounterAndTimerPerResult() {
        metrics.recordBuild("success", 40);
        metrics.recordBuild("success", 20);
        metrics.recordBuild("schema_violation", 5);

        assertEquals(2.0, registry.get("plangraph.build.total").tag("result", "success").counter().count());
        assertEquals(1.0, registry.get("plangraph.build.total").tag("result", "schema_violation").counter().count());
        var timer = registry.get("plangraph.build.duration").tag("result", "success").timer();
        assertEquals(2L, timer.count());
        assertEquals(60.0, timer.totalTime(TimeUnit.MILLISECONDS), 0.001);
    }

    @Test
    void droppedTaggedByLevelAndReason() {
        metrics.recordDropped(new DroppedElement(NodeKind.STORY, "S2", DropReason.INVALID_POINTS, "many"));
        assertEquals(1.0, registry.get("plangraph.parse.dropped")
                .tags("level", "story", "reason", "invalid_points").counter().count());
    }

    @Test
    void readyTaskDistribution() {
        metrics.recordReadyTasks(3);
        metrics.recordReadyTasks(0);
        var summary = registry.get("plangraph.ready.tasks").summary();
        assertEquals(2L, summary.count());
        assertEquals(3.0, summary.max());
    }
}
