package org.stress;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class StressMetricsTest {

    @Test
    void recordCountsAndObservesPerWorkload() {
        double before = StressMetrics.ops.labels("metrics-test").get();
        double otherBefore = StressMetrics.ops.labels("metrics-other").get();

        StressMetrics.record("metrics-test", 1_500);
        StressMetrics.record("metrics-test", 2_500);

        assertEquals(before + 2, StressMetrics.ops.labels("metrics-test").get());
        assertEquals(otherBefore, StressMetrics.ops.labels("metrics-other").get());
        assertEquals(0.004, StressMetrics.latency.labels("metrics-test").get().sum, 1e-9);
    }
}
