package com.llestrade.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for analysis jobs and provider traffic.
 */
@Service
public class AnalysisMetrics {

    private final MeterRegistry registry;

    public AnalysisMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordJobResult(String kind, String status) {
        Counter.builder("llestrade.jobs.total")
                .tag("kind", kind)
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordProviderCall(String provider, long ms, boolean success) {
        Timer.builder("llestrade.provider.duration")
                .tag("provider", provider)
                .tag("outcome", success ? "success" : "error")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * Counts units of work skipped because their manifest still matched.
     *
     * @param stage "convert", "map" or "reduce"
     */
    public void incrementSkipped(String stage) {
        Counter.builder("llestrade.map.skipped")
                .description("Work units skipped because source and prompt hashes were unchanged")
                .tag("stage", stage)
                .register(registry)
                .increment();
    }

    public void recordReduction(int levels, int invocations) {
        DistributionSummary.builder("llestrade.reduce.levels")
                .register(registry)
                .record(levels);
        DistributionSummary.builder("llestrade.reduce.invocations")
                .register(registry)
                .record(invocations);
    }
}
