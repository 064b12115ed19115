package com.stealerlens.normalization;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Metrics collector for system information normalization.
 *
 * Tracks:
 * - parsed and failed files per stealer family
 * - per-file parse latency
 */
@Component
public class NormalizationMetrics {

    private final MeterRegistry registry;
    private final Map<String, Counter> parsedCounters = new ConcurrentHashMap<>();
    private final Map<String, Counter> failedCounters = new ConcurrentHashMap<>();
    private final Timer parseLatency;

    public NormalizationMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.parseLatency = Timer.builder("stealerlens.systeminfo.parse.latency")
            .description("Time to detect, parse and clean one system information file")
            .tag("component", "normalization")
            .publishPercentiles(0.5, 0.95, 0.99)
            .register(registry);
    }

    /**
     * Increment parsed file counter for a stealer tag
     */
    public void recordParsed(String stealerType) {
        parsedCounters.computeIfAbsent(stealerType, tag ->
            Counter.builder("stealerlens.systeminfo.parsed")
                .tag("stealer", tag)
                .description("Number of successfully parsed system information files by stealer")
                .register(registry)
        ).increment();
    }

    /**
     * Increment failed file counter for a stealer tag
     */
    public void recordFailed(String stealerType) {
        failedCounters.computeIfAbsent(stealerType, tag ->
            Counter.builder("stealerlens.systeminfo.failed")
                .tag("stealer", tag)
                .description("Number of system information files that failed to parse by stealer")
                .register(registry)
        ).increment();
    }

    public Timer.Sample startTimer() {
        return Timer.start(registry);
    }

    public void recordLatency(Timer.Sample sample) {
        sample.stop(parseLatency);
    }
}
