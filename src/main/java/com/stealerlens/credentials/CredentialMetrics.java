package com.stealerlens.credentials;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

/**
 * Metrics collector for credential ingestion.
 */
@Component
public class CredentialMetrics {

    private final Counter extracted;
    private final Counter dropped;
    private final Counter truncated;

    public CredentialMetrics(MeterRegistry registry) {
        this.extracted = Counter.builder("stealerlens.credentials.extracted")
            .description("Number of credentials extracted from password files")
            .tag("component", "credentials")
            .register(registry);

        this.dropped = Counter.builder("stealerlens.credentials.dropped")
            .description("Number of credentials the store rejected")
            .tag("component", "credentials")
            .register(registry);

        this.truncated = Counter.builder("stealerlens.credentials.truncated")
            .description("Number of usernames cut to the column limit")
            .tag("component", "credentials")
            .register(registry);
    }

    public void recordExtracted(int count) {
        extracted.increment(count);
    }

    public void recordDropped() {
        dropped.increment();
    }

    public void recordTruncated() {
        truncated.increment();
    }
}
