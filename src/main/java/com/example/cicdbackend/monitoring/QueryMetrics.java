package com.example.cicdbackend.monitoring;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Records duration and failures of store queries, tagged by operation.
 * Exposed through the Prometheus endpoint at /metrics.
 */
@Component
@RequiredArgsConstructor
public class QueryMetrics {

    private final MeterRegistry meterRegistry;

    public <T> T time(String operation, Supplier<T> query) {
        Timer.Sample sample = Timer.start(meterRegistry);
        String outcome = "success";
        try {
            return query.get();
        } catch (RuntimeException e) {
            outcome = "error";
            Counter.builder("cicd.query.errors")
                    .tag("operation", operation)
                    .tag("exception", e.getClass().getSimpleName())
                    .register(meterRegistry)
                    .increment();
            throw e;
        } finally {
            sample.stop(Timer.builder("cicd.query.duration")
                    .tag("operation", operation)
                    .tag("outcome", outcome)
                    .register(meterRegistry));
        }
    }
}
