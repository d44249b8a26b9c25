package com.example.jobtrigger.config;

import com.example.jobtrigger.domain.enums.TriggerSource;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;

/**
 * Metrics for trigger scheduling.
 * <p>
 * Exposes Prometheus metrics for:
 * - Triggers registered per source
 * - Scheduling failures by error type
 * - Scheduling request duration by outcome
 */
@Configuration
@RequiredArgsConstructor
public class MetricsConfig {

    private final MeterRegistry meterRegistry;

    /**
     * Start timing a scheduling request
     */
    public Timer.Sample startSchedulingTimer() {
        return Timer.start(meterRegistry);
    }

    /**
     * Record scheduling request duration
     */
    public void recordSchedulingRequest(Timer.Sample sample, String outcome) {
        sample.stop(Timer.builder("job_trigger_scheduling_time")
                .tag("outcome", outcome)
                .description("Scheduling request duration")
                .register(meterRegistry));
    }

    /**
     * Record a trigger registered with the scheduler
     */
    public void recordTriggerRegistered(TriggerSource source) {
        meterRegistry.counter("job_trigger_registered",
                "source", source.getCode()
        ).increment();
    }

    /**
     * Record a failed scheduling request
     */
    public void recordSchedulingFailure(String errorType) {
        meterRegistry.counter("job_trigger_scheduling_failures",
                "error_type", errorType != null ? errorType : "unknown"
        ).increment();
    }
}
