package com.pm.logorganizer.batch;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Metrics;

import java.util.EnumMap;
import java.util.Map;

/**
 * Metrics counters for batch processing.
 *
 * Tracks:
 * - Number of records written and acknowledged
 * - Number of records failed, by reason
 * - Number of partition groups written
 */
public class BatchMetrics {

    private final Counter recordsSucceeded;
    private final Map<FailureReason, Counter> recordsFailed = new EnumMap<>(FailureReason.class);
    private final Counter groupsWritten;

    public BatchMetrics() {
        this(Metrics.globalRegistry);
    }

    public BatchMetrics(MeterRegistry registry) {
        this.recordsSucceeded = Counter
            .builder("pm_log_organizer_records_succeeded_total")
            .description("counter for how many audit records are stored and deleted from SQS")
            .register(registry);

        for (FailureReason reason : FailureReason.values()) {
            recordsFailed.put(reason, Counter
                .builder("pm_log_organizer_records_failed_total")
                .description("counter for how many audit records failed, by reason")
                .tag("reason", reason.name().toLowerCase())
                .register(registry));
        }

        this.groupsWritten = Counter
            .builder("pm_log_organizer_groups_written_total")
            .description("counter for how many partition group objects are written to S3")
            .register(registry);
    }

    public void recordSucceeded() {
        recordsSucceeded.increment();
    }

    public void recordFailed(FailureReason reason) {
        recordsFailed.get(reason).increment();
    }

    public void groupWritten() {
        groupsWritten.increment();
    }
}
