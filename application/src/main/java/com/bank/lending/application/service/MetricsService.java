package com.bank.lending.application.service;

import com.bank.lending.domain.enums.ApplicationStatus;
import com.bank.lending.domain.enums.VerifiableField;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

/**
 * Metrics collection service
 * Tracks corrections, status transitions and reconciliation outcomes
 */
@Service
public class MetricsService {

    private final MeterRegistry meterRegistry;

    // Counters
    private final Counter correctionReplaysCounter;
    private final Counter reconciliationBlockedCounter;
    private final Counter submissionsIncompleteCounter;

    // Timers
    private final Timer correctionProcessingTimer;

    public MetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.correctionReplaysCounter = Counter.builder("corrections.rejected_replays")
                .description("Corrections submitted for a field with no pending rejection")
                .register(meterRegistry);

        this.reconciliationBlockedCounter = Counter.builder("reconciliation.blocked")
                .description("Reconciliation attempts blocked by outstanding rejections")
                .register(meterRegistry);

        this.submissionsIncompleteCounter = Counter.builder("applications.submissions.incomplete")
                .description("Submissions refused because requirements were missing")
                .register(meterRegistry);

        this.correctionProcessingTimer = Timer.builder("correction.processing.time")
                .description("End-to-end correction processing duration")
                .register(meterRegistry);
    }

    public void incrementCorrectionReplays() {
        correctionReplaysCounter.increment();
    }

    public void incrementReconciliationBlocked() {
        reconciliationBlockedCounter.increment();
    }

    public void incrementIncompleteSubmissions() {
        submissionsIncompleteCounter.increment();
    }

    // Timer methods
    public Timer.Sample startCorrectionProcessing() {
        return Timer.start(meterRegistry);
    }

    public void recordCorrectionProcessing(Timer.Sample sample) {
        sample.stop(correctionProcessingTimer);
    }

    // Business metrics
    public void recordCorrectionSubmitted(VerifiableField field) {
        Counter.builder("corrections.submitted")
                .tag("field", field.getCode())
                .register(meterRegistry)
                .increment();
    }

    public void recordTransition(ApplicationStatus to) {
        Counter.builder("applications.transitions")
                .tag("to", to.name())
                .register(meterRegistry)
                .increment();
    }

    public void recordReconciliationAdvanced(int applications) {
        Counter.builder("reconciliation.advanced")
                .register(meterRegistry)
                .increment(applications);
    }
}
