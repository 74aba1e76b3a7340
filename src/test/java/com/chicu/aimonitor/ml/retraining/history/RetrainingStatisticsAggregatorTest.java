package com.chicu.aimonitor.ml.retraining.history;

import com.chicu.aimonitor.ml.retraining.MutableClock;
import com.chicu.aimonitor.ml.retraining.model.RetrainableModelType;
import com.chicu.aimonitor.ml.retraining.model.RetrainingJob;
import com.chicu.aimonitor.ml.retraining.model.RetrainingJobConfig;
import com.chicu.aimonitor.ml.retraining.model.RetrainingJobStatus;
import com.chicu.aimonitor.ml.retraining.model.SchedulerStatistics;
import com.chicu.aimonitor.ml.retraining.model.TrainingMetrics;
import com.chicu.aimonitor.ml.retraining.model.TriggerReason;
import com.chicu.aimonitor.ml.retraining.model.ValidationResult;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class RetrainingStatisticsAggregatorTest {

    private final MutableClock clock = MutableClock.at("2026-03-01T00:00:00Z");
    private final RetrainingStatisticsAggregator aggregator = new RetrainingStatisticsAggregator(clock);

    @Test
    void compute_countsOutcomesAndAverages() {
        List<RetrainingJob> jobs = List.of(
                job(RetrainableModelType.ANOMALY_DETECTION, TriggerReason.MANUAL, RetrainingJobStatus.COMPLETED, 4.0, 1000L, 500),
                job(RetrainableModelType.ANOMALY_DETECTION, TriggerReason.SCHEDULED, RetrainingJobStatus.COMPLETED, 2.0, 3000L, 300),
                job(RetrainableModelType.SIGNAL_TRACKER, TriggerReason.SCHEDULED, RetrainingJobStatus.ROLLED_BACK, -9.0, 2000L, 100),
                job(RetrainableModelType.SIGNAL_TRACKER, TriggerReason.MANUAL, RetrainingJobStatus.PENDING, null, null, 0)
        );

        SchedulerStatistics s = RetrainingStatisticsAggregator.compute(jobs, 3, clock.instant());

        assertEquals(4, s.totalJobs());
        assertEquals(2, s.successfulJobs());
        assertEquals(1, s.rolledBackJobs());
        assertEquals(0, s.failedJobs());
        assertEquals(2000.0, s.avgTrainingDurationMs(), 1e-9);
        assertEquals(3.0, s.avgImprovementPercent(), 1e-9);
        assertEquals(900, s.totalSamplesUsed());
        assertEquals(3, s.activeSchedules());
        assertEquals(2, s.jobsByModelType().get(RetrainableModelType.SIGNAL_TRACKER));
        assertEquals(0, s.jobsByModelType().get(RetrainableModelType.MARKET_PREDICTOR));
        assertEquals(2, s.jobsByTriggerReason().get(TriggerReason.SCHEDULED));
        assertEquals(0, s.jobsByTriggerReason().get(TriggerReason.DATA_DRIFT_DETECTED));
    }

    @Test
    void emptyTable_givesZeroAverages() {
        SchedulerStatistics s = RetrainingStatisticsAggregator.compute(List.of(), 0, clock.instant());

        assertEquals(0, s.totalJobs());
        assertEquals(0.0, s.avgTrainingDurationMs());
        assertEquals(0.0, s.avgImprovementPercent());
    }

    @Test
    void cachedValue_isServedUntilTtlExpires() {
        List<RetrainingJob> table = new ArrayList<>();
        AtomicInteger computations = new AtomicInteger();

        SchedulerStatistics first = aggregator.get(true, 60_000, () -> {
            computations.incrementAndGet();
            return new ArrayList<>(table);
        }, () -> 0);

        table.add(job(RetrainableModelType.ANOMALY_DETECTION, TriggerReason.MANUAL, RetrainingJobStatus.FAILED, null, 10L, 0));
        clock.advance(Duration.ofSeconds(59));

        SchedulerStatistics cached = aggregator.get(true, 60_000, () -> {
            computations.incrementAndGet();
            return new ArrayList<>(table);
        }, () -> 0);

        assertSame(first, cached);
        assertEquals(1, computations.get());

        clock.advance(Duration.ofSeconds(1));
        SchedulerStatistics fresh = aggregator.get(true, 60_000, () -> new ArrayList<>(table), () -> 0);
        assertEquals(1, fresh.totalJobs());
        assertEquals(clock.instant(), fresh.lastUpdated());
    }

    @Test
    void clearCache_andDisabledCache_recompute() {
        List<RetrainingJob> table = new ArrayList<>();
        aggregator.get(true, 60_000, () -> new ArrayList<>(table), () -> 0);
        table.add(job(RetrainableModelType.ANOMALY_DETECTION, TriggerReason.MANUAL, RetrainingJobStatus.CANCELLED, null, 5L, 0));

        aggregator.clearCache();
        assertEquals(1, aggregator.get(true, 60_000, () -> new ArrayList<>(table), () -> 0).cancelledJobs());

        table.add(job(RetrainableModelType.ANOMALY_DETECTION, TriggerReason.MANUAL, RetrainingJobStatus.CANCELLED, null, 5L, 0));
        assertEquals(2, aggregator.get(false, 60_000, () -> new ArrayList<>(table), () -> 0).cancelledJobs());
    }

    private static RetrainingJob job(RetrainableModelType type, TriggerReason reason, RetrainingJobStatus status,
                                     Double improvementPercent, Long durationMs, int samples) {
        return RetrainingJob.builder()
                .jobId("job_" + System.nanoTime())
                .config(RetrainingJobConfig.builder().modelType(type).triggerReason(reason).priority(1).build())
                .status(status)
                .durationMs(durationMs)
                .trainingMetrics(samples > 0 ? TrainingMetrics.builder().samplesUsed(samples).build() : null)
                .validationResult(improvementPercent != null
                        ? ValidationResult.builder().passed(status == RetrainingJobStatus.COMPLETED)
                                .improvementPercent(improvementPercent).build()
                        : null)
                .build();
    }
}
