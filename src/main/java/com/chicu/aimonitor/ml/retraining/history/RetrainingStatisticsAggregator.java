package com.chicu.aimonitor.ml.retraining.history;

import com.chicu.aimonitor.ml.retraining.model.RetrainableModelType;
import com.chicu.aimonitor.ml.retraining.model.RetrainingJob;
import com.chicu.aimonitor.ml.retraining.model.RetrainingJobStatus;
import com.chicu.aimonitor.ml.retraining.model.SchedulerStatistics;
import com.chicu.aimonitor.ml.retraining.model.TriggerReason;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Агрегаты по таблице задач с TTL-кэшем.
 *
 * Мутации кэш не сбрасывают: после создания/завершения задачи статистика
 * может отставать до cacheTtlMs. Для операторов есть {@link #clearCache()}.
 */
@Slf4j
@Component
public class RetrainingStatisticsAggregator {

    private final Clock clock;

    private volatile Cached cached;

    public RetrainingStatisticsAggregator(Clock clock) {
        this.clock = clock;
    }

    public SchedulerStatistics get(boolean cacheEnabled,
                                   long cacheTtlMs,
                                   Supplier<Collection<RetrainingJob>> jobs,
                                   Supplier<Integer> activeSchedules) {
        Instant now = clock.instant();

        if (cacheEnabled) {
            Cached c = cached;
            if (c != null && now.isBefore(c.expiresAt())) {
                log.debug("📦 statistics cache hit (expiresAt={})", c.expiresAt());
                return c.stats();
            }
        }

        SchedulerStatistics stats = compute(jobs.get(), activeSchedules.get(), now);

        if (cacheEnabled) {
            cached = new Cached(stats, now.plusMillis(cacheTtlMs));
        }
        return stats;
    }

    public void clearCache() {
        cached = null;
    }

    static SchedulerStatistics compute(Collection<RetrainingJob> jobs, int activeSchedules, Instant now) {
        int successful = 0;
        int failed = 0;
        int rolledBack = 0;
        int cancelled = 0;

        long durationSum = 0;
        int durationCount = 0;

        double improvementSum = 0;
        int improvementCount = 0;

        long samples = 0;

        Map<RetrainableModelType, Integer> byType = new EnumMap<>(RetrainableModelType.class);
        for (RetrainableModelType t : RetrainableModelType.values()) byType.put(t, 0);

        Map<TriggerReason, Integer> byReason = new EnumMap<>(TriggerReason.class);
        for (TriggerReason r : TriggerReason.values()) byReason.put(r, 0);

        for (RetrainingJob j : jobs) {
            RetrainingJobStatus st = j.getStatus();
            if (st == RetrainingJobStatus.COMPLETED) successful++;
            else if (st == RetrainingJobStatus.FAILED) failed++;
            else if (st == RetrainingJobStatus.ROLLED_BACK) rolledBack++;
            else if (st == RetrainingJobStatus.CANCELLED) cancelled++;

            if (j.getDurationMs() != null) {
                durationSum += j.getDurationMs();
                durationCount++;
            }

            if (st == RetrainingJobStatus.COMPLETED && j.getValidationResult() != null) {
                improvementSum += j.getValidationResult().improvementPercent();
                improvementCount++;
            }

            if (j.getTrainingMetrics() != null) {
                samples += j.getTrainingMetrics().samplesUsed();
            }

            if (j.getConfig() != null) {
                byType.merge(j.getConfig().modelType(), 1, Integer::sum);
                byReason.merge(j.getConfig().triggerReason(), 1, Integer::sum);
            }
        }

        return SchedulerStatistics.builder()
                .totalJobs(jobs.size())
                .successfulJobs(successful)
                .failedJobs(failed)
                .rolledBackJobs(rolledBack)
                .cancelledJobs(cancelled)
                .avgTrainingDurationMs(durationCount == 0 ? 0 : (double) durationSum / durationCount)
                .avgImprovementPercent(improvementCount == 0 ? 0 : improvementSum / improvementCount)
                .totalSamplesUsed(samples)
                .activeSchedules(activeSchedules)
                .jobsByModelType(Collections.unmodifiableMap(byType))
                .jobsByTriggerReason(Collections.unmodifiableMap(byReason))
                .lastUpdated(now)
                .build();
    }

    private record Cached(SchedulerStatistics stats, Instant expiresAt) {}
}
