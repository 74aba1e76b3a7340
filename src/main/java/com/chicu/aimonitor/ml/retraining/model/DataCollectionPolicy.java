package com.chicu.aimonitor.ml.retraining.model;

import lombok.Builder;

import java.util.List;

import static com.chicu.aimonitor.ml.retraining.model.PolicyMerge.pick;
import static com.chicu.aimonitor.ml.retraining.model.PolicyMerge.pickList;

/**
 * Политика сбора обучающих данных.
 * Любое поле может быть null, тогда объект работает как частичный override.
 */
@Builder(toBuilder = true)
public record DataCollectionPolicy(
        List<DataSourceType> sources,
        Long timeWindowMs,
        Integer minSamples,
        Integer maxSamples,
        Boolean labeledOnly,
        FilterCriteria filterCriteria
) {

    public static final long DEFAULT_TIME_WINDOW_MS = 30L * 24 * 60 * 60 * 1000;

    public static DataCollectionPolicy defaults() {
        return DataCollectionPolicy.builder()
                .sources(List.of(DataSourceType.DATABASE, DataSourceType.CACHE))
                .timeWindowMs(DEFAULT_TIME_WINDOW_MS)
                .minSamples(100)
                .maxSamples(10_000)
                .labeledOnly(false)
                .filterCriteria(FilterCriteria.builder().minConfidence(0.5).build())
                .build();
    }

    public DataCollectionPolicy mergedWith(DataCollectionPolicy override) {
        if (override == null) return this;
        return new DataCollectionPolicy(
                pickList(override.sources(), sources),
                pick(override.timeWindowMs(), timeWindowMs),
                pick(override.minSamples(), minSamples),
                pick(override.maxSamples(), maxSamples),
                pick(override.labeledOnly(), labeledOnly),
                pick(override.filterCriteria(), filterCriteria)
        );
    }

    @Builder
    public record FilterCriteria(
            Double minConfidence,
            List<String> categories,
            Boolean excludeAnomalies
    ) {}
}
