package com.chicu.aimonitor.ml.retraining.history;

import com.chicu.aimonitor.ml.retraining.model.RetrainableModelType;
import com.chicu.aimonitor.ml.retraining.model.RetrainingJobStatus;
import lombok.Builder;

/**
 * Фильтр истории. null = без фильтра; limit &lt;= 0 или null = без ограничения.
 */
@Builder
public record HistoryQuery(
        RetrainableModelType modelType,
        RetrainingJobStatus status,
        Integer offset,
        Integer limit
) {
    public static HistoryQuery all() {
        return HistoryQuery.builder().build();
    }
}
