package com.chicu.aimonitor.ml.retraining.event;

import com.chicu.aimonitor.ml.retraining.model.RetrainableModelType;
import lombok.Builder;

import java.time.Instant;
import java.util.Map;

/**
 * Уведомление, а не источник правды: несёт идентификаторы и минимальный payload,
 * полное состояние слушатель читает через query-операции оркестратора.
 */
@Builder
public record RetrainingEvent(
        RetrainingEventType type,
        String jobId,
        String scheduleId,
        RetrainableModelType modelType,
        Map<String, Object> payload,
        Instant time
) {
    public RetrainingEvent {
        payload = payload == null ? Map.of() : Map.copyOf(payload);
        if (time == null) time = Instant.now();
    }
}
