package com.chicu.aimonitor.ml.retraining.guard;

import com.chicu.aimonitor.ml.retraining.model.RetrainableModelType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Минимальная пауза между переобучениями одной модели.
 *
 * Консультируются только таймеры и perf/volume-триггеры; ручной triggerRetraining
 * через этот guard не идёт. Гонка "новый триггер vs. завершение в полёте" допустима.
 */
@Slf4j
@Component
public class RetrainingIntervalGuard {

    private final Clock clock;

    /** modelType -> момент последнего успешного (COMPLETED) переобучения */
    private final Map<RetrainableModelType, Instant> lastRetrainedAt = new ConcurrentHashMap<>();

    public RetrainingIntervalGuard(Clock clock) {
        this.clock = clock;
    }

    public GuardDecision check(RetrainableModelType type, long minIntervalMs) {
        Instant last = lastRetrainedAt.get(type);
        if (last == null || minIntervalMs <= 0) return GuardDecision.allow();

        Duration since = Duration.between(last, clock.instant());
        if (since.toMillis() < minIntervalMs) {
            return GuardDecision.deny(
                    "Слишком часто: прошло " + since.toMillis() + "ms, нужно минимум " + minIntervalMs + "ms",
                    minIntervalMs - since.toMillis());
        }
        return GuardDecision.allow();
    }

    public void markRetrained(RetrainableModelType type) {
        lastRetrainedAt.put(type, clock.instant());
    }

    public Optional<Instant> lastRetrainedAt(RetrainableModelType type) {
        return Optional.ofNullable(lastRetrainedAt.get(type));
    }

    public void clear() {
        lastRetrainedAt.clear();
    }
}
