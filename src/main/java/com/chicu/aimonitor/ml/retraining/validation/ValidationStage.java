package com.chicu.aimonitor.ml.retraining.validation;

import com.chicu.aimonitor.ml.retraining.model.RetrainableModelType;
import com.chicu.aimonitor.ml.retraining.model.TrainingMetrics;
import com.chicu.aimonitor.ml.retraining.model.ValidationPolicy;
import com.chicu.aimonitor.ml.retraining.model.ValidationResult;
import com.chicu.aimonitor.ml.retraining.performance.ModelPerformanceSource;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.Locale;
import java.util.OptionalDouble;
import java.util.Random;

/**
 * Quality gate: сравнивает новую модель с текущей по правилам {@link ValidationPolicy}.
 *
 * Правила проверяются по порядку, в результат попадает только первая сработавшая причина:
 * <ol>
 *     <li>newAccuracy &lt; minAccuracy</li>
 *     <li>improvement &lt; minImprovement</li>
 *     <li>improvement &lt; maxDegradation</li>
 * </ol>
 */
@Slf4j
public class ValidationStage {

    private final Random random;
    private final Clock clock;
    private volatile ModelPerformanceSource performanceSource;

    public ValidationStage(ModelPerformanceSource performanceSource, Random random, Clock clock) {
        this.performanceSource = performanceSource;
        this.random = random;
        this.clock = clock;
    }

    public void setPerformanceSource(ModelPerformanceSource performanceSource) {
        this.performanceSource = performanceSource;
    }

    /**
     * Текущая точность модели: источник, если он есть и что-то вернул, иначе 0.75..0.85.
     */
    public double currentAccuracy(RetrainableModelType type) {
        ModelPerformanceSource src = performanceSource;
        if (src != null) {
            OptionalDouble v = src.accuracyOf(type);
            if (v != null && v.isPresent()) {
                return v.getAsDouble();
            }
        }
        return 0.75 + random.nextDouble() * 0.1;
    }

    public ValidationResult validate(RetrainableModelType type,
                                     TrainingMetrics metrics,
                                     int sampleCount,
                                     ValidationPolicy policy) {

        double oldAccuracy = currentAccuracy(type);
        double newAccuracy;
        if (metrics != null && metrics.accuracy() != null) {
            newAccuracy = metrics.accuracy();
        } else {
            newAccuracy = 0.75 + random.nextDouble() * 0.2;
        }

        double improvement = newAccuracy - oldAccuracy;
        double improvementPercent = oldAccuracy != 0 ? improvement / oldAccuracy * 100.0 : 0.0;

        String failureReason = firstFailure(newAccuracy, improvement, policy);
        boolean passed = failureReason == null;

        ValidationResult result = ValidationResult.builder()
                .strategy(policy.strategy())
                .passed(passed)
                .oldModelAccuracy(oldAccuracy)
                .newModelAccuracy(newAccuracy)
                .improvement(improvement)
                .improvementPercent(improvementPercent)
                .samplesUsed((int) Math.floor(sampleCount * policy.holdoutSize()))
                .metrics(metricsOf(metrics))
                .validatedAt(clock.instant())
                .failureReason(failureReason)
                .build();

        if (passed) {
            log.info("✅ VALIDATION PASSED type={} old={} new={} improvement={}",
                    type, fmt(oldAccuracy), fmt(newAccuracy), fmt(improvement));
        } else {
            log.warn("⛔ VALIDATION FAILED type={} reason={}", type, failureReason);
        }
        return result;
    }

    static String firstFailure(double newAccuracy, double improvement, ValidationPolicy policy) {
        if (newAccuracy < policy.minAccuracy()) {
            return String.format(Locale.ROOT,
                    "New model accuracy (%.1f%%) below minimum threshold (%.1f%%)",
                    newAccuracy * 100, policy.minAccuracy() * 100);
        }
        if (improvement < policy.minImprovement()) {
            return String.format(Locale.ROOT,
                    "Improvement (%.2f%%) below minimum required (%.2f%%)",
                    improvement * 100, policy.minImprovement() * 100);
        }
        if (improvement < policy.maxDegradation()) {
            return String.format(Locale.ROOT,
                    "Model degradation (%.2f%%) exceeds maximum allowed (%.2f%%)",
                    improvement * 100, policy.maxDegradation() * 100);
        }
        return null;
    }

    private static ValidationResult.Metrics metricsOf(TrainingMetrics m) {
        return ValidationResult.Metrics.builder()
                .precision(orDefault(m != null ? m.precision() : null, 0.80))
                .recall(orDefault(m != null ? m.recall() : null, 0.75))
                .f1Score(orDefault(m != null ? m.f1Score() : null, 0.77))
                .aucRoc(orDefault(m != null ? m.aucRoc() : null, 0.85))
                .build();
    }

    private static double orDefault(Double v, double def) {
        return v != null ? v : def;
    }

    private static String fmt(double v) {
        return String.format(Locale.ROOT, "%.4f", v);
    }
}
