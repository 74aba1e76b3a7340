package com.chicu.aimonitor.ml.retraining.validation;

import com.chicu.aimonitor.ml.retraining.MutableClock;
import com.chicu.aimonitor.ml.retraining.model.RetrainableModelType;
import com.chicu.aimonitor.ml.retraining.model.TrainingMetrics;
import com.chicu.aimonitor.ml.retraining.model.ValidationPolicy;
import com.chicu.aimonitor.ml.retraining.model.ValidationResult;
import org.junit.jupiter.api.Test;

import java.util.OptionalDouble;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class ValidationStageTest {

    private final MutableClock clock = MutableClock.at("2026-03-01T00:00:00Z");

    @Test
    void passes_andComputesImprovement() {
        ValidationStage stage = new ValidationStage(type -> OptionalDouble.of(0.78), new Random(1), clock);

        ValidationResult r = stage.validate(RetrainableModelType.ANOMALY_DETECTION,
                metrics(0.82), 1000, ValidationPolicy.defaults());

        assertTrue(r.passed());
        assertNull(r.failureReason());
        assertEquals(0.04, r.improvement(), 1e-9);
        assertEquals(0.04 / 0.78 * 100, r.improvementPercent(), 1e-9);
        assertEquals(200, r.samplesUsed());
        assertEquals(clock.instant(), r.validatedAt());
        assertEquals(0.8, r.metrics().precision());
    }

    @Test
    void minAccuracy_isCheckedFirst() {
        String reason = ValidationStage.firstFailure(0.65, -0.2, ValidationPolicy.defaults());

        assertEquals("New model accuracy (65.0%) below minimum threshold (70.0%)", reason);
    }

    @Test
    void minImprovement_beforeDegradation() {
        ValidationPolicy policy = ValidationPolicy.defaults().toBuilder().minImprovement(0.01).build();

        assertEquals("Improvement (0.50%) below minimum required (1.00%)",
                ValidationStage.firstFailure(0.8, 0.005, policy));
        assertEquals("Improvement (-10.00%) below minimum required (1.00%)",
                ValidationStage.firstFailure(0.8, -0.1, policy));
    }

    @Test
    void degradation_isReported_whenImprovementRuleAllowsNegative() {
        ValidationPolicy policy = ValidationPolicy.defaults().toBuilder().minImprovement(-1.0).build();

        assertEquals("Model degradation (-8.00%) exceeds maximum allowed (-5.00%)",
                ValidationStage.firstFailure(0.75, -0.08, policy));
        assertNull(ValidationStage.firstFailure(0.75, -0.03, policy));
    }

    @Test
    void defaultPolicy_rejectsAnyDrop() {
        assertNotNull(ValidationStage.firstFailure(0.8, -0.001, ValidationPolicy.defaults()));
        assertNull(ValidationStage.firstFailure(0.8, 0.0, ValidationPolicy.defaults()));
    }

    @Test
    void zeroOldAccuracy_givesZeroPercent_andMissingMetricsGetDefaults() {
        ValidationStage stage = new ValidationStage(type -> OptionalDouble.of(0.0), new Random(1), clock);

        ValidationResult r = stage.validate(RetrainableModelType.ANOMALY_DETECTION,
                TrainingMetrics.builder().samplesUsed(10).build(), 10, ValidationPolicy.defaults());

        assertEquals(0.0, r.improvementPercent());
        assertTrue(r.newModelAccuracy() >= 0.75 && r.newModelAccuracy() <= 0.95);
        assertEquals(0.85, r.metrics().aucRoc());
        assertEquals(2, r.samplesUsed());
    }

    @Test
    void currentAccuracy_fallsBackToSimulation_whenSourceIsSilent() {
        ValidationStage stage = new ValidationStage(type -> OptionalDouble.empty(), new Random(1), clock);
        double v = stage.currentAccuracy(RetrainableModelType.MARKET_PREDICTOR);
        assertTrue(v >= 0.75 && v <= 0.85);

        stage.setPerformanceSource(null);
        v = stage.currentAccuracy(RetrainableModelType.MARKET_PREDICTOR);
        assertTrue(v >= 0.75 && v <= 0.85);
    }

    private static TrainingMetrics metrics(double accuracy) {
        return TrainingMetrics.builder().accuracy(accuracy).samplesUsed(1000).build();
    }
}
