package com.chicu.aimonitor.ml.retraining.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PolicyMergeTest {

    @Test
    void validationOverride_replacesOnlyProvidedFields() {
        ValidationPolicy merged = ValidationPolicy.defaults()
                .mergedWith(ValidationPolicy.builder().minAccuracy(0.9).build());

        assertEquals(0.9, merged.minAccuracy());
        assertEquals(0.0, merged.minImprovement());
        assertEquals(-0.05, merged.maxDegradation());
        assertEquals(0.2, merged.holdoutSize());
        assertEquals(ValidationStrategy.HOLDOUT_VALIDATION, merged.strategy());
    }

    @Test
    void threeLayers_callerWinsOverSchedulerDefaults() {
        DataCollectionPolicy scheduler = DataCollectionPolicy.builder().minSamples(200).maxSamples(800).build();
        DataCollectionPolicy caller = DataCollectionPolicy.builder().minSamples(50).build();

        DataCollectionPolicy merged = DataCollectionPolicy.defaults().mergedWith(scheduler).mergedWith(caller);

        assertEquals(50, merged.minSamples());
        assertEquals(800, merged.maxSamples());
        assertEquals(DataCollectionPolicy.DEFAULT_TIME_WINDOW_MS, merged.timeWindowMs());
        assertEquals(List.of(DataSourceType.DATABASE, DataSourceType.CACHE), merged.sources());
        assertFalse(merged.labeledOnly());
    }

    @Test
    void nullOverride_returnsSamePolicy() {
        DeploymentPolicy base = DeploymentPolicy.defaults();
        assertSame(base, base.mergedWith(null));
    }

    @Test
    void deploymentOverride_canDisableAutoRollback() {
        DeploymentPolicy merged = DeploymentPolicy.defaults()
                .mergedWith(DeploymentPolicy.builder()
                        .strategy(DeploymentStrategy.CANARY)
                        .autoRollback(false)
                        .build());

        assertEquals(DeploymentStrategy.CANARY, merged.strategy());
        assertFalse(merged.isAutoRollback());
        assertEquals(5, merged.canaryPercent());
        assertEquals(List.of(10, 25, 50, 75, 100), merged.rolloutSteps());
    }
}
