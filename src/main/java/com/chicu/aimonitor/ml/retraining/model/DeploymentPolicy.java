package com.chicu.aimonitor.ml.retraining.model;

import lombok.Builder;

import java.util.List;

import static com.chicu.aimonitor.ml.retraining.model.PolicyMerge.pick;
import static com.chicu.aimonitor.ml.retraining.model.PolicyMerge.pickList;

@Builder(toBuilder = true)
public record DeploymentPolicy(
        DeploymentStrategy strategy,
        List<Integer> rolloutSteps,
        Integer canaryPercent,
        Boolean autoRollback,
        Long timeoutMs,
        Long healthCheckIntervalMs
) {

    public static DeploymentPolicy defaults() {
        return DeploymentPolicy.builder()
                .strategy(DeploymentStrategy.IMMEDIATE)
                .rolloutSteps(List.of(10, 25, 50, 75, 100))
                .canaryPercent(5)
                .autoRollback(true)
                .timeoutMs(5L * 60 * 1000)
                .healthCheckIntervalMs(30_000L)
                .build();
    }

    public DeploymentPolicy mergedWith(DeploymentPolicy override) {
        if (override == null) return this;
        return new DeploymentPolicy(
                pick(override.strategy(), strategy),
                pickList(override.rolloutSteps(), rolloutSteps),
                pick(override.canaryPercent(), canaryPercent),
                pick(override.autoRollback(), autoRollback),
                pick(override.timeoutMs(), timeoutMs),
                pick(override.healthCheckIntervalMs(), healthCheckIntervalMs)
        );
    }

    public boolean isAutoRollback() {
        return Boolean.TRUE.equals(autoRollback);
    }
}
