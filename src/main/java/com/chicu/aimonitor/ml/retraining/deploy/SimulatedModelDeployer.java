package com.chicu.aimonitor.ml.retraining.deploy;

import com.chicu.aimonitor.ml.retraining.model.DeploymentPolicy;
import com.chicu.aimonitor.ml.retraining.model.DeploymentResult;
import com.chicu.aimonitor.ml.retraining.model.DeploymentStrategy;
import com.chicu.aimonitor.ml.retraining.model.RetrainableModelType;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Заглушка выката: проходит шаги стратегии и делает "health check",
 * успешный с вероятностью successRate.
 */
@Slf4j
public class SimulatedModelDeployer implements ModelDeployer {

    private final Random random;
    private final double successRate;

    public SimulatedModelDeployer(Random random, double successRate) {
        if (successRate < 0 || successRate > 1) {
            throw new IllegalArgumentException("successRate must be in [0..1]: " + successRate);
        }
        this.random = random;
        this.successRate = successRate;
    }

    @Override
    public DeploymentOutcome deploy(RetrainableModelType modelType,
                                    String newModelId,
                                    String previousModelId,
                                    DeploymentPolicy policy) {

        List<Integer> steps = trafficSteps(policy);
        for (Integer pct : steps) {
            log.debug("🚚 [{}] {} -> {}% трафика ({})", modelType, newModelId, pct, policy.strategy());
        }

        DeploymentResult.HealthCheck hc = DeploymentResult.HealthCheck.builder()
                .healthy(random.nextDouble() < successRate)
                .latencyMs(10 + random.nextDouble() * 50)
                .errorRate(random.nextDouble() * 0.01)
                .build();

        return hc.healthy()
                ? DeploymentOutcome.healthy(hc)
                : DeploymentOutcome.unhealthy(null, hc);
    }

    /**
     * Доли трафика, через которые проходит выкат.
     */
    static List<Integer> trafficSteps(DeploymentPolicy policy) {
        DeploymentStrategy strategy = policy.strategy() != null ? policy.strategy() : DeploymentStrategy.IMMEDIATE;
        switch (strategy) {
            case GRADUAL: {
                List<Integer> steps = new ArrayList<>();
                if (policy.rolloutSteps() != null) steps.addAll(policy.rolloutSteps());
                if (steps.isEmpty() || steps.get(steps.size() - 1) != 100) steps.add(100);
                return steps;
            }
            case CANARY: {
                int canary = policy.canaryPercent() != null ? policy.canaryPercent() : 5;
                return List.of(canary, 100);
            }
            case BLUE_GREEN:
            case IMMEDIATE:
            default:
                return List.of(100);
        }
    }
}
