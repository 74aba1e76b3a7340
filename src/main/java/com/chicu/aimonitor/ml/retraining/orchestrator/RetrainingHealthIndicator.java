package com.chicu.aimonitor.ml.retraining.orchestrator;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * /actuator/health → components.retraining
 */
@Component("retraining")
@RequiredArgsConstructor
public class RetrainingHealthIndicator implements HealthIndicator {

    private final RetrainingOrchestrator orchestrator;

    @Override
    public Health health() {
        return Health.up()
                .withDetail("enabled", orchestrator.isRunning())
                .withDetail("activeJobs", orchestrator.activeCount())
                .withDetail("maxConcurrentJobs", orchestrator.getConfig().maxConcurrentJobs())
                .withDetail("timers", orchestrator.runningTimers())
                .build();
    }
}
