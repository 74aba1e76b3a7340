package com.chicu.aimonitor.ml.retraining.model;

public enum DeploymentStrategy {
    IMMEDIATE("Immediate replacement"),
    GRADUAL("Gradual rollout"),
    CANARY("Canary deployment"),
    BLUE_GREEN("Blue-green deployment");

    private final String description;

    DeploymentStrategy(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
