package com.chicu.aimonitor.ml.retraining.model;

public enum ValidationStrategy {
    ACCURACY_COMPARISON("Compare accuracy metrics"),
    AB_TEST("A/B test with production traffic"),
    SHADOW_MODE("Shadow mode comparison"),
    HOLDOUT_VALIDATION("Holdout validation set"),
    CROSS_VALIDATION("Cross-validation");

    private final String description;

    ValidationStrategy(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
