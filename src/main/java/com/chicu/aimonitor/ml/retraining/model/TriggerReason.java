package com.chicu.aimonitor.ml.retraining.model;

public enum TriggerReason {
    SCHEDULED("Scheduled retraining"),
    PERFORMANCE_DROP("Performance drop detected"),
    NEW_DATA_AVAILABLE("New training data available"),
    DATA_DRIFT_DETECTED("Data drift detected"),
    MANUAL("Manual trigger"),
    MODEL_EXPIRED("Model expired");

    private final String description;

    TriggerReason(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
