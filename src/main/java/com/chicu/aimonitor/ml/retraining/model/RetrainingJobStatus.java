package com.chicu.aimonitor.ml.retraining.model;

public enum RetrainingJobStatus {
    PENDING("Pending execution", false),
    COLLECTING_DATA("Collecting training data", false),
    TRAINING("Training model", false),
    VALIDATING("Validating model", false),
    DEPLOYING("Deploying model", false),
    COMPLETED("Completed successfully", true),
    FAILED("Failed", true),
    CANCELLED("Cancelled", true),
    ROLLED_BACK("Rolled back", true);

    private final String description;
    private final boolean terminal;

    RetrainingJobStatus(String description, boolean terminal) {
        this.description = description;
        this.terminal = terminal;
    }

    public String description() {
        return description;
    }

    public boolean isTerminal() {
        return terminal;
    }
}
