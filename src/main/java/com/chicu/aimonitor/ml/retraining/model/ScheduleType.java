package com.chicu.aimonitor.ml.retraining.model;

public enum ScheduleType {
    INTERVAL("Run at fixed time intervals"),
    CRON("Run on cron schedule"),
    PERFORMANCE_TRIGGER("Run when performance drops below threshold"),
    DATA_VOLUME_TRIGGER("Run when new data volume reaches threshold"),
    MANUAL("Manual trigger only");

    private final String description;

    ScheduleType(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }

    /** Только INTERVAL крутится на таймере, остальные через явный poll или вручную */
    public boolean isTimerDriven() {
        return this == INTERVAL;
    }
}
