package com.chicu.aimonitor.ml.retraining.event;

import java.util.Locale;

public enum RetrainingEventType {
    SCHEDULE_CREATED,
    SCHEDULE_UPDATED,
    SCHEDULE_DELETED,

    JOB_CREATED,
    JOB_STARTED,
    JOB_PROGRESS,
    JOB_COMPLETED,
    JOB_FAILED,
    JOB_ROLLED_BACK,
    JOB_CANCELLED,

    VALIDATION_PASSED,
    VALIDATION_FAILED,
    MODEL_DEPLOYED,

    PERFORMANCE_TRIGGER,
    DATA_VOLUME_TRIGGER,

    ERROR;

    /** job_progress, schedule_created, ... */
    public String topic() {
        return name().toLowerCase(Locale.ROOT);
    }
}
