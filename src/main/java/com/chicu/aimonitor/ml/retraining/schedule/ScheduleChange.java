package com.chicu.aimonitor.ml.retraining.schedule;

import com.chicu.aimonitor.ml.retraining.model.RetrainingSchedule;

/**
 * Снимки расписания до и после обновления: по ним решаем, что делать с таймером.
 */
public record ScheduleChange(
        RetrainingSchedule before,
        RetrainingSchedule after
) {

    public boolean enabledChanged() {
        return before.isEnabled() != after.isEnabled();
    }

    public boolean intervalChanged() {
        Long a = before.getIntervalMs();
        Long b = after.getIntervalMs();
        return a == null ? b != null : !a.equals(b);
    }
}
