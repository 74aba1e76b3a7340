package com.chicu.aimonitor.ml.retraining.web.dto;

import com.chicu.aimonitor.ml.retraining.model.ScheduleUpdate;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * PATCH расписания: null-поля не меняются.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleUpdateRequest {

    private Boolean enabled;

    @Positive
    private Long intervalMs;

    private String cronExpression;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private Double performanceThreshold;

    @Positive
    private Long dataVolumeThreshold;

    public ScheduleUpdate toUpdate() {
        return ScheduleUpdate.builder()
                .enabled(enabled)
                .intervalMs(intervalMs)
                .cronExpression(cronExpression)
                .performanceThreshold(performanceThreshold)
                .dataVolumeThreshold(dataVolumeThreshold)
                .build();
    }
}
