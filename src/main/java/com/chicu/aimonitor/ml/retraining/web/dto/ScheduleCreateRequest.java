package com.chicu.aimonitor.ml.retraining.web.dto;

import com.chicu.aimonitor.ml.retraining.model.RetrainableModelType;
import com.chicu.aimonitor.ml.retraining.model.ScheduleOptions;
import com.chicu.aimonitor.ml.retraining.model.ScheduleType;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleCreateRequest {

    @NotNull
    private RetrainableModelType modelType;

    @NotNull
    private ScheduleType scheduleType;

    @Positive
    private Long intervalMs;

    private String cronExpression;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private Double performanceThreshold;

    @Positive
    private Long dataVolumeThreshold;

    private Boolean enabled;

    public ScheduleOptions toOptions() {
        return ScheduleOptions.builder()
                .intervalMs(intervalMs)
                .cronExpression(cronExpression)
                .performanceThreshold(performanceThreshold)
                .dataVolumeThreshold(dataVolumeThreshold)
                .enabled(enabled)
                .build();
    }
}
