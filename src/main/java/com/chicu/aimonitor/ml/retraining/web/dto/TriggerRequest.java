package com.chicu.aimonitor.ml.retraining.web.dto;

import com.chicu.aimonitor.ml.retraining.model.DataCollectionPolicy;
import com.chicu.aimonitor.ml.retraining.model.DeploymentPolicy;
import com.chicu.aimonitor.ml.retraining.model.RetrainableModelType;
import com.chicu.aimonitor.ml.retraining.model.RetrainingOptions;
import com.chicu.aimonitor.ml.retraining.model.TriggerReason;
import com.chicu.aimonitor.ml.retraining.model.ValidationPolicy;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TriggerRequest {

    @NotNull
    private RetrainableModelType modelType;

    /** По умолчанию MANUAL */
    private TriggerReason reason;

    private String scheduleId;
    private Integer priority;
    private List<String> tags;

    // частичные override'ы политик
    private DataCollectionPolicy dataCollection;
    private ValidationPolicy validation;
    private DeploymentPolicy deployment;

    public TriggerReason reasonOrDefault() {
        return reason != null ? reason : TriggerReason.MANUAL;
    }

    public RetrainingOptions toOptions() {
        return RetrainingOptions.builder()
                .scheduleId(scheduleId)
                .priority(priority)
                .tags(tags)
                .dataCollection(dataCollection)
                .validation(validation)
                .deployment(deployment)
                .build();
    }
}
