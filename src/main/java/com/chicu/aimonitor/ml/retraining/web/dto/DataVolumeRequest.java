package com.chicu.aimonitor.ml.retraining.web.dto;

import com.chicu.aimonitor.ml.retraining.model.RetrainableModelType;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class DataVolumeRequest {

    @NotNull
    private RetrainableModelType modelType;

    @PositiveOrZero
    private long count;
}
