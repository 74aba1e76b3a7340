package com.chicu.aimonitor.ml.retraining.training.sidecar.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TrainRequestDto {

    /** Например: anomaly_detection */
    private String modelKey;

    private String[] featureNames;

    @JsonProperty("X")
    private double[][] x;

    /** 1 = аномалия, 0 = норма / без метки */
    private int[] y;

    @Builder.Default
    private Map<String, Object> params = Map.of();

    @Builder.Default
    private Map<String, Object> meta = Map.of();
}
