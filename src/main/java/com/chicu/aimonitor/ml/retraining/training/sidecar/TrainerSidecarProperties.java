package com.chicu.aimonitor.ml.retraining.training.sidecar;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "ml.retraining.trainer.sidecar")
public class TrainerSidecarProperties {

    /**
     * false = обучение симулируется внутри процесса.
     */
    private boolean enabled = false;

    /**
     * Пример: http://127.0.0.1:8001
     */
    private String baseUrl = "http://127.0.0.1:8001";

    private String apiKey = "";

    private long connectTimeoutMs = 1000;
    private long readTimeoutMs = 60000;
}
