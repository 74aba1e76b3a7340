package com.chicu.aimonitor.ml.retraining.training.sidecar;

import com.chicu.aimonitor.ml.retraining.model.RetrainableModelType;
import com.chicu.aimonitor.ml.retraining.model.TrainingMetrics;
import com.chicu.aimonitor.ml.retraining.model.TrainingSample;
import com.chicu.aimonitor.ml.retraining.training.ModelTrainer;
import com.chicu.aimonitor.ml.retraining.training.TrainedModel;
import com.chicu.aimonitor.ml.retraining.training.sidecar.dto.TrainRequestDto;
import com.chicu.aimonitor.ml.retraining.training.sidecar.dto.TrainResponseDto;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Обучение через внешний python sidecar: POST {baseUrl}/train.
 */
@Slf4j
@RequiredArgsConstructor
public class SidecarModelTrainer implements ModelTrainer {

    private static final MediaType JSON = MediaType.parse("application/json; charset=utf-8");

    private final OkHttpClient baseClient;
    private final ObjectMapper objectMapper;
    private final TrainerSidecarProperties props;

    private OkHttpClient clientWithTimeouts() {
        return baseClient.newBuilder()
                .connectTimeout(Duration.ofMillis(Math.max(200, props.getConnectTimeoutMs())))
                .readTimeout(Duration.ofMillis(Math.max(500, props.getReadTimeoutMs())))
                .build();
    }

    @Override
    public TrainedModel train(RetrainableModelType modelType, List<TrainingSample> samples) {
        long started = System.currentTimeMillis();

        TrainRequestDto req = toRequest(modelType, samples);
        TrainResponseDto resp = post("/train", req, TrainResponseDto.class);

        if (resp == null || !resp.isOk()) {
            String msg = resp != null ? resp.getMessage() : null;
            log.warn("🧠 TRAIN FAIL modelKey={} msg={}", req.getModelKey(), msg);
            throw new IllegalStateException("ML sidecar train failed: " + (msg != null ? msg : "ok=false"));
        }

        String modelId = resp.getModelVersion() != null && !resp.getModelVersion().isBlank()
                ? resp.getModelVersion()
                : resp.getModelPath();

        TrainingMetrics metrics = toMetrics(resp.getMetrics(), samples.size(), System.currentTimeMillis() - started);

        log.info("🧠 SIDECAR TRAIN OK modelKey={} modelId={} msg={}", req.getModelKey(), modelId, resp.getMessage());
        return new TrainedModel(modelId, metrics);
    }

    // ==== ✅ запрос: объединение имён фич, отсутствующие = 0 ====

    static TrainRequestDto toRequest(RetrainableModelType modelType, List<TrainingSample> samples) {
        TreeSet<String> names = new TreeSet<>();
        for (TrainingSample s : samples) {
            if (s.features() != null) names.addAll(s.features().keySet());
        }
        String[] featureNames = names.toArray(new String[0]);

        double[][] x = new double[samples.size()][featureNames.length];
        int[] y = new int[samples.size()];

        for (int i = 0; i < samples.size(); i++) {
            TrainingSample s = samples.get(i);
            Map<String, Double> f = s.features() != null ? s.features() : Map.of();
            for (int j = 0; j < featureNames.length; j++) {
                Double v = f.get(featureNames[j]);
                x[i][j] = v != null ? v : 0.0;
            }
            y[i] = Boolean.TRUE.equals(s.label()) ? 1 : 0;
        }

        long labeled = samples.stream().filter(TrainingSample::isLabeled).count();

        return TrainRequestDto.builder()
                .modelKey(modelType.name().toLowerCase())
                .featureNames(featureNames)
                .x(x)
                .y(y)
                .meta(Map.of(
                        "modelType", modelType.name(),
                        "labeledSamples", labeled
                ))
                .build();
    }

    static TrainingMetrics toMetrics(Map<String, Object> m, int samplesUsed, long tookMs) {
        Map<String, Object> src = m != null ? m : Map.of();
        Double precision = num(src, "precision");
        Double recall = num(src, "recall");
        Double f1 = num(src, "f1Score");
        if (f1 == null) f1 = num(src, "f1");
        if (f1 == null && precision != null && recall != null && precision + recall > 0) {
            f1 = 2 * precision * recall / (precision + recall);
        }
        Double auc = num(src, "aucRoc");
        if (auc == null) auc = num(src, "auc");

        return TrainingMetrics.builder()
                .loss(num(src, "loss"))
                .accuracy(num(src, "accuracy"))
                .precision(precision)
                .recall(recall)
                .f1Score(f1)
                .aucRoc(auc)
                .trainingDurationMs(tookMs)
                .samplesUsed(samplesUsed)
                .build();
    }

    private static Double num(Map<String, Object> m, String key) {
        Object v = m.get(key);
        if (v instanceof Number n) return n.doubleValue();
        if (v instanceof String s && !s.isBlank()) {
            try {
                return Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                log.debug("🧠 sidecar metric {} не число: {}", key, s);
                return null;
            }
        }
        return null;
    }

    private <T> T post(String path, Object body, Class<T> responseType) {
        String url = props.getBaseUrl().replaceAll("/+$", "") + path;

        try {
            String json = objectMapper.writeValueAsString(body);

            Request.Builder rb = new Request.Builder()
                    .url(url)
                    .post(RequestBody.create(json, JSON));

            if (props.getApiKey() != null && !props.getApiKey().isBlank()) {
                rb.header("X-API-KEY", props.getApiKey().trim());
            }

            try (Response resp = clientWithTimeouts().newCall(rb.build()).execute()) {

                String respBody = resp.body() != null ? resp.body().string() : "";

                if (!resp.isSuccessful()) {
                    log.warn("🧠 ML sidecar error: {} {} -> {} body={}", "POST", path, resp.code(), shrink(respBody));
                    throw new IllegalStateException("ML sidecar HTTP " + resp.code() + ": " + shrink(respBody));
                }

                if (respBody.isBlank()) {
                    throw new IllegalStateException("ML sidecar пустой ответ: " + path);
                }

                return objectMapper.readValue(respBody, responseType);
            }

        } catch (IOException e) {
            throw new IllegalStateException("ML sidecar IO error: " + url + " -> " + e.getMessage(), e);
        }
    }

    private static String shrink(String s) {
        if (s == null) return "null";
        String x = s.trim().replaceAll("\\s+", " ");
        if (x.length() <= 400) return x;
        return x.substring(0, 400) + "...";
    }
}
