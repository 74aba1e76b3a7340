package com.chicu.aimonitor.ml.retraining.data;

import com.chicu.aimonitor.ml.retraining.model.DataCollectionPolicy;
import com.chicu.aimonitor.ml.retraining.model.RetrainableModelType;
import com.chicu.aimonitor.ml.retraining.model.TrainingSample;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Синтетический генератор признаков кошельков, чтобы пайплайн работал без реального источника.
 *
 * Кол-во: min(maxSamples, max(minSamples, 500)), ~10% аномалий.
 * filterCriteria.excludeAnomalies=true отключает генерацию аномалий.
 */
@Slf4j
public class SyntheticTrainingDataCollector implements TrainingDataCollector {

    public static final int BASE_SAMPLES = 500;
    public static final double ANOMALY_RATE = 0.1;
    public static final double LABELED_SHARE = 0.7;

    private final Random random;
    private final Clock clock;

    public SyntheticTrainingDataCollector(Random random, Clock clock) {
        this.random = random;
        this.clock = clock;
    }

    @Override
    public List<TrainingSample> collect(RetrainableModelType modelType, DataCollectionPolicy policy) {
        int count = sampleCount(policy);
        boolean labeledOnly = Boolean.TRUE.equals(policy.labeledOnly());
        boolean excludeAnomalies = policy.filterCriteria() != null
                && Boolean.TRUE.equals(policy.filterCriteria().excludeAnomalies());
        long windowMs = policy.timeWindowMs() != null ? policy.timeWindowMs() : DataCollectionPolicy.DEFAULT_TIME_WINDOW_MS;

        Instant now = clock.instant();
        List<TrainingSample> samples = new ArrayList<>(count);

        for (int i = 0; i < count; i++) {
            boolean anomaly = !excludeAnomalies && random.nextDouble() < ANOMALY_RATE;

            Boolean label;
            if (labeledOnly) {
                label = anomaly;
            } else {
                label = random.nextDouble() < LABELED_SHARE ? anomaly : null;
            }

            samples.add(TrainingSample.builder()
                    .id("sample_" + now.toEpochMilli() + "_" + i)
                    .walletAddress(randomAddress())
                    .features(features(anomaly))
                    .label(label)
                    .timestamp(now.minusMillis((long) (random.nextDouble() * windowMs)))
                    .build());
        }

        log.debug("🧪 Synthetic data for {}: {} samples (labeledOnly={})", modelType, count, labeledOnly);
        return samples;
    }

    static int sampleCount(DataCollectionPolicy policy) {
        int min = policy.minSamples() != null ? policy.minSamples() : 0;
        int max = policy.maxSamples() != null ? policy.maxSamples() : Integer.MAX_VALUE;
        return Math.min(max, Math.max(min, BASE_SAMPLES));
    }

    private Map<String, Double> features(boolean anomaly) {
        Map<String, Double> f = new LinkedHashMap<>();
        f.put("wallet_age_days", uniform(0, 365));
        f.put("total_trades", (double) random.nextInt(1000));
        f.put("unique_markets", (double) random.nextInt(50));
        f.put("avg_trade_size", uniform(0, 10_000));
        f.put("trade_size_stddev", uniform(0, 5_000));
        f.put("buy_sell_ratio", random.nextDouble());
        f.put("holding_period_avg", uniform(0, 168));
        f.put("volume_spike_count", anomaly ? random.nextInt(20) + 5.0 : random.nextInt(3));
        f.put("whale_trade_count", anomaly ? random.nextInt(10) + 2.0 : random.nextInt(2));
        f.put("total_volume_usd", uniform(0, 100_000));
        f.put("off_hours_ratio", random.nextDouble());
        f.put("pre_event_trade_ratio", anomaly ? uniform(0.5, 1.0) : uniform(0, 0.3));
        f.put("timing_consistency_score", random.nextDouble());
        f.put("market_concentration", random.nextDouble());
        f.put("niche_market_ratio", anomaly ? uniform(0.5, 1.0) : uniform(0, 0.3));
        f.put("political_market_ratio", random.nextDouble());
        f.put("win_rate", anomaly ? uniform(0.7, 1.0) : uniform(0.2, 0.8));
        f.put("profit_factor", anomaly ? uniform(2, 5) : uniform(0.5, 2.5));
        f.put("max_consecutive_wins", anomaly ? random.nextInt(15) + 5.0 : random.nextInt(5));
        f.put("coordination_score", anomaly ? uniform(50, 100) : uniform(0, 30));
        f.put("cluster_membership_count", (double) random.nextInt(5));
        f.put("sybil_risk_score", anomaly ? uniform(30, 80) : uniform(0, 30));
        return f;
    }

    private double uniform(double from, double to) {
        return from + random.nextDouble() * (to - from);
    }

    private String randomAddress() {
        StringBuilder sb = new StringBuilder("0x");
        for (int i = 0; i < 40; i++) {
            sb.append(Character.forDigit(random.nextInt(16), 16));
        }
        return sb.toString();
    }
}
