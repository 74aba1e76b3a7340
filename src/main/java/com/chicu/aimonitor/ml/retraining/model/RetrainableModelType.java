package com.chicu.aimonitor.ml.retraining.model;

/** Модели, которые умеет переобучать оркестратор */
public enum RetrainableModelType {
    ANOMALY_DETECTION("Anomaly Detection Model"),
    INSIDER_PREDICTOR("Insider Probability Predictor"),
    MARKET_PREDICTOR("Market Outcome Predictor"),
    SIGNAL_TRACKER("Signal Effectiveness Tracker");

    private final String description;

    RetrainableModelType(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
