package com.chicu.aimonitor.ml.retraining.model;

/** Откуда брать обучающие данные */
public enum DataSourceType {
    DATABASE,
    STREAM,
    CACHE,
    EXTERNAL_API,
    MANUAL_UPLOAD
}
