package com.chicu.aimonitor.ml.retraining.model;

import java.util.List;

/**
 * Поле-за-полем слияние политик: непустое значение верхнего слоя перекрывает нижний.
 * Порядок слоёв: вызов > дефолты шедулера > зашитые дефолты.
 */
final class PolicyMerge {

    private PolicyMerge() {
    }

    static <T> T pick(T override, T base) {
        return override != null ? override : base;
    }

    static <T> List<T> pickList(List<T> override, List<T> base) {
        return override != null ? List.copyOf(override) : base;
    }
}
