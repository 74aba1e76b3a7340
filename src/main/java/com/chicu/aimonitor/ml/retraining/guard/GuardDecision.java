package com.chicu.aimonitor.ml.retraining.guard;

import lombok.Builder;

/**
 * Решение guard'а. retryInMs заполнен только при отказе по интервалу.
 */
@Builder
public record GuardDecision(
        boolean allowed,
        String reason,
        Long retryInMs
) {
    public static GuardDecision allow() {
        return GuardDecision.builder().allowed(true).reason("OK").build();
    }

    public static GuardDecision deny(String reason, long retryInMs) {
        return GuardDecision.builder().allowed(false).reason(reason).retryInMs(retryInMs).build();
    }
}
