package com.chicu.aimonitor.ml.retraining.orchestrator;

import lombok.Getter;

/**
 * Синхронный отказ triggerRetraining: задача не создаётся.
 */
@Getter
public class RetrainingRejectedException extends RuntimeException {

    public enum Reason {
        DISABLED,
        CONCURRENCY_LIMIT
    }

    private final Reason reason;

    public RetrainingRejectedException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }
}
