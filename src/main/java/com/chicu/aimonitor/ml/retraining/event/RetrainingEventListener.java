package com.chicu.aimonitor.ml.retraining.event;

@FunctionalInterface
public interface RetrainingEventListener {

    void onEvent(RetrainingEvent event);
}
