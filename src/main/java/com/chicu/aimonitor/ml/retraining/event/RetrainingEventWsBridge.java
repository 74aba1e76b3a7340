package com.chicu.aimonitor.ml.retraining.event;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

/**
 * Пробрасывает события оркестратора в STOMP: /topic/retraining/{event_type}
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RetrainingEventWsBridge implements RetrainingEventListener {

    public static final String TOPIC_PREFIX = "/topic/retraining/";

    private final SimpMessagingTemplate ws;

    @Override
    public void onEvent(RetrainingEvent event) {
        String dest = TOPIC_PREFIX + event.type().topic();

        log.debug("📡 WS SEND → {} jobId={} scheduleId={}", dest, event.jobId(), event.scheduleId());
        ws.convertAndSend(dest, event);
    }
}
