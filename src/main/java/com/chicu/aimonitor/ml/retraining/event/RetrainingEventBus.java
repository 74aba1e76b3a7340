package com.chicu.aimonitor.ml.retraining.event;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Канал уведомлений оркестратора: явная регистрация колбэков на все события
 * или на конкретный тип.
 *
 * Исключение в слушателе логируется и не доходит до публикующего кода,
 * поэтому уведомления никогда не ломают состояние задачи.
 */
@Slf4j
@Component
public class RetrainingEventBus {

    private final List<Subscription> subscriptions = new CopyOnWriteArrayList<>();

    public RetrainingEventBus() {
    }

    @Autowired
    public RetrainingEventBus(ObjectProvider<RetrainingEventListener> listeners) {
        listeners.orderedStream().forEach(this::subscribe);
        log.info("📣 RetrainingEventBus поднят. Слушателей из контекста: {}", subscriptions.size());
    }

    public Subscription subscribe(RetrainingEventListener listener) {
        return subscribe(null, listener);
    }

    /**
     * @param type null = все события
     */
    public Subscription subscribe(RetrainingEventType type, RetrainingEventListener listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener=null");
        }
        Subscription s = new Subscription(type, listener);
        subscriptions.add(s);
        return s;
    }

    public boolean unsubscribe(Subscription subscription) {
        return subscriptions.remove(subscription);
    }

    public void publish(RetrainingEvent event) {
        if (event == null || event.type() == null) {
            log.warn("🚫 publish called with empty event");
            return;
        }

        for (Subscription s : subscriptions) {
            if (s.type() != null && s.type() != event.type()) continue;
            try {
                s.listener().onEvent(event);
            } catch (Exception e) {
                log.warn("⚠️ Listener failed on {} jobId={} scheduleId={}: {}",
                        event.type(), event.jobId(), event.scheduleId(), e.getMessage(), e);
            }
        }
    }

    public int listenerCount() {
        return subscriptions.size();
    }

    public void clear() {
        subscriptions.clear();
    }

    public record Subscription(RetrainingEventType type, RetrainingEventListener listener) {}
}
