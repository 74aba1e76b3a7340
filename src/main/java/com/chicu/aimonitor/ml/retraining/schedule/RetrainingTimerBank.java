package com.chicu.aimonitor.ml.retraining.schedule;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Периодические таймеры INTERVAL-расписаний, ключ = scheduleId.
 *
 * Банк ничего не знает о расписаниях: на каждом тике просто зовёт переданный колбэк.
 * Исключение из колбэка логируется, таймер продолжает работать.
 */
@Slf4j
@Component
public class RetrainingTimerBank {

    private static final AtomicInteger THREAD_SEQ = new AtomicInteger();

    /**
     * daemon=true чтобы не блокировать завершение приложения.
     */
    private final ScheduledExecutorService executor =
            Executors.newScheduledThreadPool(
                    2,
                    r -> {
                        Thread t = new Thread(r);
                        t.setDaemon(true);
                        t.setName("retraining-timer-" + THREAD_SEQ.incrementAndGet());
                        return t;
                    }
            );

    /** scheduleId → future таймера */
    private final Map<String, ScheduledFuture<?>> timers = new ConcurrentHashMap<>();

    // ==============================================================
    // ▶️ START
    // ==============================================================
    public synchronized void start(String scheduleId, long intervalMs, Runnable onFire) {
        if (intervalMs <= 0) {
            throw new IllegalArgumentException("intervalMs must be > 0");
        }

        // если таймер уже крутится, сначала гасим
        stop(scheduleId);

        ScheduledFuture<?> future = executor.scheduleAtFixedRate(
                () -> fireSafely(scheduleId, onFire),
                intervalMs,
                intervalMs,
                TimeUnit.MILLISECONDS
        );

        timers.put(scheduleId, future);
        log.info("⏱ Timer started scheduleId={} intervalMs={}", scheduleId, intervalMs);
    }

    // ==============================================================
    // ⏹ STOP
    // ==============================================================
    public synchronized boolean stop(String scheduleId) {
        ScheduledFuture<?> future = timers.remove(scheduleId);
        if (future == null) return false;

        future.cancel(false);
        log.info("🛑 Timer stopped scheduleId={}", scheduleId);
        return true;
    }

    public synchronized void stopAll() {
        for (String id : Set.copyOf(timers.keySet())) {
            stop(id);
        }
    }

    // ==============================================================
    // ℹ STATUS
    // ==============================================================
    public boolean isRunning(String scheduleId) {
        ScheduledFuture<?> future = timers.get(scheduleId);
        return future != null && !future.isCancelled() && !future.isDone();
    }

    public Set<String> runningIds() {
        return Set.copyOf(timers.keySet());
    }

    private void fireSafely(String scheduleId, Runnable onFire) {
        try {
            onFire.run();
        } catch (Exception e) {
            log.error("❌ Timer fire failed scheduleId={}: {}", scheduleId, e.getMessage(), e);
        }
    }

    // ==============================================================
    // 🛑 SHUTDOWN
    // ==============================================================
    @PreDestroy
    public void shutdown() {
        log.info("💤 RetrainingTimerBank shutting down… timers={}", timers.size());
        timers.clear();
        executor.shutdownNow();
    }
}
