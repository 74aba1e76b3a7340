package com.chicu.aimonitor.ml.retraining.history;

import com.chicu.aimonitor.ml.retraining.model.RetrainableModelType;
import com.chicu.aimonitor.ml.retraining.model.RetrainingHistoryEntry;
import com.chicu.aimonitor.ml.retraining.model.RetrainingJobStatus;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Append-only журнал терминальных исходов задач (в порядке завершения).
 */
@Component
public class RetrainingHistoryLedger {

    public static final double DEFAULT_BASELINE_ACCURACY = 0.8;
    static final int BASELINE_WINDOW = 5;

    private final List<RetrainingHistoryEntry> entries = new ArrayList<>();

    public synchronized void append(RetrainingHistoryEntry entry) {
        entries.add(entry);
    }

    /**
     * filter(modelType, status) → sort(timestamp desc) → offset → limit
     */
    public synchronized List<RetrainingHistoryEntry> query(HistoryQuery q) {
        HistoryQuery query = q != null ? q : HistoryQuery.all();

        Stream<RetrainingHistoryEntry> s = entries.stream();
        if (query.modelType() != null) {
            s = s.filter(e -> e.modelType() == query.modelType());
        }
        if (query.status() != null) {
            s = s.filter(e -> e.status() == query.status());
        }

        s = s.sorted(Comparator.comparing(RetrainingHistoryEntry::timestamp).reversed());

        if (query.offset() != null && query.offset() > 0) {
            s = s.skip(query.offset());
        }
        if (query.limit() != null && query.limit() > 0) {
            s = s.limit(query.limit());
        }
        return s.toList();
    }

    /**
     * Среднее newAccuracy последних пяти COMPLETED записей модели, иначе 0.8.
     */
    public synchronized double baselineAccuracy(RetrainableModelType type) {
        List<Double> accuracies = entries.stream()
                .filter(e -> e.modelType() == type)
                .filter(e -> e.status() == RetrainingJobStatus.COMPLETED)
                .filter(e -> e.newAccuracy() != null)
                .map(RetrainingHistoryEntry::newAccuracy)
                .toList();

        if (accuracies.isEmpty()) return DEFAULT_BASELINE_ACCURACY;

        List<Double> recent = accuracies.subList(Math.max(0, accuracies.size() - BASELINE_WINDOW), accuracies.size());
        return recent.stream().mapToDouble(Double::doubleValue).average().orElse(DEFAULT_BASELINE_ACCURACY);
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized void clear() {
        entries.clear();
    }
}
