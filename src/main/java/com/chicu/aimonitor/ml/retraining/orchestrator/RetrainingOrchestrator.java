package com.chicu.aimonitor.ml.retraining.orchestrator;

import com.chicu.aimonitor.ml.retraining.config.RetrainingProperties;
import com.chicu.aimonitor.ml.retraining.config.SchedulerSettings;
import com.chicu.aimonitor.ml.retraining.data.DataCollectionStage;
import com.chicu.aimonitor.ml.retraining.data.TrainingDataCollector;
import com.chicu.aimonitor.ml.retraining.deploy.DeploymentStage;
import com.chicu.aimonitor.ml.retraining.deploy.ModelDeployer;
import com.chicu.aimonitor.ml.retraining.event.RetrainingEvent;
import com.chicu.aimonitor.ml.retraining.event.RetrainingEventBus;
import com.chicu.aimonitor.ml.retraining.event.RetrainingEventType;
import com.chicu.aimonitor.ml.retraining.guard.GuardDecision;
import com.chicu.aimonitor.ml.retraining.guard.RetrainingIntervalGuard;
import com.chicu.aimonitor.ml.retraining.history.HistoryQuery;
import com.chicu.aimonitor.ml.retraining.history.RetrainingHistoryLedger;
import com.chicu.aimonitor.ml.retraining.history.RetrainingStatisticsAggregator;
import com.chicu.aimonitor.ml.retraining.model.DataCollectionPolicy;
import com.chicu.aimonitor.ml.retraining.model.DeploymentPolicy;
import com.chicu.aimonitor.ml.retraining.model.DeploymentResult;
import com.chicu.aimonitor.ml.retraining.model.RetrainableModelType;
import com.chicu.aimonitor.ml.retraining.model.RetrainingHistoryEntry;
import com.chicu.aimonitor.ml.retraining.model.RetrainingJob;
import com.chicu.aimonitor.ml.retraining.model.RetrainingJobConfig;
import com.chicu.aimonitor.ml.retraining.model.RetrainingJobStatus;
import com.chicu.aimonitor.ml.retraining.model.RetrainingOptions;
import com.chicu.aimonitor.ml.retraining.model.RetrainingSchedule;
import com.chicu.aimonitor.ml.retraining.model.ScheduleOptions;
import com.chicu.aimonitor.ml.retraining.model.ScheduleType;
import com.chicu.aimonitor.ml.retraining.model.ScheduleUpdate;
import com.chicu.aimonitor.ml.retraining.model.SchedulerStatistics;
import com.chicu.aimonitor.ml.retraining.model.TrainingSample;
import com.chicu.aimonitor.ml.retraining.model.TriggerReason;
import com.chicu.aimonitor.ml.retraining.model.ValidationPolicy;
import com.chicu.aimonitor.ml.retraining.model.ValidationResult;
import com.chicu.aimonitor.ml.retraining.performance.ModelPerformanceSource;
import com.chicu.aimonitor.ml.retraining.schedule.RetrainingScheduleStore;
import com.chicu.aimonitor.ml.retraining.schedule.RetrainingTimerBank;
import com.chicu.aimonitor.ml.retraining.schedule.ScheduleChange;
import com.chicu.aimonitor.ml.retraining.training.ModelTrainer;
import com.chicu.aimonitor.ml.retraining.training.TrainedModel;
import com.chicu.aimonitor.ml.retraining.training.TrainingStage;
import com.chicu.aimonitor.ml.retraining.validation.ValidationStage;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Оркестратор переобучения моделей.
 *
 * Владеет таблицей задач и множеством активных задач; расписаниями, таймерами,
 * историей и статистикой управляет через соответствующие компоненты.
 *
 * Жизненный цикл задачи:
 * PENDING → COLLECTING_DATA → TRAINING → VALIDATING → DEPLOYING → COMPLETED,
 * с выходами в FAILED / ROLLED_BACK и CANCELLED из любого не терминального состояния.
 *
 * Порядок мониторов всегда: оркестратор → задача.
 */
@Slf4j
@Service
public class RetrainingOrchestrator {

    public static final int PERFORMANCE_DROP_PRIORITY = 10;

    static final String MSG_CREATED = "Job created";
    static final String MSG_STARTING = "Starting retraining job";
    static final String MSG_COLLECTING = "Collecting training data";
    static final String MSG_TRAINING = "Training model";
    static final String MSG_VALIDATING = "Validating model";
    static final String MSG_DEPLOYING = "Deploying model";
    static final String MSG_COMPLETED = "Retraining completed successfully";

    static final String ERR_CANCELLED = "Job cancelled by user";
    static final String ERR_DEPLOYMENT_FAILED = "Deployment failed";
    static final String ERR_UNKNOWN = "Unknown error";

    private final RetrainingScheduleStore scheduleStore;
    private final RetrainingTimerBank timerBank;
    private final RetrainingHistoryLedger historyLedger;
    private final RetrainingStatisticsAggregator statistics;
    private final RetrainingIntervalGuard intervalGuard;
    private final RetrainingEventBus eventBus;

    private final DataCollectionStage dataStage;
    private final TrainingStage trainingStage;
    private final ValidationStage validationStage;
    private final DeploymentStage deploymentStage;

    private final Executor jobExecutor;
    private final Clock clock;

    private volatile SchedulerSettings settings;

    /** jobId → job, в порядке создания. Под монитором this */
    private final Map<String, RetrainingJob> jobs = new LinkedHashMap<>();

    /** не терминальные задачи. Под монитором this */
    private final Set<String> activeJobIds = new LinkedHashSet<>();

    /** modelType → modelId последнего COMPLETED. Под монитором this */
    private final Map<RetrainableModelType, String> deployedModelIds = new EnumMap<>(RetrainableModelType.class);

    /** накопленный объём новых данных по модели (для DATA_VOLUME_TRIGGER) */
    private final Map<RetrainableModelType, AtomicLong> pendingDataVolume = new ConcurrentHashMap<>();

    private final AtomicLong jobSeq = new AtomicLong();
    private final AtomicLong historySeq = new AtomicLong();

    public RetrainingOrchestrator(RetrainingProperties properties,
                                  RetrainingScheduleStore scheduleStore,
                                  RetrainingTimerBank timerBank,
                                  RetrainingHistoryLedger historyLedger,
                                  RetrainingStatisticsAggregator statistics,
                                  RetrainingIntervalGuard intervalGuard,
                                  RetrainingEventBus eventBus,
                                  DataCollectionStage dataStage,
                                  TrainingStage trainingStage,
                                  ValidationStage validationStage,
                                  DeploymentStage deploymentStage,
                                  @Qualifier("retrainingJobExecutor") Executor jobExecutor,
                                  Clock clock) {
        this.scheduleStore = scheduleStore;
        this.timerBank = timerBank;
        this.historyLedger = historyLedger;
        this.statistics = statistics;
        this.intervalGuard = intervalGuard;
        this.eventBus = eventBus;
        this.dataStage = dataStage;
        this.trainingStage = trainingStage;
        this.validationStage = validationStage;
        this.deploymentStage = deploymentStage;
        this.jobExecutor = jobExecutor;
        this.clock = clock;
        this.settings = properties.toSettings();

        log.info("🧠 RetrainingOrchestrator поднят. enabled={} maxConcurrentJobs={} minIntervalMs={} trainer={}",
                settings.isEnabled(), settings.maxConcurrentJobs(), settings.minRetrainingIntervalMs(),
                trainingStage.hasTrainer() ? "registered" : "simulated");
    }

    // =====================================================================
    // ⚙️ CONFIG
    // =====================================================================

    public SchedulerSettings getConfig() {
        return settings;
    }

    /**
     * Частичное обновление: null-поля не меняются, политики сливаются по полям.
     */
    public synchronized SchedulerSettings updateConfig(SchedulerSettings patch) {
        if (patch == null) return settings;
        if (patch.maxConcurrentJobs() != null && patch.maxConcurrentJobs() < 1) {
            throw new IllegalArgumentException("maxConcurrentJobs must be >= 1");
        }
        if (patch.performanceDropThreshold() != null
                && (patch.performanceDropThreshold() < 0 || patch.performanceDropThreshold() > 1)) {
            throw new IllegalArgumentException("performanceDropThreshold must be in [0..1]");
        }

        SchedulerSettings current = settings;
        settings = current.mergedWith(patch).toBuilder()
                .defaultDataCollection(current.defaultDataCollection().mergedWith(patch.defaultDataCollection()))
                .defaultValidation(current.defaultValidation().mergedWith(patch.defaultValidation()))
                .defaultDeployment(current.defaultDeployment().mergedWith(patch.defaultDeployment()))
                .build();

        log.info("⚙️ Retraining config updated: enabled={} maxConcurrentJobs={} autoPerf={} dropThreshold={} minIntervalMs={}",
                settings.isEnabled(), settings.maxConcurrentJobs(), settings.isAutoPerformanceRetraining(),
                settings.performanceDropThreshold(), settings.minRetrainingIntervalMs());
        return settings;
    }

    public void setTrainer(ModelTrainer trainer) {
        trainingStage.setTrainer(trainer);
    }

    public void setPerformanceSource(ModelPerformanceSource source) {
        validationStage.setPerformanceSource(source);
    }

    public void setDataCollector(TrainingDataCollector collector) {
        dataStage.setCollector(collector);
    }

    public void setDeployer(ModelDeployer deployer) {
        deploymentStage.setDeployer(deployer);
    }

    // =====================================================================
    // 🗓 SCHEDULES
    // =====================================================================

    public RetrainingSchedule createSchedule(RetrainableModelType modelType,
                                             ScheduleType scheduleType,
                                             ScheduleOptions options) {
        RetrainingSchedule s = scheduleStore.create(modelType, scheduleType, options);

        if (s.isEnabled() && s.getScheduleType().isTimerDriven() && settings.isEnabled()) {
            startTimer(s);
        }

        emit(RetrainingEventType.SCHEDULE_CREATED, null, s.getScheduleId(), s.getModelType(),
                payload("scheduleType", s.getScheduleType(), "enabled", s.isEnabled(),
                        "intervalMs", s.getIntervalMs(), "nextExecutionAt", s.getNextExecutionAt()));
        return s;
    }

    public Optional<RetrainingSchedule> updateSchedule(String scheduleId, ScheduleUpdate patch) {
        Optional<ScheduleChange> change = scheduleStore.update(scheduleId, patch);
        if (change.isEmpty()) return Optional.empty();

        ScheduleChange c = change.get();
        RetrainingSchedule after = c.after();

        if (!after.isEnabled()) {
            timerBank.stop(scheduleId);
        } else if (after.getScheduleType().isTimerDriven() && settings.isEnabled()
                && (c.enabledChanged() || c.intervalChanged() || !timerBank.isRunning(scheduleId))) {
            startTimer(after);
        }

        emit(RetrainingEventType.SCHEDULE_UPDATED, null, scheduleId, after.getModelType(),
                payload("enabled", after.isEnabled(), "intervalMs", after.getIntervalMs()));
        return Optional.of(after);
    }

    public boolean deleteSchedule(String scheduleId) {
        if (scheduleStore.get(scheduleId).isEmpty()) return false;

        timerBank.stop(scheduleId);
        Optional<RetrainingSchedule> removed = scheduleStore.delete(scheduleId);
        removed.ifPresent(s -> emit(RetrainingEventType.SCHEDULE_DELETED, null, scheduleId, s.getModelType(), Map.of()));
        return removed.isPresent();
    }

    public Optional<RetrainingSchedule> getSchedule(String scheduleId) {
        return scheduleStore.get(scheduleId);
    }

    public List<RetrainingSchedule> getAllSchedules() {
        return scheduleStore.listAll();
    }

    public List<RetrainingSchedule> getSchedulesForModel(RetrainableModelType modelType) {
        return scheduleStore.listForModel(modelType);
    }

    private void startTimer(RetrainingSchedule s) {
        String id = s.getScheduleId();
        timerBank.start(id, s.getIntervalMs(), () -> onScheduleFire(id));
    }

    /**
     * Тик таймера. Расписание перечитывается по id: таймер не держит ссылку на объект.
     */
    void onScheduleFire(String scheduleId) {
        Optional<RetrainingSchedule> found = scheduleStore.get(scheduleId);
        if (found.isEmpty() || !found.get().isEnabled()) {
            log.debug("⏭ Timer fire ignored: scheduleId={} missing or disabled", scheduleId);
            return;
        }

        RetrainingSchedule schedule = found.get();
        SchedulerSettings cfg = settings;
        if (!cfg.isEnabled()) {
            log.debug("⏭ Timer fire ignored: scheduler disabled (scheduleId={})", scheduleId);
            return;
        }

        GuardDecision decision = intervalGuard.check(schedule.getModelType(), cfg.minRetrainingIntervalMs());
        if (!decision.allowed()) {
            log.debug("⏭ Timer fire skipped scheduleId={} type={}: {}",
                    scheduleId, schedule.getModelType(), decision.reason());
            return;
        }

        try {
            triggerRetraining(schedule.getModelType(), TriggerReason.SCHEDULED,
                    RetrainingOptions.builder().scheduleId(scheduleId).build());
            scheduleStore.markExecuted(scheduleId);
        } catch (RetrainingRejectedException e) {
            log.warn("⚠️ Scheduled retraining rejected scheduleId={} type={}: {}",
                    scheduleId, schedule.getModelType(), e.getMessage());
            emit(RetrainingEventType.ERROR, null, scheduleId, schedule.getModelType(),
                    payload("message", e.getMessage(), "context", "Schedule " + scheduleId));
        }
    }

    // =====================================================================
    // ▶️ TRIGGER
    // =====================================================================

    public RetrainingJob triggerRetraining(RetrainableModelType modelType,
                                           TriggerReason triggerReason,
                                           RetrainingOptions options) {
        if (modelType == null) throw new IllegalArgumentException("modelType=null");
        if (triggerReason == null) throw new IllegalArgumentException("triggerReason=null");

        RetrainingOptions o = options != null ? options : RetrainingOptions.none();
        RetrainingJob job;

        synchronized (this) {
            SchedulerSettings cfg = settings;

            if (!cfg.isEnabled()) {
                throw reject(RetrainingRejectedException.Reason.DISABLED, "Retraining scheduler is disabled");
            }
            if (activeJobIds.size() >= cfg.maxConcurrentJobs()) {
                throw reject(RetrainingRejectedException.Reason.CONCURRENCY_LIMIT,
                        "Maximum concurrent jobs (" + cfg.maxConcurrentJobs() + ") reached");
            }

            RetrainingJobConfig config = RetrainingJobConfig.builder()
                    .modelType(modelType)
                    .dataCollection(DataCollectionPolicy.defaults()
                            .mergedWith(cfg.defaultDataCollection())
                            .mergedWith(o.dataCollection()))
                    .validation(ValidationPolicy.defaults()
                            .mergedWith(cfg.defaultValidation())
                            .mergedWith(o.validation()))
                    .deployment(DeploymentPolicy.defaults()
                            .mergedWith(cfg.defaultDeployment())
                            .mergedWith(o.deployment()))
                    .triggerReason(triggerReason)
                    .scheduleId(o.scheduleId())
                    .priority(o.priority() != null ? o.priority() : RetrainingOptions.DEFAULT_PRIORITY)
                    .tags(o.tags())
                    .build();

            Instant now = clock.instant();
            job = RetrainingJob.builder()
                    .jobId("job_" + now.toEpochMilli() + "_" + jobSeq.incrementAndGet())
                    .config(config)
                    .status(RetrainingJobStatus.PENDING)
                    .progress(0)
                    .stageMessage(MSG_CREATED)
                    .previousModelId(deployedModelIds.get(modelType))
                    .createdAt(now)
                    .build();

            jobs.put(job.getJobId(), job);
            activeJobIds.add(job.getJobId());
        }

        log.info("🧠 RETRAIN JOB CREATED jobId={} type={} reason={} scheduleId={} priority={} active={}",
                job.getJobId(), modelType, triggerReason, o.scheduleId(), job.getConfig().priority(), activeCount());

        emit(RetrainingEventType.JOB_CREATED, job.getJobId(), o.scheduleId(), modelType,
                payload("triggerReason", triggerReason, "priority", job.getConfig().priority()));

        RetrainingJob created = job.snapshot();

        try {
            jobExecutor.execute(() -> runJob(job));
        } catch (RejectedExecutionException e) {
            log.error("❌ Job executor rejected jobId={}: {}", job.getJobId(), e.getMessage(), e);
            fail(job, "Job executor rejected: " + e.getMessage());
        }

        return created;
    }

    // =====================================================================
    // 🏃 PIPELINE
    // =====================================================================

    private void runJob(RetrainingJob job) {
        RetrainingJobConfig cfg = job.getConfig();
        RetrainableModelType type = cfg.modelType();
        String jobId = job.getJobId();

        try {
            boolean started = progress(job, 5, MSG_STARTING, j -> {
                j.setStartedAt(clock.instant());
                emit(RetrainingEventType.JOB_STARTED, jobId, cfg.scheduleId(), type,
                        payload("triggerReason", cfg.triggerReason()));
            });
            if (!started) return;

            // ==== 1. data ====
            if (!advance(job, RetrainingJobStatus.COLLECTING_DATA, 10, MSG_COLLECTING)) return;

            List<TrainingSample> samples = dataStage.collect(type, cfg.dataCollection());
            int minSamples = cfg.dataCollection().minSamples();
            if (samples.size() < minSamples) {
                fail(job, "Insufficient training samples: " + samples.size() + " < " + minSamples);
                return;
            }

            // ==== 2. train ====
            if (!advance(job, RetrainingJobStatus.TRAINING, 30, MSG_TRAINING)) return;

            TrainedModel model = trainingStage.train(type, samples, job.getPreviousModelId());
            if (!mutate(job, j -> {
                j.setNewModelId(model.modelId());
                j.setTrainingMetrics(model.metrics());
            })) return;

            // ==== 3. validate ====
            if (!advance(job, RetrainingJobStatus.VALIDATING, 60, MSG_VALIDATING)) return;

            ValidationResult validation = validationStage.validate(type, model.metrics(), samples.size(), cfg.validation());
            if (!mutate(job, j -> j.setValidationResult(validation))) return;

            if (!validation.passed()) {
                emit(RetrainingEventType.VALIDATION_FAILED, jobId, cfg.scheduleId(), type,
                        payload("failureReason", validation.failureReason(),
                                "newAccuracy", validation.newModelAccuracy(),
                                "oldAccuracy", validation.oldModelAccuracy()));
                rollBack(job, validation.failureReason() != null ? validation.failureReason() : "Validation failed");
                return;
            }

            emit(RetrainingEventType.VALIDATION_PASSED, jobId, cfg.scheduleId(), type,
                    payload("newAccuracy", validation.newModelAccuracy(),
                            "oldAccuracy", validation.oldModelAccuracy(),
                            "improvement", validation.improvement()));

            // ==== 4. deploy ====
            if (!advance(job, RetrainingJobStatus.DEPLOYING, 80, MSG_DEPLOYING)) return;

            DeploymentResult deployment = deploymentStage.deploy(type, model.modelId(), job.getPreviousModelId(), cfg.deployment());
            if (!mutate(job, j -> j.setDeploymentResult(deployment))) return;

            if (!deployment.success()) {
                if (deployment.rolledBack()) {
                    rollBack(job, deployment.rollbackReason() != null ? deployment.rollbackReason() : ERR_DEPLOYMENT_FAILED);
                } else {
                    fail(job, ERR_DEPLOYMENT_FAILED);
                }
                return;
            }

            complete(job, model, validation);

        } catch (Exception e) {
            String msg = e.getMessage() != null && !e.getMessage().isBlank() ? e.getMessage() : ERR_UNKNOWN;
            log.error("❌ RETRAIN JOB FAILED jobId={} type={} stage={} : {}",
                    jobId, type, job.getStatus(), msg, e);
            fail(job, msg);
        }
    }

    /**
     * Мутация задачи под её монитором. false = задача уже терминальная (например, отменена),
     * изменение отброшено и пайплайн должен остановиться.
     */
    private boolean mutate(RetrainingJob job, Consumer<RetrainingJob> change) {
        synchronized (job) {
            if (job.isTerminal()) {
                log.debug("⏭ jobId={} already {}, stage update discarded", job.getJobId(), job.getStatus());
                return false;
            }
            change.accept(job);
            return true;
        }
    }

    private boolean advance(RetrainingJob job, RetrainingJobStatus status, int progress, String message) {
        return progress(job, progress, message, j -> j.setStatus(status));
    }

    /**
     * Переход стадии вместе с событием прогресса. Публикация идёт под мониторами
     * оркестратора и задачи (порядок как в finish), поэтому cancelJob не может
     * вклиниться между мутацией и событием: после CANCELLED прогресса нет.
     */
    private boolean progress(RetrainingJob job, int progress, String message, Consumer<RetrainingJob> change) {
        synchronized (this) {
            synchronized (job) {
                if (job.isTerminal()) {
                    log.debug("⏭ jobId={} already {}, progress {} discarded", job.getJobId(), job.getStatus(), progress);
                    return false;
                }
                change.accept(job);
                job.setProgress(progress);
                job.setStageMessage(message);
                emitProgress(job, progress, message);
                return true;
            }
        }
    }

    private void emitProgress(RetrainingJob job, int progress, String message) {
        emit(RetrainingEventType.JOB_PROGRESS, job.getJobId(), job.getConfig().scheduleId(), job.getModelType(),
                payload("progress", progress, "stage", message));
    }

    // =====================================================================
    // 🏁 TERMINAL
    // =====================================================================

    private void complete(RetrainingJob job, TrainedModel model, ValidationResult validation) {
        if (!finish(job, RetrainingJobStatus.COMPLETED, null)) return;

        intervalGuard.markRetrained(job.getModelType());

        log.info("✅ RETRAIN JOB COMPLETED jobId={} type={} modelId={} prev={} improvement={} durationMs={}",
                job.getJobId(), job.getModelType(), model.modelId(), job.getPreviousModelId(),
                validation.improvement(), job.getDurationMs());

        emit(RetrainingEventType.MODEL_DEPLOYED, job.getJobId(), job.getConfig().scheduleId(), job.getModelType(),
                payload("modelId", model.modelId(), "previousModelId", job.getPreviousModelId()));
        emit(RetrainingEventType.JOB_COMPLETED, job.getJobId(), job.getConfig().scheduleId(), job.getModelType(),
                payload("modelId", model.modelId(),
                        "improvement", validation.improvement(),
                        "accuracy", validation.newModelAccuracy()));
    }

    private void rollBack(RetrainingJob job, String reason) {
        if (!finish(job, RetrainingJobStatus.ROLLED_BACK, reason)) return;

        log.warn("↩️ RETRAIN JOB ROLLED_BACK jobId={} type={} reason={}", job.getJobId(), job.getModelType(), reason);
        emit(RetrainingEventType.JOB_ROLLED_BACK, job.getJobId(), job.getConfig().scheduleId(), job.getModelType(),
                payload("reason", reason));
    }

    private void fail(RetrainingJob job, String error) {
        if (!finish(job, RetrainingJobStatus.FAILED, error)) return;

        log.warn("❌ RETRAIN JOB FAILED jobId={} type={} error={}", job.getJobId(), job.getModelType(), error);
        emit(RetrainingEventType.JOB_FAILED, job.getJobId(), job.getConfig().scheduleId(), job.getModelType(),
                payload("error", error));
        emit(RetrainingEventType.ERROR, job.getJobId(), job.getConfig().scheduleId(), job.getModelType(),
                payload("message", error, "context", "Job " + job.getJobId()));
    }

    /**
     * Единственная точка перехода в терминальный статус: освобождает слот
     * и пишет ровно одну запись в историю. false = задача уже была терминальной.
     */
    private boolean finish(RetrainingJob job, RetrainingJobStatus status, String error) {
        RetrainingHistoryEntry entry;

        synchronized (this) {
            synchronized (job) {
                if (job.isTerminal()) return false;

                Instant now = clock.instant();
                job.setStatus(status);
                job.setError(error);
                job.setCompletedAt(now);

                Instant from = job.getStartedAt() != null ? job.getStartedAt() : job.getCreatedAt();
                job.setDurationMs(Duration.between(from, now).toMillis());

                if (status == RetrainingJobStatus.COMPLETED) {
                    job.setProgress(100);
                    job.setStageMessage(MSG_COMPLETED);
                }

                entry = historyEntryOf(job, now);
            }

            activeJobIds.remove(job.getJobId());
            if (status == RetrainingJobStatus.COMPLETED) {
                deployedModelIds.put(job.getModelType(), job.getNewModelId());
            }
            historyLedger.append(entry);
        }

        if (status == RetrainingJobStatus.COMPLETED) {
            emitProgress(job, 100, MSG_COMPLETED);
        }
        return true;
    }

    private RetrainingHistoryEntry historyEntryOf(RetrainingJob job, Instant now) {
        ValidationResult v = job.getValidationResult();
        boolean completed = job.getStatus() == RetrainingJobStatus.COMPLETED;

        return RetrainingHistoryEntry.builder()
                .entryId("history_" + now.toEpochMilli() + "_" + historySeq.incrementAndGet())
                .jobId(job.getJobId())
                .modelType(job.getModelType())
                .triggerReason(job.getConfig().triggerReason())
                .status(job.getStatus())
                .previousAccuracy(v != null ? v.oldModelAccuracy() : 0.0)
                .newAccuracy(completed && v != null ? v.newModelAccuracy() : null)
                .improvement(completed && v != null ? v.improvement() : null)
                .trainingSamples(job.getTrainingMetrics() != null ? job.getTrainingMetrics().samplesUsed() : 0)
                .durationMs(job.getDurationMs() != null ? job.getDurationMs() : 0L)
                .timestamp(now)
                .notes(completed ? "Deployed " + job.getNewModelId() : job.getError())
                .build();
    }

    // =====================================================================
    // 🔎 JOBS
    // =====================================================================

    public synchronized Optional<RetrainingJob> getJob(String jobId) {
        return Optional.ofNullable(jobs.get(jobId)).map(RetrainingJob::snapshot);
    }

    public synchronized List<RetrainingJob> getAllJobs() {
        return jobs.values().stream().map(RetrainingJob::snapshot).toList();
    }

    public synchronized List<RetrainingJob> getActiveJobs() {
        List<RetrainingJob> out = new ArrayList<>();
        for (String id : activeJobIds) {
            RetrainingJob j = jobs.get(id);
            if (j != null) out.add(j.snapshot());
        }
        return out;
    }

    public synchronized List<RetrainingJob> getJobsByStatus(RetrainingJobStatus status) {
        return jobs.values().stream()
                .map(RetrainingJob::snapshot)
                .filter(j -> j.getStatus() == status)
                .toList();
    }

    public synchronized int activeCount() {
        return activeJobIds.size();
    }

    public boolean cancelJob(String jobId) {
        RetrainingJob job;
        synchronized (this) {
            job = jobs.get(jobId);
        }
        if (job == null) return false;

        if (!finish(job, RetrainingJobStatus.CANCELLED, ERR_CANCELLED)) {
            return false;
        }

        log.info("🛑 RETRAIN JOB CANCELLED jobId={} type={}", jobId, job.getModelType());
        emit(RetrainingEventType.JOB_CANCELLED, jobId, job.getConfig().scheduleId(), job.getModelType(), Map.of());
        return true;
    }

    // =====================================================================
    // 📉 PERFORMANCE / 📦 DATA VOLUME
    // =====================================================================

    /**
     * Первая модель, чья текущая точность упала ниже baseline·(1 − threshold),
     * получает задачу PERFORMANCE_DROP с приоритетом 10 (если guard пускает).
     */
    public Optional<RetrainingJob> checkPerformanceAndTrigger() {
        SchedulerSettings cfg = settings;
        if (!cfg.isAutoPerformanceRetraining()) return Optional.empty();

        for (RetrainableModelType type : RetrainableModelType.values()) {
            double current = validationStage.currentAccuracy(type);
            double baseline = historyLedger.baselineAccuracy(type);
            double threshold = baseline * (1 - cfg.performanceDropThreshold());

            if (current >= threshold) continue;

            log.info("📉 PERFORMANCE DROP type={} current={} baseline={} threshold={}",
                    type, current, baseline, threshold);
            emit(RetrainingEventType.PERFORMANCE_TRIGGER, null, null, type,
                    payload("currentAccuracy", current, "baselineAccuracy", baseline, "threshold", threshold));

            GuardDecision decision = intervalGuard.check(type, cfg.minRetrainingIntervalMs());
            if (!decision.allowed()) {
                log.info("⏭ PERFORMANCE retrain skipped type={}: {}", type, decision.reason());
                continue;
            }

            return Optional.of(triggerRetraining(type, TriggerReason.PERFORMANCE_DROP,
                    RetrainingOptions.builder().priority(PERFORMANCE_DROP_PRIORITY).build()));
        }
        return Optional.empty();
    }

    /**
     * Учитывает новые данные по модели. Возвращает накопленный объём.
     */
    public long recordNewData(RetrainableModelType modelType, long count) {
        if (modelType == null) throw new IllegalArgumentException("modelType=null");
        if (count < 0) throw new IllegalArgumentException("count must be >= 0");

        long total = pendingDataVolume.computeIfAbsent(modelType, k -> new AtomicLong()).addAndGet(count);
        log.debug("📦 new data type={} +{} total={}", modelType, count, total);
        return total;
    }

    public long getPendingDataVolume(RetrainableModelType modelType) {
        AtomicLong v = pendingDataVolume.get(modelType);
        return v != null ? v.get() : 0L;
    }

    /**
     * Первое включённое DATA_VOLUME_TRIGGER расписание, чей порог достигнут,
     * порождает задачу NEW_DATA_AVAILABLE; учтённый объём списывается.
     */
    public Optional<RetrainingJob> checkDataVolumeAndTrigger() {
        SchedulerSettings cfg = settings;

        for (RetrainingSchedule s : scheduleStore.listAll()) {
            if (!s.isEnabled() || s.getScheduleType() != ScheduleType.DATA_VOLUME_TRIGGER) continue;

            RetrainableModelType type = s.getModelType();
            long volume = getPendingDataVolume(type);
            long threshold = s.getDataVolumeThreshold() != null
                    ? s.getDataVolumeThreshold()
                    : RetrainingSchedule.DEFAULT_DATA_VOLUME_THRESHOLD;

            if (volume < threshold) continue;

            log.info("📦 DATA VOLUME TRIGGER type={} volume={} threshold={} scheduleId={}",
                    type, volume, threshold, s.getScheduleId());
            emit(RetrainingEventType.DATA_VOLUME_TRIGGER, null, s.getScheduleId(), type,
                    payload("volume", volume, "threshold", threshold));

            GuardDecision decision = intervalGuard.check(type, cfg.minRetrainingIntervalMs());
            if (!decision.allowed()) {
                log.info("⏭ DATA VOLUME retrain skipped type={}: {}", type, decision.reason());
                continue;
            }

            RetrainingJob job = triggerRetraining(type, TriggerReason.NEW_DATA_AVAILABLE,
                    RetrainingOptions.builder().scheduleId(s.getScheduleId()).build());

            pendingDataVolume.computeIfAbsent(type, k -> new AtomicLong()).addAndGet(-volume);
            scheduleStore.markExecuted(s.getScheduleId());
            return Optional.of(job);
        }
        return Optional.empty();
    }

    // =====================================================================
    // 📜 HISTORY / 📊 STATS
    // =====================================================================

    public List<RetrainingHistoryEntry> getHistory(HistoryQuery query) {
        return historyLedger.query(query);
    }

    public SchedulerStatistics getStatistics() {
        SchedulerSettings cfg = settings;
        return statistics.get(cfg.isCacheEnabled(), cfg.cacheTtlMs(), this::getAllJobs, scheduleStore::countEnabled);
    }

    public void clearCache() {
        statistics.clearCache();
    }

    // =====================================================================
    // ▶️ / ⏹ LIFECYCLE
    // =====================================================================

    public synchronized void start() {
        settings = settings.toBuilder().enabled(true).build();

        int started = 0;
        for (RetrainingSchedule s : scheduleStore.listAll()) {
            if (s.isEnabled() && s.getScheduleType().isTimerDriven()) {
                startTimer(s);
                started++;
            }
        }
        log.info("▶️ Retraining scheduler started. timers={}", started);
    }

    public synchronized void stop() {
        settings = settings.toBuilder().enabled(false).build();
        timerBank.stopAll();
        log.info("⏹ Retraining scheduler stopped");
    }

    public boolean isRunning() {
        return settings.isEnabled();
    }

    public int runningTimers() {
        return timerBank.runningIds().size();
    }

    /**
     * Полный сброс in-memory состояния. Задачи в полёте доработают, но их апдейты
     * уже никуда не попадут.
     */
    @PreDestroy
    public void destroy() {
        stop();
        synchronized (this) {
            scheduleStore.clear();
            jobs.clear();
            activeJobIds.clear();
            deployedModelIds.clear();
            historyLedger.clear();
        }
        pendingDataVolume.clear();
        intervalGuard.clear();
        statistics.clearCache();
        eventBus.clear();
        log.info("💤 RetrainingOrchestrator destroyed");
    }

    // =====================================================================
    // helpers
    // =====================================================================

    private static RetrainingRejectedException reject(RetrainingRejectedException.Reason reason, String message) {
        log.warn("⛔ RETRAIN REJECTED reason={} : {}", reason, message);
        return new RetrainingRejectedException(reason, message);
    }

    private void emit(RetrainingEventType type,
                      String jobId,
                      String scheduleId,
                      RetrainableModelType modelType,
                      Map<String, Object> payload) {
        eventBus.publish(RetrainingEvent.builder()
                .type(type)
                .jobId(jobId)
                .scheduleId(scheduleId)
                .modelType(modelType)
                .payload(payload)
                .time(clock.instant())
                .build());
    }

    /**
     * key/value пары, null-значения пропускаются.
     */
    private static Map<String, Object> payload(Object... kv) {
        Map<String, Object> m = new LinkedHashMap<>();
        for (int i = 0; i + 1 < kv.length; i += 2) {
            if (kv[i + 1] != null) {
                m.put(String.valueOf(kv[i]), kv[i + 1]);
            }
        }
        return m;
    }
}
