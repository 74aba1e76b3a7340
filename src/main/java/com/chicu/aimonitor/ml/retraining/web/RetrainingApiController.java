package com.chicu.aimonitor.ml.retraining.web;

import com.chicu.aimonitor.ml.retraining.config.SchedulerSettings;
import com.chicu.aimonitor.ml.retraining.history.HistoryQuery;
import com.chicu.aimonitor.ml.retraining.model.RetrainableModelType;
import com.chicu.aimonitor.ml.retraining.model.RetrainingHistoryEntry;
import com.chicu.aimonitor.ml.retraining.model.RetrainingJob;
import com.chicu.aimonitor.ml.retraining.model.RetrainingJobStatus;
import com.chicu.aimonitor.ml.retraining.model.RetrainingSchedule;
import com.chicu.aimonitor.ml.retraining.model.SchedulerStatistics;
import com.chicu.aimonitor.ml.retraining.orchestrator.RetrainingOrchestrator;
import com.chicu.aimonitor.ml.retraining.web.dto.DataVolumeRequest;
import com.chicu.aimonitor.ml.retraining.web.dto.ScheduleCreateRequest;
import com.chicu.aimonitor.ml.retraining.web.dto.ScheduleUpdateRequest;
import com.chicu.aimonitor.ml.retraining.web.dto.TriggerRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping(value = "/api/ml/retraining", produces = MediaType.APPLICATION_JSON_VALUE)
public class RetrainingApiController {

    private final RetrainingOrchestrator orchestrator;

    // ==============================================================
    // 🗓 SCHEDULES
    // ==============================================================

    @GetMapping("/schedules")
    public List<RetrainingSchedule> schedules(@RequestParam(required = false) RetrainableModelType modelType) {
        return modelType != null
                ? orchestrator.getSchedulesForModel(modelType)
                : orchestrator.getAllSchedules();
    }

    @PostMapping("/schedules")
    public ResponseEntity<RetrainingSchedule> createSchedule(@Valid @RequestBody ScheduleCreateRequest req) {
        RetrainingSchedule s = orchestrator.createSchedule(req.getModelType(), req.getScheduleType(), req.toOptions());
        return ResponseEntity.status(HttpStatus.CREATED).body(s);
    }

    @GetMapping("/schedules/{scheduleId}")
    public RetrainingSchedule schedule(@PathVariable String scheduleId) {
        return orchestrator.getSchedule(scheduleId)
                .orElseThrow(() -> notFound("Schedule not found: " + scheduleId));
    }

    @PatchMapping("/schedules/{scheduleId}")
    public RetrainingSchedule updateSchedule(@PathVariable String scheduleId,
                                             @Valid @RequestBody ScheduleUpdateRequest req) {
        return orchestrator.updateSchedule(scheduleId, req.toUpdate())
                .orElseThrow(() -> notFound("Schedule not found: " + scheduleId));
    }

    @DeleteMapping("/schedules/{scheduleId}")
    public ResponseEntity<Void> deleteSchedule(@PathVariable String scheduleId) {
        if (!orchestrator.deleteSchedule(scheduleId)) {
            throw notFound("Schedule not found: " + scheduleId);
        }
        return ResponseEntity.noContent().build();
    }

    // ==============================================================
    // ▶️ JOBS
    // ==============================================================

    @PostMapping("/jobs")
    public ResponseEntity<RetrainingJob> trigger(@Valid @RequestBody TriggerRequest req) {
        RetrainingJob job = orchestrator.triggerRetraining(req.getModelType(), req.reasonOrDefault(), req.toOptions());
        log.info("🚀 API trigger jobId={} type={} reason={}", job.getJobId(), req.getModelType(), req.reasonOrDefault());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(job);
    }

    @GetMapping("/jobs")
    public List<RetrainingJob> jobs(@RequestParam(required = false) RetrainingJobStatus status,
                                    @RequestParam(defaultValue = "false") boolean active) {
        if (active) return orchestrator.getActiveJobs();
        if (status != null) return orchestrator.getJobsByStatus(status);
        return orchestrator.getAllJobs();
    }

    @GetMapping("/jobs/{jobId}")
    public RetrainingJob job(@PathVariable String jobId) {
        return orchestrator.getJob(jobId)
                .orElseThrow(() -> notFound("Job not found: " + jobId));
    }

    @PostMapping("/jobs/{jobId}/cancel")
    public Map<String, Object> cancel(@PathVariable String jobId) {
        if (orchestrator.getJob(jobId).isEmpty()) {
            throw notFound("Job not found: " + jobId);
        }
        boolean cancelled = orchestrator.cancelJob(jobId);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("jobId", jobId);
        body.put("cancelled", cancelled);
        return body;
    }

    // ==============================================================
    // 📉 TRIGGERS
    // ==============================================================

    @PostMapping("/performance/check")
    public Map<String, Object> checkPerformance() {
        return triggerBody(orchestrator.checkPerformanceAndTrigger());
    }

    @PostMapping("/data-volume")
    public Map<String, Object> recordData(@Valid @RequestBody DataVolumeRequest req) {
        long pending = orchestrator.recordNewData(req.getModelType(), req.getCount());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("modelType", req.getModelType());
        body.put("pending", pending);
        return body;
    }

    @PostMapping("/data-volume/check")
    public Map<String, Object> checkDataVolume() {
        return triggerBody(orchestrator.checkDataVolumeAndTrigger());
    }

    // ==============================================================
    // 📜 HISTORY / 📊 STATS
    // ==============================================================

    @GetMapping("/history")
    public List<RetrainingHistoryEntry> history(@RequestParam(required = false) RetrainableModelType modelType,
                                                @RequestParam(required = false) RetrainingJobStatus status,
                                                @RequestParam(required = false) Integer offset,
                                                @RequestParam(required = false) Integer limit) {
        return orchestrator.getHistory(HistoryQuery.builder()
                .modelType(modelType)
                .status(status)
                .offset(offset)
                .limit(limit)
                .build());
    }

    @GetMapping("/statistics")
    public SchedulerStatistics statistics() {
        return orchestrator.getStatistics();
    }

    @DeleteMapping("/statistics/cache")
    public ResponseEntity<Void> clearCache() {
        orchestrator.clearCache();
        return ResponseEntity.noContent().build();
    }

    // ==============================================================
    // ⚙️ CONFIG / LIFECYCLE
    // ==============================================================

    @GetMapping("/config")
    public SchedulerSettings config() {
        return orchestrator.getConfig();
    }

    @PatchMapping("/config")
    public SchedulerSettings updateConfig(@RequestBody SchedulerSettings patch) {
        return orchestrator.updateConfig(patch);
    }

    @PostMapping("/start")
    public Map<String, Object> start() {
        orchestrator.start();
        return Map.of("running", orchestrator.isRunning(), "timers", orchestrator.runningTimers());
    }

    @PostMapping("/stop")
    public Map<String, Object> stop() {
        orchestrator.stop();
        return Map.of("running", orchestrator.isRunning(), "timers", orchestrator.runningTimers());
    }

    // ---------- helpers ----------

    private static Map<String, Object> triggerBody(Optional<RetrainingJob> job) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("triggered", job.isPresent());
        job.ifPresent(j -> body.put("job", j));
        return body;
    }

    private static ResponseStatusException notFound(String message) {
        return new ResponseStatusException(HttpStatus.NOT_FOUND, message);
    }
}
