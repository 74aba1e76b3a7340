package com.chicu.aimonitor.ml.retraining.web;

import com.chicu.aimonitor.ml.retraining.model.RetrainableModelType;
import com.chicu.aimonitor.ml.retraining.model.RetrainingJob;
import com.chicu.aimonitor.ml.retraining.model.RetrainingJobConfig;
import com.chicu.aimonitor.ml.retraining.model.RetrainingJobStatus;
import com.chicu.aimonitor.ml.retraining.model.RetrainingOptions;
import com.chicu.aimonitor.ml.retraining.model.RetrainingSchedule;
import com.chicu.aimonitor.ml.retraining.model.ScheduleOptions;
import com.chicu.aimonitor.ml.retraining.model.ScheduleType;
import com.chicu.aimonitor.ml.retraining.model.ScheduleUpdate;
import com.chicu.aimonitor.ml.retraining.model.TriggerReason;
import com.chicu.aimonitor.ml.retraining.orchestrator.RetrainingOrchestrator;
import com.chicu.aimonitor.ml.retraining.orchestrator.RetrainingRejectedException;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(RetrainingApiController.class)
class RetrainingApiControllerTest {

    @Autowired
    private MockMvc mvc;

    @MockBean
    private RetrainingOrchestrator orchestrator;

    @Test
    void trigger_returnsAccepted_withPendingJob() throws Exception {
        when(orchestrator.triggerRetraining(eq(RetrainableModelType.ANOMALY_DETECTION), eq(TriggerReason.MANUAL), any()))
                .thenReturn(pendingJob("job_1"));

        mvc.perform(post("/api/ml/retraining/jobs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"modelType\":\"ANOMALY_DETECTION\",\"priority\":3,\"validation\":{\"minAccuracy\":0.9}}"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.jobId").value("job_1"))
                .andExpect(jsonPath("$.status").value("PENDING"))
                .andExpect(jsonPath("$.createdAt").value("2026-03-01T10:00:00Z"));

        ArgumentCaptor<RetrainingOptions> options = ArgumentCaptor.forClass(RetrainingOptions.class);
        verify(orchestrator).triggerRetraining(eq(RetrainableModelType.ANOMALY_DETECTION), eq(TriggerReason.MANUAL), options.capture());
        assertEquals(3, options.getValue().priority());
        assertEquals(0.9, options.getValue().validation().minAccuracy());
        assertNull(options.getValue().validation().maxDegradation());
    }

    @Test
    void trigger_rejection_mapsToConflict() throws Exception {
        when(orchestrator.triggerRetraining(any(), any(), any()))
                .thenThrow(new RetrainingRejectedException(RetrainingRejectedException.Reason.CONCURRENCY_LIMIT,
                        "Maximum concurrent jobs (2) reached"));

        mvc.perform(post("/api/ml/retraining/jobs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"modelType\":\"MARKET_PREDICTOR\",\"reason\":\"SCHEDULED\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.reason").value("CONCURRENCY_LIMIT"))
                .andExpect(jsonPath("$.message").value("Maximum concurrent jobs (2) reached"));
    }

    @Test
    void trigger_withoutModelType_isBadRequest() throws Exception {
        mvc.perform(post("/api/ml/retraining/jobs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(orchestrator);
    }

    @Test
    void unknownJob_isNotFound() throws Exception {
        when(orchestrator.getJob("job_x")).thenReturn(Optional.empty());

        mvc.perform(get("/api/ml/retraining/jobs/job_x"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Job not found: job_x"));

        mvc.perform(post("/api/ml/retraining/jobs/job_x/cancel"))
                .andExpect(status().isNotFound());
        verify(orchestrator, never()).cancelJob(anyString());
    }

    @Test
    void cancel_reportsOutcome() throws Exception {
        when(orchestrator.getJob("job_1")).thenReturn(Optional.of(pendingJob("job_1")));
        when(orchestrator.cancelJob("job_1")).thenReturn(true);

        mvc.perform(post("/api/ml/retraining/jobs/job_1/cancel"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.jobId").value("job_1"))
                .andExpect(jsonPath("$.cancelled").value(true));
    }

    @Test
    void createSchedule_returnsCreated_andInvalidIntervalIsBadRequest() throws Exception {
        when(orchestrator.createSchedule(eq(RetrainableModelType.SIGNAL_TRACKER), eq(ScheduleType.INTERVAL), any(ScheduleOptions.class)))
                .thenReturn(RetrainingSchedule.builder()
                        .scheduleId("schedule_1")
                        .modelType(RetrainableModelType.SIGNAL_TRACKER)
                        .scheduleType(ScheduleType.INTERVAL)
                        .intervalMs(3_600_000L)
                        .enabled(true)
                        .build());

        mvc.perform(post("/api/ml/retraining/schedules")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"modelType\":\"SIGNAL_TRACKER\",\"scheduleType\":\"INTERVAL\",\"intervalMs\":3600000}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.scheduleId").value("schedule_1"))
                .andExpect(jsonPath("$.enabled").value(true));

        mvc.perform(post("/api/ml/retraining/schedules")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"modelType\":\"SIGNAL_TRACKER\",\"scheduleType\":\"INTERVAL\",\"intervalMs\":-1}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void orchestratorArgumentError_isBadRequest() throws Exception {
        when(orchestrator.createSchedule(any(), eq(ScheduleType.INTERVAL), any()))
                .thenThrow(new IllegalArgumentException("intervalMs must be > 0 for INTERVAL schedule"));

        mvc.perform(post("/api/ml/retraining/schedules")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"modelType\":\"SIGNAL_TRACKER\",\"scheduleType\":\"INTERVAL\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("intervalMs must be > 0 for INTERVAL schedule"));
    }

    @Test
    void patchSchedule_validatesBody_andPassesPartialUpdate() throws Exception {
        when(orchestrator.updateSchedule(eq("schedule_1"), any()))
                .thenReturn(Optional.of(RetrainingSchedule.builder()
                        .scheduleId("schedule_1")
                        .modelType(RetrainableModelType.SIGNAL_TRACKER)
                        .scheduleType(ScheduleType.DATA_VOLUME_TRIGGER)
                        .dataVolumeThreshold(2_000L)
                        .enabled(true)
                        .build()));

        mvc.perform(patch("/api/ml/retraining/schedules/schedule_1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"dataVolumeThreshold\":0}"))
                .andExpect(status().isBadRequest());
        mvc.perform(patch("/api/ml/retraining/schedules/schedule_1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"performanceThreshold\":1.2}"))
                .andExpect(status().isBadRequest());
        verify(orchestrator, never()).updateSchedule(any(), any());

        mvc.perform(patch("/api/ml/retraining/schedules/schedule_1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"dataVolumeThreshold\":2000}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.dataVolumeThreshold").value(2000));

        ArgumentCaptor<ScheduleUpdate> update = ArgumentCaptor.forClass(ScheduleUpdate.class);
        verify(orchestrator).updateSchedule(eq("schedule_1"), update.capture());
        assertEquals(2_000L, update.getValue().dataVolumeThreshold());
        assertNull(update.getValue().enabled());
        assertNull(update.getValue().intervalMs());
    }

    @Test
    void deleteUnknownSchedule_isNotFound() throws Exception {
        when(orchestrator.deleteSchedule("schedule_x")).thenReturn(false);
        when(orchestrator.deleteSchedule("schedule_1")).thenReturn(true);

        mvc.perform(delete("/api/ml/retraining/schedules/schedule_x")).andExpect(status().isNotFound());
        mvc.perform(delete("/api/ml/retraining/schedules/schedule_1")).andExpect(status().isNoContent());
    }

    @Test
    void dataVolume_negativeCount_isBadRequest() throws Exception {
        when(orchestrator.recordNewData(RetrainableModelType.INSIDER_PREDICTOR, 40)).thenReturn(140L);

        mvc.perform(post("/api/ml/retraining/data-volume")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"modelType\":\"INSIDER_PREDICTOR\",\"count\":40}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.pending").value(140));

        mvc.perform(post("/api/ml/retraining/data-volume")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"modelType\":\"INSIDER_PREDICTOR\",\"count\":-4}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void performanceCheck_withoutTrigger() throws Exception {
        when(orchestrator.checkPerformanceAndTrigger()).thenReturn(Optional.empty());

        mvc.perform(post("/api/ml/retraining/performance/check"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.triggered").value(false))
                .andExpect(jsonPath("$.job").doesNotExist());
    }

    private static RetrainingJob pendingJob(String id) {
        return RetrainingJob.builder()
                .jobId(id)
                .config(RetrainingJobConfig.builder()
                        .modelType(RetrainableModelType.ANOMALY_DETECTION)
                        .triggerReason(TriggerReason.MANUAL)
                        .priority(1)
                        .build())
                .status(RetrainingJobStatus.PENDING)
                .progress(0)
                .stageMessage("Job created")
                .createdAt(Instant.parse("2026-03-01T10:00:00Z"))
                .build();
    }
}
