package com.zakat.hawl.api;

import com.zakat.hawl.domain.exception.DetectionRunInProgressException;
import com.zakat.hawl.domain.model.HawlDetectionJobResult;
import com.zakat.hawl.domain.service.PeriodicDetectionJob;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.Optional;

import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@ExtendWith(MockitoExtension.class)
class HawlDetectionControllerTest {

    private static final String BASE = "/api/v1/admin/hawl-detection";

    @Mock
    private PeriodicDetectionJob detectionJob;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new HawlDetectionController(detectionJob))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void lastRun_beforeFirstRun_isNoContent() throws Exception {
        when(detectionJob.getLastResult()).thenReturn(Optional.empty());

        mockMvc.perform(get(BASE + "/last-run"))
                .andExpect(status().isNoContent());
    }

    @Test
    void run_returnsSummary_andLastRunReportsIt() throws Exception {
        HawlDetectionJobResult result = HawlDetectionJobResult.builder()
                .usersScheduled(3)
                .usersProcessed(2)
                .thresholdCrossings(1)
                .failures(1)
                .build();
        when(detectionJob.runOnce()).thenReturn(result);
        when(detectionJob.getLastResult()).thenReturn(Optional.of(result));

        mockMvc.perform(post(BASE + "/run"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.usersScheduled").value(3))
                .andExpect(jsonPath("$.thresholdCrossings").value(1));

        mockMvc.perform(get(BASE + "/last-run"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.usersProcessed").value(2))
                .andExpect(jsonPath("$.failures").value(1));
    }

    @Test
    void run_whileRunInProgress_isConflict() throws Exception {
        when(detectionJob.runOnce()).thenThrow(new DetectionRunInProgressException());

        mockMvc.perform(post(BASE + "/run"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.errorCode").value("DETECTION_IN_PROGRESS"));
    }
}
