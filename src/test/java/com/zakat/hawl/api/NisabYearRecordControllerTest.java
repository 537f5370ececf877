package com.zakat.hawl.api;

import com.zakat.hawl.domain.exception.AuditWriteFailureException;
import com.zakat.hawl.domain.exception.PriceUnavailableException;
import com.zakat.hawl.domain.exception.RecordNotFoundException;
import com.zakat.hawl.domain.model.LifecycleFailure;
import com.zakat.hawl.domain.model.MetalType;
import com.zakat.hawl.domain.model.NisabYearRecordView;
import com.zakat.hawl.domain.model.RecordOperationResult;
import com.zakat.hawl.domain.model.RecordStatus;
import com.zakat.hawl.domain.service.NisabYearRecordService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.math.BigDecimal;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@ExtendWith(MockitoExtension.class)
class NisabYearRecordControllerTest {

    private static final String BASE = "/api/v1/nisab-year-records";

    @Mock
    private NisabYearRecordService recordService;

    private MockMvc mockMvc;
    private UUID userId;
    private UUID recordId;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new NisabYearRecordController(recordService))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
        userId = UUID.randomUUID();
        recordId = UUID.randomUUID();
    }

    @Test
    void create_returnsCreatedRecord() throws Exception {
        when(recordService.create(eq(userId), any(), any(), eq("USD"), eq(new BigDecimal("6000.00")), isNull()))
                .thenReturn(RecordOperationResult.builder()
                        .success(true)
                        .record(NisabYearRecordView.builder().recordId(recordId).status(RecordStatus.DRAFT).build())
                        .build());

        mockMvc.perform(post(BASE)
                        .header("X-User-Id", userId.toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"currency\":\"USD\",\"thresholdValue\":6000.00}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.recordId").value(recordId.toString()))
                .andExpect(jsonPath("$.status").value("DRAFT"));
    }

    @Test
    void create_duplicateWindow_isConflict() throws Exception {
        when(recordService.create(any(), any(), any(), any(), any(), any()))
                .thenReturn(RecordOperationResult.builder()
                        .success(false)
                        .failure(LifecycleFailure.DUPLICATE_OPEN_WINDOW)
                        .message("User already has an open window")
                        .build());

        mockMvc.perform(post(BASE)
                        .header("X-User-Id", userId.toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.errorCode").value("DUPLICATE_OPEN_WINDOW"));
    }

    @Test
    void create_badCurrency_isBadRequest() throws Exception {
        mockMvc.perform(post(BASE)
                        .header("X-User-Id", userId.toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"currency\":\"dollars\"}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(recordService);
    }

    @Test
    void unlock_shortReason_isBadRequest() throws Exception {
        when(recordService.unlock(userId, recordId, "typo"))
                .thenReturn(RecordOperationResult.builder()
                        .success(false)
                        .failure(LifecycleFailure.INSUFFICIENT_JUSTIFICATION)
                        .message("Unlock reason must be between 10 and 500 characters")
                        .build());

        mockMvc.perform(post(BASE + "/" + recordId + "/unlock")
                        .header("X-User-Id", userId.toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reason\":\"typo\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("INSUFFICIENT_JUSTIFICATION"));
    }

    @Test
    void get_unknownRecord_isNotFound() throws Exception {
        when(recordService.get(userId, recordId)).thenThrow(new RecordNotFoundException(recordId));

        mockMvc.perform(get(BASE + "/" + recordId).header("X-User-Id", userId.toString()))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.errorCode").value("RECORD_NOT_FOUND"));
    }

    @Test
    void delete_draft_isNoContent() throws Exception {
        when(recordService.delete(userId, recordId)).thenReturn(RecordOperationResult.builder().success(true).build());

        mockMvc.perform(delete(BASE + "/" + recordId).header("X-User-Id", userId.toString()))
                .andExpect(status().isNoContent());
    }

    @Test
    void create_priceUnavailable_isServiceUnavailable() throws Exception {
        when(recordService.create(any(), any(), any(), any(), any(), any()))
                .thenThrow(new PriceUnavailableException(MetalType.GOLD, "USD", new IllegalStateException("feed down")));

        mockMvc.perform(post(BASE)
                        .header("X-User-Id", userId.toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.errorCode").value("PRICE_UNAVAILABLE"));
    }

    @Test
    void finalize_auditWriteFailure_isInternalError() throws Exception {
        when(recordService.finalizeRecord(userId, recordId, null))
                .thenThrow(new AuditWriteFailureException(recordId, new IllegalStateException("disk full")));

        mockMvc.perform(post(BASE + "/" + recordId + "/finalize").header("X-User-Id", userId.toString()))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.errorCode").value("AUDIT_WRITE_FAILURE"));
    }

    @Test
    void missingUserHeader_isBadRequest() throws Exception {
        mockMvc.perform(get(BASE + "/status"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(recordService);
    }
}
