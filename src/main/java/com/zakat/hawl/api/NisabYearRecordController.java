package com.zakat.hawl.api;

import com.zakat.hawl.api.dto.CreateRecordRequest;
import com.zakat.hawl.api.dto.FinalizeRecordRequest;
import com.zakat.hawl.api.dto.UnlockRecordRequest;
import com.zakat.hawl.api.dto.UpdateRecordRequest;
import com.zakat.hawl.domain.model.AuditTrail;
import com.zakat.hawl.domain.model.HawlStatus;
import com.zakat.hawl.domain.model.NisabYearRecordPage;
import com.zakat.hawl.domain.model.NisabYearRecordView;
import com.zakat.hawl.domain.model.RecordEdit;
import com.zakat.hawl.domain.model.RecordOperationResult;
import com.zakat.hawl.domain.model.RecordStatus;
import com.zakat.hawl.domain.service.NisabYearRecordService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * REST API for Nisab year records.
 *
 * The caller's identity comes from the {@code X-User-Id} header; every operation is
 * scoped to that user.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/nisab-year-records")
@RequiredArgsConstructor
public class NisabYearRecordController {

    static final String USER_HEADER = "X-User-Id";

    private final NisabYearRecordService recordService;

    @GetMapping
    public ResponseEntity<NisabYearRecordPage> list(@RequestHeader(USER_HEADER) UUID userId,
                                                    @RequestParam(required = false) List<RecordStatus> status,
                                                    @RequestParam(required = false) Integer hijriYear,
                                                    @RequestParam(defaultValue = "20") int limit,
                                                    @RequestParam(defaultValue = "0") long offset) {
        return ResponseEntity.ok(recordService.list(userId, status, hijriYear, limit, offset));
    }

    @GetMapping("/status")
    public ResponseEntity<HawlStatus> status(@RequestHeader(USER_HEADER) UUID userId) {
        return ResponseEntity.ok(recordService.status(userId));
    }

    @PostMapping
    public ResponseEntity<?> create(@RequestHeader(USER_HEADER) UUID userId,
                                    @Valid @RequestBody CreateRecordRequest request,
                                    HttpServletRequest httpRequest) {
        log.info("Create record requested by user {}", userId);
        RecordOperationResult result = recordService.create(userId, request.getHawlStartDate(),
                request.getNisabBasis(), request.getCurrency(), request.getThresholdValue(), request.getUserNotes());
        return respond(result, HttpStatus.CREATED, httpRequest);
    }

    @GetMapping("/{recordId}")
    public ResponseEntity<NisabYearRecordView> get(@RequestHeader(USER_HEADER) UUID userId,
                                                   @PathVariable UUID recordId) {
        return ResponseEntity.ok(recordService.get(userId, recordId));
    }

    @PutMapping("/{recordId}")
    public ResponseEntity<?> update(@RequestHeader(USER_HEADER) UUID userId,
                                    @PathVariable UUID recordId,
                                    @Valid @RequestBody UpdateRecordRequest request,
                                    HttpServletRequest httpRequest) {
        RecordEdit edit = RecordEdit.builder()
                .thresholdValue(request.getThresholdValue())
                .zakatableWealth(request.getZakatableWealth())
                .userNotes(request.getUserNotes())
                .build();
        return respond(recordService.update(userId, recordId, edit), HttpStatus.OK, httpRequest);
    }

    @DeleteMapping("/{recordId}")
    public ResponseEntity<?> delete(@RequestHeader(USER_HEADER) UUID userId,
                                    @PathVariable UUID recordId,
                                    HttpServletRequest httpRequest) {
        RecordOperationResult result = recordService.delete(userId, recordId);
        if (!result.isSuccess()) {
            return reject(result, httpRequest);
        }
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{recordId}/finalize")
    public ResponseEntity<?> finalizeRecord(@RequestHeader(USER_HEADER) UUID userId,
                                            @PathVariable UUID recordId,
                                            @Valid @RequestBody(required = false) FinalizeRecordRequest request,
                                            HttpServletRequest httpRequest) {
        log.info("Finalize of record {} requested by user {}", recordId, userId);
        RecordOperationResult result = recordService.finalizeRecord(userId, recordId,
                request != null ? request.getZakatableWealth() : null);
        return respond(result, HttpStatus.OK, httpRequest);
    }

    @PostMapping("/{recordId}/unlock")
    public ResponseEntity<?> unlock(@RequestHeader(USER_HEADER) UUID userId,
                                    @PathVariable UUID recordId,
                                    @Valid @RequestBody UnlockRecordRequest request,
                                    HttpServletRequest httpRequest) {
        log.info("Unlock of record {} requested by user {}", recordId, userId);
        return respond(recordService.unlock(userId, recordId, request.getReason()), HttpStatus.OK, httpRequest);
    }

    @GetMapping("/{recordId}/audit")
    public ResponseEntity<AuditTrail> audit(@RequestHeader(USER_HEADER) UUID userId,
                                            @PathVariable UUID recordId) {
        return ResponseEntity.ok(recordService.auditTrail(userId, recordId));
    }

    private ResponseEntity<?> respond(RecordOperationResult result, HttpStatus successStatus,
                                      HttpServletRequest httpRequest) {
        if (!result.isSuccess()) {
            return reject(result, httpRequest);
        }
        return ResponseEntity.status(successStatus).body(result.getRecord());
    }

    private ResponseEntity<ErrorResponse> reject(RecordOperationResult result, HttpServletRequest httpRequest) {
        return GlobalExceptionHandler.respond(GlobalExceptionHandler.statusOf(result.getFailure()),
                result.getFailure().name(), result.getMessage(), httpRequest);
    }
}
