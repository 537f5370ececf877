package com.zakat.hawl.api;

import com.zakat.hawl.domain.model.HawlDetectionJobResult;
import com.zakat.hawl.domain.service.PeriodicDetectionJob;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Operational endpoints for the Hawl detection job.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/admin/hawl-detection")
@RequiredArgsConstructor
public class HawlDetectionController {

    private final PeriodicDetectionJob detectionJob;

    /**
     * Run detection over all users now, with the same semantics as a scheduled run.
     */
    @PostMapping("/run")
    public ResponseEntity<HawlDetectionJobResult> run() {
        log.info("Manual Hawl detection run triggered");
        return ResponseEntity.ok(detectionJob.runOnce());
    }

    @GetMapping("/last-run")
    public ResponseEntity<HawlDetectionJobResult> lastRun() {
        return detectionJob.getLastResult()
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }
}
