package com.gpu.specharvester.controller;

import com.gpu.specharvester.dto.RunStartResult;
import com.gpu.specharvester.dto.RunStatus;
import com.gpu.specharvester.service.RunMode;
import com.gpu.specharvester.service.RunSupervisor;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for starting harvest runs and reading their state
 */
@RestController
@RequestMapping("/api/harvester")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Harvester", description = "GPU catalog harvest and review reconciliation runs")
public class HarvestController {

    private final RunSupervisor supervisor;

    /**
     * Start a run in the background. Only one run may be active at a time.
     */
    @Operation(
        summary = "Start a harvest run",
        description = "Starts a default harvest, a full review update or an incremental review update in the background. "
                + "Returns 409 while another run is active."
    )
    @PostMapping("/run")
    public ResponseEntity<RunResponse> startRun(
            @Parameter(description = "Run mode: default, full or incremental") @RequestParam(required = false) String mode,
            @Parameter(description = "Restrict a default run to one GPU by exact name") @RequestParam(required = false) String gpu) {

        RunMode runMode;
        try {
            runMode = RunMode.parse(mode);
        } catch (IllegalArgumentException e) {
            log.warn("Rejected run request: {}", e.getMessage());
            return ResponseEntity.badRequest().body(new RunResponse("error", e.getMessage()));
        }

        log.info("Run requested via API: mode={}, gpu={}", runMode.label(), gpu);
        RunStartResult result = supervisor.start(runMode, gpu);
        if (!result.accepted()) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(new RunResponse("rejected", result.message()));
        }
        return ResponseEntity.accepted().body(new RunResponse("started", result.message()));
    }

    @Operation(summary = "Run status", description = "Whether a run is active, its progress and the last run's summary")
    @GetMapping("/status")
    public RunStatus status() {
        return supervisor.status();
    }

    public record RunResponse(String status, String message) {
    }
}
