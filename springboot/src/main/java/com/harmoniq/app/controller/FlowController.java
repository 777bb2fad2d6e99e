package com.harmoniq.app.controller;

import com.harmoniq.app.dto.flow.Period;
import com.harmoniq.app.dto.response.ApiResponse;
import com.harmoniq.app.dto.response.FlowPreviewResponse;
import com.harmoniq.app.dto.response.FlowRunResponse;
import com.harmoniq.app.exception.FlowAlreadyRunningException;
import com.harmoniq.app.service.FlowOrchestrationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDateTime;
import java.util.List;

@RestController
@RequestMapping("/api/flow")
@RequiredArgsConstructor
@Slf4j
public class FlowController {

    private final FlowOrchestrationService flowOrchestrationService;

    @PostMapping("/run")
    public ResponseEntity<ApiResponse<FlowRunResponse>> runFlow() {
        log.info("Manual flow run requested");
        try {
            FlowRunResponse run = flowOrchestrationService.runFlow();
            return ResponseEntity.ok(ApiResponse.success("Flow run finished with status " + run.getStatus(), run));
        } catch (FlowAlreadyRunningException e) {
            return ResponseEntity
                    .status(HttpStatus.CONFLICT)
                    .body(ApiResponse.error(e.getMessage()));
        } catch (Exception e) {
            log.error("Error running flow", e);
            return ResponseEntity
                    .status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(ApiResponse.error("Failed to run flow: " + e.getMessage()));
        }
    }

    @GetMapping("/preview")
    public ResponseEntity<ApiResponse<FlowPreviewResponse>> preview(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime at) {
        log.info("Flow preview requested for {}", at != null ? at : "now");
        try {
            FlowPreviewResponse preview = flowOrchestrationService.preview(at);
            return ResponseEntity.ok(
                    ApiResponse.success("Preview holds " + preview.getTrackCount() + " tracks", preview)
            );
        } catch (Exception e) {
            log.error("Error previewing flow", e);
            return ResponseEntity
                    .status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(ApiResponse.error("Failed to preview flow: " + e.getMessage()));
        }
    }

    @GetMapping("/period")
    public ResponseEntity<ApiResponse<Period>> activePeriod(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime at) {
        try {
            return ResponseEntity.ok(ApiResponse.success(flowOrchestrationService.activePeriod(at)));
        } catch (Exception e) {
            log.error("Error resolving active period", e);
            return ResponseEntity
                    .status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(ApiResponse.error("Failed to resolve period: " + e.getMessage()));
        }
    }

    @GetMapping("/runs")
    public ResponseEntity<ApiResponse<List<FlowRunResponse>>> recentRuns() {
        try {
            List<FlowRunResponse> runs = flowOrchestrationService.recentRuns();
            return ResponseEntity.ok(ApiResponse.success("Retrieved " + runs.size() + " runs", runs));
        } catch (Exception e) {
            log.error("Error fetching flow runs", e);
            return ResponseEntity
                    .status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(ApiResponse.error("Failed to fetch flow runs"));
        }
    }
}
