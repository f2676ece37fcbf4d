package com.mk.fx.qa.dicom.load.resource;

import com.mk.fx.qa.dicom.load.dto.controllerresponse.HealthResponse;
import com.mk.fx.qa.dicom.load.dto.controllerresponse.QueueStatusResponse;
import com.mk.fx.qa.dicom.load.dto.controllerresponse.RunCancellationResponse;
import com.mk.fx.qa.dicom.load.dto.controllerresponse.RunHistoryEntry;
import com.mk.fx.qa.dicom.load.dto.controllerresponse.RunStatusResponse;
import com.mk.fx.qa.dicom.load.dto.controllerresponse.RunSubmissionRequest;
import com.mk.fx.qa.dicom.load.dto.controllerresponse.RunSubmissionResponse;
import com.mk.fx.qa.dicom.load.dto.controllerresponse.ServiceMetricsResponse;
import com.mk.fx.qa.dicom.load.metrics.RunRegistry;
import com.mk.fx.qa.dicom.load.model.RunStatus;
import com.mk.fx.qa.dicom.load.service.LoadRunService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@Tag(name = "Load Runs", description = "Submit, monitor and cancel C-STORE load runs")
@RestController
@RequestMapping("/api/runs")
@Validated
@RequiredArgsConstructor
public class LoadRunController {

  private final LoadRunService loadRunService;
  private final RunRegistry runRegistry;
  private final RunMapper runMapper;
  private final ApiResponseFactory responseFactory;

  // -----------------------------------------------------
  // Submission
  // -----------------------------------------------------
  @Operation(
      summary = "Submit a run",
      description = "Validates the run options and queues the run. Returns 400 for unusable options.")
  @PostMapping
  public ResponseEntity<RunSubmissionResponse> submitRun(
      @Valid @RequestBody RunSubmissionRequest request) {
    var run = runMapper.toDomain(request);
    log.info("Received run submission {} with {} options", run.getId(), run.getOptions().size());
    var outcomeOpt = loadRunService.submitRun(run);

    if (outcomeOpt.isEmpty()) {
      return responseFactory.unavailable(
          new RunSubmissionResponse(null, null, "Service not accepting new runs"));
    }
    var outcome = outcomeOpt.get();
    var response = new RunSubmissionResponse(outcome.runId(), outcome.status(), outcome.message());
    return switch (outcome.status()) {
      case QUEUED, RUNNING -> responseFactory.accepted(response);
      case COMPLETED -> ResponseEntity.ok(response);
      case FAILED -> ResponseEntity.badRequest().body(response);
      case CANCELLED -> responseFactory.unavailable(response);
    };
  }

  // -----------------------------------------------------
  // Status and control
  // -----------------------------------------------------
  @Operation(summary = "Run status", description = "Returns the current status of a run.")
  @GetMapping("/{runId}")
  public ResponseEntity<RunStatusResponse> getRunStatus(@PathVariable UUID runId) {
    return loadRunService
        .getRunStatus(runId)
        .map(ResponseEntity::ok)
        .orElseGet(
            () -> {
              log.warn("Run {} not found", runId);
              return ResponseEntity.notFound().build();
            });
  }

  @Operation(summary = "Cancel run", description = "Cancels a queued run or asks a running one to stop.")
  @DeleteMapping("/{runId}")
  public ResponseEntity<?> cancelRun(@PathVariable UUID runId) {
    var result = loadRunService.cancelRun(runId);
    log.info("Cancellation requested for {} -> {}", runId, result.getState());
    return switch (result.getState()) {
      case NOT_FOUND -> responseFactory.notFound("Run not found");
      case NOT_CANCELLABLE -> responseFactory.error(
          HttpStatus.CONFLICT, "Conflict", "Run is already " + result.getRunStatus());
      case CANCELLED -> ResponseEntity.ok(
          new RunCancellationResponse(runId, RunStatus.CANCELLED, "Run cancelled"));
      case CANCELLATION_REQUESTED -> ResponseEntity.ok(
          new RunCancellationResponse(runId, result.getRunStatus(), "Cancellation requested"));
    };
  }

  // -----------------------------------------------------
  // Listings and history
  // -----------------------------------------------------
  @Operation(summary = "List runs", description = "Lists all runs or those with the given status.")
  @GetMapping
  public ResponseEntity<?> getRuns(@RequestParam(required = false) String status) {
    if (status == null) {
      return ResponseEntity.ok(loadRunService.getAllRuns());
    }
    RunStatus runStatus;
    try {
      runStatus = RunStatus.valueOf(status.toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      log.warn("Invalid status filter: {}", status);
      return responseFactory.error(
          HttpStatus.BAD_REQUEST,
          "Invalid Status",
          "Unrecognized status: " + status + ". Allowed: " + Arrays.toString(RunStatus.values()));
    }
    return ResponseEntity.ok(loadRunService.getRunsByStatus(runStatus));
  }

  @Operation(summary = "Run history", description = "Returns recently finished runs, newest first.")
  @GetMapping("/history")
  public ResponseEntity<List<RunHistoryEntry>> getRunHistory() {
    return ResponseEntity.ok(loadRunService.getRunHistory());
  }

  @Operation(summary = "Queue status", description = "Returns pending and running run counts.")
  @GetMapping("/queue")
  public ResponseEntity<QueueStatusResponse> getQueueStatus() {
    return ResponseEntity.ok(loadRunService.getQueueStatus());
  }

  @Operation(summary = "Service metrics", description = "Aggregate counters across all runs.")
  @GetMapping("/metrics")
  public ResponseEntity<ServiceMetricsResponse> getMetrics() {
    return ResponseEntity.ok(loadRunService.getMetrics());
  }

  // -----------------------------------------------------
  // Per-run metrics and verdict
  // -----------------------------------------------------
  @Operation(
      summary = "Run metrics",
      description = "Live snapshot for a running run, final snapshot for a finished one.")
  @GetMapping("/{runId}/metrics")
  public ResponseEntity<?> getRunMetrics(@PathVariable UUID runId) {
    return runRegistry
        .getSnapshot(runId)
        .<ResponseEntity<?>>map(snapshot -> ResponseEntity.ok(runMapper.toResponse(snapshot)))
        .orElseGet(
            () -> {
              log.warn("Metrics not found for run {}", runId);
              return responseFactory.notFound("Metrics not found for run: " + runId);
            });
  }

  @Operation(
      summary = "Run verdict",
      description = "Pass/fail verdict with violated thresholds, once the run has finished.")
  @GetMapping("/{runId}/verdict")
  public ResponseEntity<?> getRunVerdict(@PathVariable UUID runId) {
    return runRegistry
        .getVerdict(runId)
        .<ResponseEntity<?>>map(ResponseEntity::ok)
        .orElseGet(
            () -> {
              log.warn("Verdict not found for run {}", runId);
              return responseFactory.notFound("Verdict not found for run: " + runId);
            });
  }

  @Operation(summary = "Health check", description = "Verifies the service accepts runs.")
  @GetMapping("/healthy")
  public ResponseEntity<HealthResponse> health() {
    boolean healthy = loadRunService.isHealthy();
    log.debug("Health check: {}", healthy ? "UP" : "DOWN");
    return ResponseEntity.ok(new HealthResponse(healthy ? "UP" : "DOWN"));
  }
}
