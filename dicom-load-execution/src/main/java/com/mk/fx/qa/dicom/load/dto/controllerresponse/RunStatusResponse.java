package com.mk.fx.qa.dicom.load.dto.controllerresponse;

import com.mk.fx.qa.dicom.load.model.RunStatus;
import java.time.Instant;
import java.util.UUID;

/**
 * Current state of a run, with its timestamps, verdict once known and the setup error if it
 * failed.
 */
public record RunStatusResponse(
    UUID runId,
    RunStatus status,
    Instant submittedAt,
    Instant startedAt,
    Instant completedAt,
    Long processingTimeMillis,
    Boolean passed,
    String errorMessage) {}
