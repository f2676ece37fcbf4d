package com.mk.fx.qa.dicom.load.dto.controllerresponse;

import com.mk.fx.qa.dicom.load.model.RunStatus;
import java.time.Instant;
import java.util.UUID;

/** One finished run in the service history, newest first. */
public record RunHistoryEntry(
    UUID runId,
    RunStatus status,
    Instant startedAt,
    Instant completedAt,
    Long processingTimeMillis,
    Boolean passed,
    String errorMessage) {}
