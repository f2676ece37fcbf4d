package com.mk.fx.qa.dicom.load.dto.controllerresponse;

import com.mk.fx.qa.dicom.load.model.RunStatus;
import java.time.Instant;
import java.util.UUID;

public record RunSummaryResponse(UUID runId, RunStatus status, Instant submittedAt) {}
