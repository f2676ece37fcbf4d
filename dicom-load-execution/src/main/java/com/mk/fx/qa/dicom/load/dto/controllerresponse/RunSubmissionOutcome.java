package com.mk.fx.qa.dicom.load.dto.controllerresponse;

import com.mk.fx.qa.dicom.load.model.RunStatus;
import java.util.UUID;

/** Result of handing a run to the run service. */
public record RunSubmissionOutcome(UUID runId, RunStatus status, String message) {}
