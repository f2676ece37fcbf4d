package com.mk.fx.qa.dicom.load.dto.controllerresponse;

import com.mk.fx.qa.dicom.load.model.RunStatus;
import java.util.UUID;

public record RunCancellationResponse(UUID runId, RunStatus status, String message) {}
