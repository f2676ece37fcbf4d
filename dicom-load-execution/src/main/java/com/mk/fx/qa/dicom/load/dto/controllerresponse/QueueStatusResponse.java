package com.mk.fx.qa.dicom.load.dto.controllerresponse;

/** Pending and running run counts and whether new runs are accepted. */
public record QueueStatusResponse(int queueSize, int activeRuns, boolean acceptingRuns) {}
