package com.mk.fx.qa.dicom.load.dto.controllerresponse;

public record HealthResponse(String status) {}
