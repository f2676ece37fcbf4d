package com.mk.fx.qa.dicom.load.dto.controllerresponse;

/**
 * Aggregate counters over all runs handled by this instance.
 *
 * @param completed runs that reached threshold evaluation
 * @param passed completed runs whose verdict passed
 * @param failed runs that failed during setup
 * @param cancelled runs cancelled while queued or running
 * @param averageProcessingTimeMs mean wall time of completed runs
 * @param passRate passed / completed, 0 when nothing completed
 */
public record ServiceMetricsResponse(
    long completed,
    long passed,
    long failed,
    long cancelled,
    double averageProcessingTimeMs,
    double passRate) {}
