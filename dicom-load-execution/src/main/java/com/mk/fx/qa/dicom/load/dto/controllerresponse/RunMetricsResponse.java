package com.mk.fx.qa.dicom.load.dto.controllerresponse;

import com.mk.fx.qa.dicom.load.cstore.OutcomeKind;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/** Live or final metrics of one run as exposed over HTTP. */
public record RunMetricsResponse(
    UUID runId,
    long attempted,
    long succeeded,
    long failed,
    Double errorRate,
    boolean percentilesDefined,
    Long latencyP50Ms,
    Long latencyP95Ms,
    Long latencyP99Ms,
    Long latencyMinMs,
    Long latencyMaxMs,
    Double latencyMeanMs,
    double throughputPerSec,
    long elapsedMs,
    Map<OutcomeKind, Long> failuresByKind,
    Instant firstActivityAt,
    Instant lastActivityAt) {}
