package com.mk.fx.qa.dicom.load.driver;

/**
 * A threshold the run did not meet.
 *
 * @param threshold which bound was violated
 * @param limit configured bound
 * @param actual observed value, {@code null} when the metric was undefined
 * @param message human readable explanation
 */
public record ThresholdViolation(Threshold threshold, double limit, Double actual, String message) {}
