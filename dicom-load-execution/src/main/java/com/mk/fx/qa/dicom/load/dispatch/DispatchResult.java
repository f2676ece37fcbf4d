package com.mk.fx.qa.dicom.load.dispatch;

/**
 * Summary of one dispatcher run.
 *
 * @param workers worker threads started
 * @param launched sends admitted by the gate
 * @param recorded outcomes handed to the collector
 * @param cancelled whether the run stopped on cancellation
 */
public record DispatchResult(int workers, long launched, long recorded, boolean cancelled) {}
