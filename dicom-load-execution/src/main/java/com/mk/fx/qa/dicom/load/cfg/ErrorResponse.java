package com.mk.fx.qa.dicom.load.cfg;

/**
 * Body of every error answered by the API.
 *
 * @param error short title
 * @param details what went wrong
 */
public record ErrorResponse(String error, String details) {}
