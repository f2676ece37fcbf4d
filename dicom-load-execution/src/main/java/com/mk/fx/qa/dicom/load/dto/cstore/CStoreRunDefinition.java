package com.mk.fx.qa.dicom.load.dto.cstore;

import lombok.Data;

/**
 * Options of a C-STORE run as submitted. Every field is optional at this level; required options
 * and defaults are resolved when the definition is turned into a run configuration. Values arrive
 * as an untyped map, so numbers given as strings are coerced.
 */
@Data
public class CStoreRunDefinition {

  private String targetHost;
  private Integer targetPort;
  private String targetIdentity;
  private String localIdentity;

  private Double targetRate;
  private Double peakImagesPerSecond;
  private Double loadMultiplier;
  private Integer concurrency;
  private Integer durationSeconds;
  private Long totalCount;

  private Long timeoutMs;
  private Integer retryCount;
  private Long retryBackoffMs;

  private Double maxErrorRate;
  private Long maxP95LatencyMs;

  private String datasetRoot;
  private String category;
  private Integer sampleSize;
  private Long seed;
  private Boolean echoBeforeRun;
}
