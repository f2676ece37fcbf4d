package com.mk.fx.qa.dicom.load.processors.cstore;

import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mk.fx.qa.dicom.load.catalog.PayloadSelection;
import com.mk.fx.qa.dicom.load.cfg.LoadDefaultsCfg;
import com.mk.fx.qa.dicom.load.cstore.DicomTarget;
import com.mk.fx.qa.dicom.load.driver.ConfigException;
import com.mk.fx.qa.dicom.load.driver.LoadConfig;
import com.mk.fx.qa.dicom.load.driver.LoadDriver;
import com.mk.fx.qa.dicom.load.dto.cstore.CStoreRunDefinition;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import org.springframework.stereotype.Component;

/**
 * Turns a submitted option map into a {@link LoadConfig}.
 *
 * <p>Option names match case-insensitively and unknown options are ignored. Required: {@code
 * targetHost}, {@code targetPort}, {@code targetIdentity}, {@code concurrency}, {@code
 * datasetRoot}, a rate ({@code targetRate}, or {@code peakImagesPerSecond} scaled by {@code
 * loadMultiplier}) and exactly one stop condition. Anything else falls back to {@link
 * LoadDefaultsCfg}.
 */
@Component
public class LoadConfigParser {

  private final ObjectMapper objectMapper;
  private final LoadDefaultsCfg defaults;

  public LoadConfigParser(ObjectMapper objectMapper, LoadDefaultsCfg defaults) {
    this.objectMapper = objectMapper;
    this.defaults = defaults;
  }

  /**
   * @throws ConfigException naming the first missing or malformed option
   */
  public LoadConfig parse(Map<String, Object> options) {
    Objects.requireNonNull(options, "options");
    var definition = toDefinition(options);

    var target =
        toTarget(
            require("targetHost", blankToNull(definition.getTargetHost())),
            require("targetPort", definition.getTargetPort()),
            require("targetIdentity", blankToNull(definition.getTargetIdentity())),
            orDefault(blankToNull(definition.getLocalIdentity()), defaults.getLocalIdentity()));

    var config =
        LoadConfig.builder()
            .target(target)
            .targetRate(resolveRate(definition))
            .concurrency(require("concurrency", definition.getConcurrency()))
            .durationSeconds(definition.getDurationSeconds())
            .totalCount(definition.getTotalCount())
            .timeout(
                Duration.ofMillis(orDefault(definition.getTimeoutMs(), defaults.getTimeoutMs())))
            .retryCount(orDefault(definition.getRetryCount(), defaults.getRetryCount()))
            .retryBackoff(
                Duration.ofMillis(
                    orDefault(definition.getRetryBackoffMs(), defaults.getRetryBackoffMs())))
            .maxErrorRate(orDefault(definition.getMaxErrorRate(), defaults.getMaxErrorRate()))
            .maxP95LatencyMs(
                orDefault(definition.getMaxP95LatencyMs(), defaults.getMaxP95LatencyMs()))
            .datasetRoot(Path.of(require("datasetRoot", blankToNull(definition.getDatasetRoot()))))
            .selection(
                new PayloadSelection(
                    blankToNull(definition.getCategory()),
                    definition.getSampleSize(),
                    orDefault(definition.getSeed(), defaults.getSeed())))
            .echoBeforeRun(orDefault(definition.getEchoBeforeRun(), defaults.isEchoBeforeRun()))
            .build();
    LoadDriver.sendBudget(config);
    return config;
  }

  private CStoreRunDefinition toDefinition(Map<String, Object> options) {
    try {
      return objectMapper.convertValue(options, CStoreRunDefinition.class);
    } catch (IllegalArgumentException ex) {
      String key = null;
      if (ex.getCause() instanceof JsonMappingException mapping && !mapping.getPath().isEmpty()) {
        key = mapping.getPath().get(mapping.getPath().size() - 1).getFieldName();
      }
      var value = key == null ? null : findIgnoringCase(options, key);
      throw key == null
          ? new ConfigException("Malformed run options: " + ex.getMessage())
          : ConfigException.invalid(key, value, "cannot be converted");
    }
  }

  private double resolveRate(CStoreRunDefinition definition) {
    if (definition.getTargetRate() != null) {
      return definition.getTargetRate();
    }
    if (definition.getPeakImagesPerSecond() != null) {
      return definition.getPeakImagesPerSecond()
          * orDefault(definition.getLoadMultiplier(), defaults.getLoadMultiplier());
    }
    throw ConfigException.missing("targetRate");
  }

  private static DicomTarget toTarget(String host, int port, String called, String calling) {
    try {
      return new DicomTarget(host, port, called, calling);
    } catch (IllegalArgumentException ex) {
      throw new ConfigException("Invalid target: " + ex.getMessage());
    }
  }

  private static <T> T require(String key, T value) {
    if (value == null) {
      throw ConfigException.missing(key);
    }
    return value;
  }

  private static <T> T orDefault(T value, T fallback) {
    return value != null ? value : fallback;
  }

  private static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value.trim();
  }

  private static Object findIgnoringCase(Map<String, Object> options, String key) {
    for (Map.Entry<String, Object> entry : options.entrySet()) {
      if (entry.getKey() != null && entry.getKey().equalsIgnoreCase(key)) {
        return entry.getValue();
      }
    }
    return null;
  }
}
