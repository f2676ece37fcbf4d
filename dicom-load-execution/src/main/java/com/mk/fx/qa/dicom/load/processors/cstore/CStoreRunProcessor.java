package com.mk.fx.qa.dicom.load.processors.cstore;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mk.fx.qa.dicom.load.catalog.DatasetCatalog;
import com.mk.fx.qa.dicom.load.cfg.LoadDefaultsCfg;
import com.mk.fx.qa.dicom.load.cstore.ProtocolClient;
import com.mk.fx.qa.dicom.load.driver.LoadDriver;
import com.mk.fx.qa.dicom.load.driver.RunVerdict;
import com.mk.fx.qa.dicom.load.metrics.RunRegistry;
import com.mk.fx.qa.dicom.load.model.LoadRun;
import com.mk.fx.qa.dicom.load.processors.LoadRunProcessor;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Runs C-STORE load scenarios: parses the submitted options, drives the run with a fresh {@link
 * LoadDriver} and publishes live metrics, the final snapshot and the verdict to the {@link
 * RunRegistry}.
 */
@Slf4j
@Component
public class CStoreRunProcessor implements LoadRunProcessor {

  private final Map<UUID, LoadDriver> drivers = new ConcurrentHashMap<>();
  private final Set<UUID> pendingCancellations = ConcurrentHashMap.newKeySet();

  private final LoadConfigParser configParser;
  private final DatasetCatalog catalog;
  private final ProtocolClient client;
  private final RunRegistry registry;
  private final ObjectMapper objectMapper;
  private final Duration progressInterval;

  public CStoreRunProcessor(
      LoadConfigParser configParser,
      DatasetCatalog catalog,
      ProtocolClient client,
      RunRegistry registry,
      ObjectMapper objectMapper,
      LoadDefaultsCfg defaults) {
    this.configParser = configParser;
    this.catalog = catalog;
    this.client = client;
    this.registry = registry;
    this.objectMapper = objectMapper;
    this.progressInterval = Duration.ofMillis(defaults.getProgressIntervalMs());
  }

  @Override
  public void validate(LoadRun run) {
    configParser.parse(run.getOptions());
  }

  @Override
  public RunVerdict execute(LoadRun run) {
    Objects.requireNonNull(run, "Run must not be null");
    var runId = run.getId();
    var config = configParser.parse(run.getOptions());

    var driver = new LoadDriver(runId, client, progressInterval);
    drivers.put(runId, driver);
    if (pendingCancellations.remove(runId)) {
      driver.cancel();
    }
    registry.register(runId, driver.getCollector());

    try {
      var verdict = driver.execute(config, catalog);
      registry.saveVerdict(runId, verdict);
      logVerdict(runId, verdict);
      return verdict;
    } finally {
      registry.complete(runId, driver.getCollector().snapshot());
      drivers.remove(runId);
    }
  }

  @Override
  public void cancel(UUID runId) {
    var driver = drivers.get(runId);
    if (driver == null) {
      pendingCancellations.add(runId);
      // execute may have registered its driver in between
      driver = drivers.get(runId);
      if (driver == null) {
        return;
      }
    }
    driver.cancel();
  }

  @Override
  public void forget(UUID runId) {
    pendingCancellations.remove(runId);
    registry.evict(runId);
  }

  private void logVerdict(UUID runId, RunVerdict verdict) {
    try {
      log.info("Run {} verdict:\n{}", runId, objectMapper.writeValueAsString(verdict));
    } catch (JsonProcessingException e) {
      log.info("Run {} verdict (unformatted): {}", runId, verdict);
    }
  }
}
