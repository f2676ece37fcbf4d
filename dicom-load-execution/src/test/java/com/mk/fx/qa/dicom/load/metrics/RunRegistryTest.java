package com.mk.fx.qa.dicom.load.metrics;

import static org.junit.jupiter.api.Assertions.*;

import com.mk.fx.qa.dicom.load.cstore.OutcomeKind;
import com.mk.fx.qa.dicom.load.driver.DriverState;
import com.mk.fx.qa.dicom.load.driver.RunVerdict;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class RunRegistryTest {

  private final RunRegistry registry = new RunRegistry();

  @Test
  void getSnapshot_activeRun_readsLiveCollector() {
    var runId = UUID.randomUUID();
    var collector = new MetricsCollector(runId);
    registry.register(runId, collector);

    var now = Instant.now();
    collector.record(new SendOutcome(runId, Path.of("a.dcm"), OutcomeKind.SUCCESS, 5, 1, now, now, null));

    assertEquals(1, registry.getSnapshot(runId).orElseThrow().attempted());
  }

  @Test
  void complete_replacesLiveCollectorWithFinalSnapshot() {
    var runId = UUID.randomUUID();
    var collector = new MetricsCollector(runId);
    registry.register(runId, collector);
    var finalSnapshot = collector.snapshot();

    registry.complete(runId, finalSnapshot);

    assertSame(finalSnapshot, registry.getSnapshot(runId).orElseThrow());
  }

  @Test
  void evict_finishedRun_dropsSnapshotAndVerdict() {
    var runId = UUID.randomUUID();
    var collector = new MetricsCollector(runId);
    registry.register(runId, collector);
    var snapshot = collector.snapshot();
    registry.complete(runId, snapshot);
    registry.saveVerdict(runId, RunVerdict.of(runId, DriverState.COMPLETED, snapshot, List.of()));

    registry.evict(runId);

    assertTrue(registry.getSnapshot(runId).isEmpty());
    assertTrue(registry.getVerdict(runId).isEmpty());
  }

  @Test
  void evict_runningRun_keepsLiveCollector() {
    var runId = UUID.randomUUID();
    registry.register(runId, new MetricsCollector(runId));

    registry.evict(runId);

    assertTrue(registry.getSnapshot(runId).isPresent());
  }

  @Test
  void lookups_unknownRun_areEmpty() {
    var runId = UUID.randomUUID();

    assertTrue(registry.getSnapshot(runId).isEmpty());
    assertTrue(registry.getVerdict(runId).isEmpty());
  }
}
