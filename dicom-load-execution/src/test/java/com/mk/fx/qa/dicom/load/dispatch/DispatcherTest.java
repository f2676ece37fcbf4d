package com.mk.fx.qa.dicom.load.dispatch;

import static org.junit.jupiter.api.Assertions.*;

import com.mk.fx.qa.dicom.load.catalog.PayloadDescriptor;
import com.mk.fx.qa.dicom.load.cstore.DicomTarget;
import com.mk.fx.qa.dicom.load.cstore.OutcomeKind;
import com.mk.fx.qa.dicom.load.cstore.SendResult;
import com.mk.fx.qa.dicom.load.driver.LoadConfig;
import com.mk.fx.qa.dicom.load.metrics.MetricsCollector;
import java.net.ConnectException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class DispatcherTest {

  private static final DicomTarget TARGET = new DicomTarget("localhost", 11112, "ARCHIVE", "PERF_SENDER");

  private static final List<PayloadDescriptor> PAYLOADS =
      List.of(payload("p0.dcm"), payload("p1.dcm"), payload("p2.dcm"));

  private final MetricsCollector collector = new MetricsCollector(UUID.randomUUID());

  private static PayloadDescriptor payload(String name) {
    return new PayloadDescriptor(Path.of(name), 1024, "CT", null, null, null, null);
  }

  private static LoadConfig config(int concurrency, int retryCount, Duration timeout) {
    return LoadConfig.builder()
        .target(TARGET)
        .targetRate(1000)
        .concurrency(concurrency)
        .totalCount(1L)
        .timeout(timeout)
        .retryCount(retryCount)
        .maxErrorRate(0.0)
        .maxP95LatencyMs(2000)
        .build();
  }

  private DispatchResult run(ScriptedProtocolClient client, LoadConfig config, RunControl control)
      throws InterruptedException {
    return new Dispatcher(client, AdmissionGate.open()).run(PAYLOADS, config, collector, control);
  }

  @Test
  void run_twoNetworkErrorsThenSuccess_recordsOneSuccessWithCumulativeLatency() throws Exception {
    var client =
        new ScriptedProtocolClient(30)
            .then(SendResult.networkError("Connection reset"))
            .then(SendResult.networkError("Connection reset"))
            .then(SendResult.success());

    var result = run(client, config(1, 2, Duration.ofSeconds(5)), RunControl.forCount(1));

    assertEquals(1, result.recorded());
    assertEquals(3, client.calls());
    var outcomes = collector.outcomes();
    assertEquals(1, outcomes.size());
    var outcome = outcomes.get(0);
    assertEquals(OutcomeKind.SUCCESS, outcome.kind());
    assertEquals(3, outcome.attempts());
    assertTrue(outcome.latencyMs() >= 90, "latency was " + outcome.latencyMs());
    assertNull(outcome.detail());
  }

  @Test
  void run_protocolRejected_isNeverRetried() throws Exception {
    var client = new ScriptedProtocolClient(0).otherwise(SendResult.rejected(0xA700, "Out of resources"));

    run(client, config(1, 3, Duration.ofSeconds(5)), RunControl.forCount(1));

    assertEquals(1, client.calls());
    var outcome = collector.outcomes().get(0);
    assertEquals(OutcomeKind.PROTOCOL_REJECTED, outcome.kind());
    assertEquals(1, outcome.attempts());
    assertEquals("Out of resources", outcome.detail());
    assertEquals(Integer.valueOf(0xA700), outcome.status());
    assertEquals(1, collector.snapshot().failed());
  }

  @Test
  void run_retryBudgetExhausted_recordsLastFailure() throws Exception {
    var client = new ScriptedProtocolClient(0).otherwise(SendResult.networkError("Connection refused"));

    run(client, config(1, 2, Duration.ofSeconds(5)), RunControl.forCount(1));

    assertEquals(3, client.calls());
    var outcome = collector.outcomes().get(0);
    assertEquals(OutcomeKind.NETWORK_ERROR, outcome.kind());
    assertEquals(3, outcome.attempts());
  }

  @Test
  void run_slowClient_recordsTimeoutAfterEachAttempt() throws Exception {
    var client = new ScriptedProtocolClient(1_000);

    run(client, config(1, 1, Duration.ofMillis(50)), RunControl.forCount(1));

    var outcome = collector.outcomes().get(0);
    assertEquals(OutcomeKind.TIMEOUT, outcome.kind());
    assertEquals(2, outcome.attempts());
    assertTrue(outcome.latencyMs() >= 100, "latency was " + outcome.latencyMs());
    assertTrue(outcome.latencyMs() < 1_000, "latency was " + outcome.latencyMs());
  }

  @Test
  void run_clientThrows_classifiedAsNetworkError() throws Exception {
    var client =
        new ScriptedProtocolClient(0)
            .thenThrow(new UncheckedIOException(new ConnectException("Connection refused")));

    run(client, config(1, 0, Duration.ofSeconds(5)), RunControl.forCount(1));

    var outcome = collector.outcomes().get(0);
    assertEquals(OutcomeKind.NETWORK_ERROR, outcome.kind());
    assertTrue(outcome.detail().startsWith("CONNECTION_REFUSED"), outcome.detail());
  }

  @Test
  void run_budgetLargerThanPayloads_cyclesThroughThem() throws Exception {
    var client = new ScriptedProtocolClient(0);

    var result = run(client, config(1, 0, Duration.ofSeconds(5)), RunControl.forCount(7));

    assertEquals(7, result.launched());
    assertEquals(7, result.recorded());
    Map<Path, Long> perPayload =
        client.sentPayloads().stream()
            .collect(Collectors.groupingBy(Function.identity(), Collectors.counting()));
    assertEquals(3L, perPayload.get(Path.of("p0.dcm")));
    assertEquals(2L, perPayload.get(Path.of("p1.dcm")));
    assertEquals(2L, perPayload.get(Path.of("p2.dcm")));
  }

  @Test
  void run_concurrency_boundsInFlightSends() throws Exception {
    var client = new ScriptedProtocolClient(50);

    var result = run(client, config(4, 0, Duration.ofSeconds(5)), RunControl.forCount(16));

    assertEquals(4, result.workers());
    assertEquals(16, collector.snapshot().attempted());
    assertTrue(client.peakInFlight() <= 4, "peak was " + client.peakInFlight());
    assertTrue(client.peakInFlight() > 1, "peak was " + client.peakInFlight());
  }

  @Test
  void run_clientIgnoresInterrupts_timedOutCallsStillHoldTheirSlots() throws Exception {
    var client = new ScriptedProtocolClient(300).ignoringInterrupts();

    var result = run(client, config(2, 0, Duration.ofMillis(50)), RunControl.forCount(12));

    assertEquals(12, result.recorded());
    assertTrue(client.peakInFlight() <= 2, "peak was " + client.peakInFlight());
    assertTrue(client.calls() < 12, "calls were " + client.calls());
    assertTrue(
        collector.outcomes().stream().allMatch(o -> o.kind() == OutcomeKind.TIMEOUT),
        "expected only timeouts");
    assertTrue(collector.outcomes().stream().allMatch(o -> o.status() == null));
  }

  @Test
  void run_cancelledBeforeStart_sendsNothing() throws Exception {
    var client = new ScriptedProtocolClient(0);
    var control = RunControl.forCount(10);
    control.cancel();

    var result = run(client, config(2, 0, Duration.ofSeconds(5)), control);

    assertTrue(result.cancelled());
    assertEquals(0, result.launched());
    assertEquals(0, client.calls());
    assertEquals(0, collector.snapshot().attempted());
  }

  @Test
  void run_cancelledMidRun_recordsEveryLaunchedSendOnce() throws Exception {
    var client = new ScriptedProtocolClient(20);
    var control = RunControl.forCount(100_000);
    CompletableFuture.runAsync(
        control::cancel, CompletableFuture.delayedExecutor(200, TimeUnit.MILLISECONDS));

    var result = run(client, config(3, 0, Duration.ofSeconds(5)), control);

    assertTrue(result.cancelled());
    assertTrue(result.recorded() > 0);
    assertTrue(result.recorded() < 100_000);
    assertEquals(result.launched(), result.recorded());
    assertEquals(result.recorded(), collector.snapshot().attempted());
  }

  @Test
  void run_deadlinePassed_stopsClaiming() throws Exception {
    var client = new ScriptedProtocolClient(10);
    var control = RunControl.forDuration(100_000, Duration.ofMillis(150));

    var result = run(client, config(2, 0, Duration.ofSeconds(5)), control);

    assertFalse(result.cancelled());
    assertTrue(result.recorded() < 100_000);
    assertEquals(result.launched(), result.recorded());
  }

  @Test
  void run_emptyPayloads_throws() {
    var dispatcher = new Dispatcher(new ScriptedProtocolClient(0), AdmissionGate.open());

    assertThrows(
        IllegalArgumentException.class,
        () ->
            dispatcher.run(
                List.of(), config(1, 0, Duration.ofSeconds(1)), collector, RunControl.forCount(1)));
  }
}
