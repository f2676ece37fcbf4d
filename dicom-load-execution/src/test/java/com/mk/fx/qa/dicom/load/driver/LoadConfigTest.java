package com.mk.fx.qa.dicom.load.driver;

import static org.junit.jupiter.api.Assertions.*;

import com.mk.fx.qa.dicom.load.catalog.PayloadSelection;
import com.mk.fx.qa.dicom.load.cstore.DicomTarget;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class LoadConfigTest {

  private static LoadConfig.LoadConfigBuilder valid() {
    return LoadConfig.builder()
        .target(new DicomTarget("localhost", 11112, "ARCHIVE", "PERF_SENDER"))
        .targetRate(5)
        .concurrency(2)
        .totalCount(10L)
        .timeout(Duration.ofSeconds(1))
        .maxErrorRate(0.1)
        .maxP95LatencyMs(500);
  }

  @Test
  void build_optionalsOmitted_appliesDefaults() {
    var config = valid().build();

    assertEquals(Duration.ZERO, config.retryBackoff());
    assertEquals(PayloadSelection.all(), config.selection());
    assertFalse(config.isDurationBound());
  }

  @Test
  void build_nonPositiveRate_namesKey() {
    var ex = assertThrows(ConfigException.class, () -> valid().targetRate(0).build());
    assertEquals("targetRate", ex.getKey());
  }

  @Test
  void build_zeroConcurrency_namesKey() {
    var ex = assertThrows(ConfigException.class, () -> valid().concurrency(0).build());
    assertEquals("concurrency", ex.getKey());
  }

  @Test
  void build_errorRateAboveOne_namesKey() {
    var ex = assertThrows(ConfigException.class, () -> valid().maxErrorRate(1.5).build());
    assertEquals("maxErrorRate", ex.getKey());
  }

  @Test
  void build_missingTimeout_namesKey() {
    var ex = assertThrows(ConfigException.class, () -> valid().timeout(null).build());
    assertEquals("timeoutMs", ex.getKey());
  }

  @Test
  void build_negativeRetryCount_namesKey() {
    var ex = assertThrows(ConfigException.class, () -> valid().retryCount(-1).build());
    assertEquals("retryCount", ex.getKey());
  }

  @Test
  void build_nonPositiveSampleSize_namesKey() {
    var selection = new PayloadSelection(null, 0, PayloadSelection.DEFAULT_SEED);

    var ex = assertThrows(ConfigException.class, () -> valid().selection(selection).build());
    assertEquals("sampleSize", ex.getKey());
  }
}
