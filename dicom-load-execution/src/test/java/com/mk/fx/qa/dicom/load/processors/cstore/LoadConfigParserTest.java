package com.mk.fx.qa.dicom.load.processors.cstore;

import static org.junit.jupiter.api.Assertions.*;

import com.mk.fx.qa.dicom.load.cfg.LoadDefaultsCfg;
import com.mk.fx.qa.dicom.load.cfg.ObjectMapperConfig;
import com.mk.fx.qa.dicom.load.driver.ConfigException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class LoadConfigParserTest {

  private final LoadDefaultsCfg defaults = new LoadDefaultsCfg();
  private final LoadConfigParser parser =
      new LoadConfigParser(ObjectMapperConfig.create(), defaults);

  private static Map<String, Object> options() {
    Map<String, Object> options = new HashMap<>();
    options.put("targetHost", "pacs.local");
    options.put("targetPort", 104);
    options.put("targetIdentity", "ARCHIVE");
    options.put("targetRate", 25.0);
    options.put("concurrency", 4);
    options.put("durationSeconds", 60);
    options.put("datasetRoot", "/data/dicom");
    return options;
  }

  @Test
  void parse_completeOptions_buildsConfig() {
    var config = parser.parse(options());

    assertEquals("pacs.local", config.target().host());
    assertEquals(104, config.target().port());
    assertEquals("ARCHIVE", config.target().calledAeTitle());
    assertEquals(25.0, config.targetRate());
    assertEquals(4, config.concurrency());
    assertEquals(60, config.durationSeconds());
    assertNull(config.totalCount());
    assertEquals(Path.of("/data/dicom"), config.datasetRoot());
  }

  @Test
  void parse_optionalOptionsMissing_appliesDefaults() {
    var config = parser.parse(options());

    assertEquals(defaults.getLocalIdentity(), config.target().callingAeTitle());
    assertEquals(Duration.ofMillis(defaults.getTimeoutMs()), config.timeout());
    assertEquals(defaults.getRetryCount(), config.retryCount());
    assertEquals(Duration.ZERO, config.retryBackoff());
    assertEquals(defaults.getMaxErrorRate(), config.maxErrorRate());
    assertEquals(defaults.getMaxP95LatencyMs(), config.maxP95LatencyMs());
    assertEquals(defaults.isEchoBeforeRun(), config.echoBeforeRun());
    assertNull(config.selection().category());
    assertNull(config.selection().sampleSize());
    assertEquals(defaults.getSeed(), config.selection().seed());
  }

  @Test
  void parse_keysInOtherCase_areMatched() {
    Map<String, Object> options = new HashMap<>();
    options.put("TARGETHOST", "pacs.local");
    options.put("targetport", 11112);
    options.put("TargetIdentity", "ARCHIVE");
    options.put("targetrate", 5);
    options.put("Concurrency", 2);
    options.put("totalcount", 100);
    options.put("DATASETROOT", "/data");

    var config = parser.parse(options);

    assertEquals(11112, config.target().port());
    assertEquals(100L, config.totalCount());
    assertEquals(2, config.concurrency());
  }

  @Test
  void parse_numericStrings_areCoerced() {
    var options = options();
    options.put("targetPort", "4242");
    options.put("targetRate", "12.5");
    options.put("retryCount", "3");

    var config = parser.parse(options);

    assertEquals(4242, config.target().port());
    assertEquals(12.5, config.targetRate());
    assertEquals(3, config.retryCount());
  }

  @Test
  void parse_peakRateWithoutTargetRate_scalesByMultiplier() {
    var options = options();
    options.remove("targetRate");
    options.put("peakImagesPerSecond", 10);
    options.put("loadMultiplier", 2.5);

    assertEquals(25.0, parser.parse(options).targetRate(), 1e-9);
  }

  @Test
  void parse_peakRateWithoutMultiplier_usesDefaultMultiplier() {
    var options = options();
    options.remove("targetRate");
    options.put("peakImagesPerSecond", 10);

    assertEquals(10 * defaults.getLoadMultiplier(), parser.parse(options).targetRate(), 1e-9);
  }

  @Test
  void parse_missingRequiredOption_namesIt() {
    for (String key : new String[] {"targetHost", "targetPort", "targetIdentity", "concurrency", "datasetRoot", "targetRate"}) {
      var options = options();
      options.remove(key);

      var ex = assertThrows(ConfigException.class, () -> parser.parse(options), key);
      assertEquals(key, ex.getKey());
      assertTrue(ex.getMessage().contains(key));
    }
  }

  @Test
  void parse_blankHost_isMissing() {
    var options = options();
    options.put("targetHost", "   ");

    var ex = assertThrows(ConfigException.class, () -> parser.parse(options));
    assertEquals("targetHost", ex.getKey());
  }

  @Test
  void parse_malformedValue_namesItsKey() {
    var options = options();
    options.put("concurrency", "lots");

    var ex = assertThrows(ConfigException.class, () -> parser.parse(options));
    assertEquals("concurrency", ex.getKey());
    assertTrue(ex.getMessage().contains("lots"));
  }

  @Test
  void parse_nonPositiveRate_isRejected() {
    var options = options();
    options.put("targetRate", 0);

    var ex = assertThrows(ConfigException.class, () -> parser.parse(options));
    assertEquals("targetRate", ex.getKey());
  }

  @Test
  void parse_unknownOptions_areIgnored() {
    var options = options();
    options.put("colour", "blue");

    assertDoesNotThrow(() -> parser.parse(options));
  }

  @Test
  void parse_selectionOptions_arePassedThrough() {
    var options = options();
    options.put("category", "CT");
    options.put("sampleSize", 3);
    options.put("seed", 7);

    var selection = parser.parse(options).selection();

    assertEquals("CT", selection.category());
    assertEquals(3, selection.sampleSize());
    assertEquals(7L, selection.seed());
  }

  @Test
  void parse_nonPositiveSampleSize_namesIt() {
    for (int sampleSize : new int[] {0, -1}) {
      var options = options();
      options.put("sampleSize", sampleSize);

      var ex = assertThrows(ConfigException.class, () -> parser.parse(options));
      assertEquals("sampleSize", ex.getKey());
    }
  }

  @Test
  void parse_noStopCondition_isRejected() {
    var options = options();
    options.remove("durationSeconds");

    var ex = assertThrows(ConfigException.class, () -> parser.parse(options));
    assertTrue(ex.getMessage().contains("durationSeconds"), ex.getMessage());
  }

  @Test
  void parse_bothStopConditions_isRejected() {
    var options = options();
    options.put("totalCount", 100);

    var ex = assertThrows(ConfigException.class, () -> parser.parse(options));
    assertTrue(ex.getMessage().contains("mutually exclusive"), ex.getMessage());
  }

  @Test
  void parse_zeroTotalCount_namesIt() {
    var options = options();
    options.remove("durationSeconds");
    options.put("totalCount", 0);

    var ex = assertThrows(ConfigException.class, () -> parser.parse(options));
    assertEquals("totalCount", ex.getKey());
  }
}
